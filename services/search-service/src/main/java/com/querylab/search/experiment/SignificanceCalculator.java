package com.querylab.search.experiment;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Two-proportion z-test with a pooled standard error.
 */
public final class SignificanceCalculator {
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private SignificanceCalculator() {
    }

    public static double twoSidedPValue(VariantStats control, VariantStats treatment) {
        long n1 = control.participants();
        long n2 = treatment.participants();
        if (n1 <= 0 || n2 <= 0) {
            return 1.0;
        }
        double p1 = control.conversionRate();
        double p2 = treatment.conversionRate();
        double pooled = (double) (control.conversions() + treatment.conversions()) / (n1 + n2);
        double se = Math.sqrt(pooled * (1.0 - pooled) * (1.0 / n1 + 1.0 / n2));
        if (se == 0.0) {
            return 1.0;
        }
        double z = (p2 - p1) / se;
        return 2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(Math.abs(z)));
    }

    public static boolean isSignificant(double pValue, double confidenceLevel) {
        return pValue < 1.0 - confidenceLevel;
    }
}
