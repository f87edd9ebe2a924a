package com.querylab.search.experiment;

import com.querylab.search.cache.CacheKeyUtil;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic traffic gating and variant bucketing. The hash is the first eight hex digits of the
 * MD5 of the input read as an unsigned 32-bit integer, so the same input lands in the same bucket on
 * every node.
 */
public final class VariantAssigner {
    private VariantAssigner() {
    }

    public static long hash(String value) {
        String digest = CacheKeyUtil.md5(value == null ? "" : value);
        return Long.parseLong(digest.substring(0, 8), 16);
    }

    public static boolean isInTraffic(String userId, double trafficPercentage) {
        if (trafficPercentage >= 100.0) {
            return true;
        }
        if (trafficPercentage <= 0.0) {
            return false;
        }
        return hash(userId) % 100 < trafficPercentage;
    }

    /**
     * Picks a variant for the user over the variant names in lexicographic order, or {@code null}
     * when there are none.
     */
    public static String assign(String experimentName, String userId, Collection<String> variantNames) {
        if (variantNames == null || variantNames.isEmpty()) {
            return null;
        }
        List<String> sorted = new ArrayList<>(variantNames);
        Collections.sort(sorted);
        long bucket = hash(experimentName + ":" + userId) % sorted.size();
        return sorted.get((int) bucket);
    }
}
