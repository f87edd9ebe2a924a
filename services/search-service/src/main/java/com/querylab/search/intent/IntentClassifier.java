package com.querylab.search.intent;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class IntentClassifier {
    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private static final double LENGTH_BONUS = 0.3;

    // iteration order doubles as the tie-break order
    private static final List<IntentType> SCORED = List.of(
        IntentType.INFORMATIONAL,
        IntentType.NAVIGATIONAL,
        IntentType.TRANSACTIONAL,
        IntentType.EXPLORATORY
    );

    private static final List<IntentPattern> BUILT_IN = List.of(
        IntentPattern.of("^(how|what|why|when|where|which|who)\\b", IntentType.INFORMATIONAL, 1.5, "question_word"),
        IntentPattern.of(
            "\\b(tutorial|guide|learn|example|explain|documentation|docs)\\b",
            IntentType.INFORMATIONAL,
            1.3,
            "learning_term"
        ),
        IntentPattern.of(
            "\\b(difference between|vs|versus|compare|comparison)\\b",
            IntentType.INFORMATIONAL,
            1.2,
            "comparison"
        ),
        IntentPattern.of("\\b(best practices?|recommended|tips?)\\b", IntentType.INFORMATIONAL, 1.1, "advice_seeking"),
        new IntentPattern(Pattern.compile("\\?$"), IntentType.INFORMATIONAL, 0.8, "question_mark"),

        IntentPattern.of("^(go to|open|find|show|view)\\b", IntentType.NAVIGATIONAL, 1.5, "navigation_command"),
        IntentPattern.of(
            "\\b(page|section|menu|settings?|dashboard|profile)\\b",
            IntentType.NAVIGATIONAL,
            1.2,
            "ui_element"
        ),
        new IntentPattern(Pattern.compile("^[a-zA-Z0-9_-]+$"), IntentType.NAVIGATIONAL, 0.6, "single_term"),
        IntentPattern.of("\\b(specific|exact|named?)\\b", IntentType.NAVIGATIONAL, 1.0, "specificity"),

        IntentPattern.of(
            "^(create|add|new|make|delete|remove|update|edit|change)\\b",
            IntentType.TRANSACTIONAL,
            1.5,
            "action_verb"
        ),
        IntentPattern.of(
            "\\b(submit|save|send|post|upload|download)\\b",
            IntentType.TRANSACTIONAL,
            1.3,
            "transaction_verb"
        ),
        IntentPattern.of(
            "\\b(configure|setup|install|enable|disable)\\b",
            IntentType.TRANSACTIONAL,
            1.2,
            "configuration"
        ),

        IntentPattern.of("^(browse|explore|list|all|show all)\\b", IntentType.EXPLORATORY, 1.4, "exploration_command"),
        IntentPattern.of("\\b(related|similar|like|more)\\b", IntentType.EXPLORATORY, 1.0, "related_content"),
        IntentPattern.of("\\b(options?|choices?|alternatives?)\\b", IntentType.EXPLORATORY, 1.1, "options_seeking")
    );

    private final Map<IntentType, List<IntentPattern>> patterns = new EnumMap<>(IntentType.class);
    private final IntentType defaultIntent;
    private final double minConfidence;

    @Autowired
    public IntentClassifier(IntentProperties properties) {
        this(toPatterns(properties.getCustomPatterns()), properties.getDefaultIntent(), properties.getMinConfidence());
    }

    public IntentClassifier(List<IntentPattern> customPatterns, IntentType defaultIntent, double minConfidence) {
        this.defaultIntent = defaultIntent == null ? IntentType.INFORMATIONAL : defaultIntent;
        this.minConfidence = minConfidence;
        for (IntentType type : SCORED) {
            patterns.put(type, new ArrayList<>());
        }
        for (IntentPattern pattern : BUILT_IN) {
            patterns.get(pattern.getIntent()).add(pattern);
        }
        if (customPatterns != null) {
            for (IntentPattern pattern : customPatterns) {
                patterns.computeIfAbsent(pattern.getIntent(), key -> new ArrayList<>()).add(pattern);
            }
        }
    }

    public QueryIntent classify(String query) {
        if (query == null || query.isBlank()) {
            return QueryIntent.unknown();
        }

        String trimmed = query.strip();
        Map<IntentType, Double> scores = new EnumMap<>(IntentType.class);
        Map<IntentType, List<String>> signals = new EnumMap<>(IntentType.class);
        for (IntentType type : SCORED) {
            scores.put(type, 0.0);
            signals.put(type, new ArrayList<>());
        }

        for (Map.Entry<IntentType, List<IntentPattern>> entry : patterns.entrySet()) {
            IntentType type = entry.getKey();
            if (!scores.containsKey(type)) {
                continue;
            }
            for (IntentPattern pattern : entry.getValue()) {
                if (pattern.matches(trimmed)) {
                    scores.merge(type, pattern.getWeight(), Double::sum);
                    if (!pattern.getSignal().isEmpty()) {
                        signals.get(type).add(pattern.getSignal());
                    }
                }
            }
        }

        int wordCount = trimmed.split("\\s+").length;
        if (wordCount <= 2) {
            scores.merge(IntentType.NAVIGATIONAL, LENGTH_BONUS, Double::sum);
        } else if (wordCount >= 5) {
            scores.merge(IntentType.INFORMATIONAL, LENGTH_BONUS, Double::sum);
        }

        IntentType best = SCORED.get(0);
        double total = 0.0;
        for (IntentType type : SCORED) {
            double score = scores.get(type);
            total += score;
            if (score > scores.get(best)) {
                best = type;
            }
        }

        double bestScore = scores.get(best);
        if (bestScore < minConfidence) {
            return new QueryIntent(
                defaultIntent,
                minConfidence,
                List.of("default_fallback"),
                RankingHints.forIntent(defaultIntent)
            );
        }

        double confidence = total > 0 ? Math.min(bestScore / total, 1.0) : 0.0;
        log.debug("intent query='{}' type={} confidence={} scores={}", trimmed, best, confidence, scores);
        return new QueryIntent(best, confidence, signals.get(best), RankingHints.forIntent(best));
    }

    public IntentType getDefaultIntent() {
        return defaultIntent;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    private static List<IntentPattern> toPatterns(List<IntentProperties.CustomPattern> custom) {
        List<IntentPattern> result = new ArrayList<>();
        if (custom == null) {
            return result;
        }
        for (IntentProperties.CustomPattern pattern : custom) {
            if (pattern.getIntent() == null || pattern.getRegex() == null || pattern.getRegex().isBlank()) {
                continue;
            }
            result.add(IntentPattern.of(pattern.getRegex(), pattern.getIntent(), pattern.getWeight(), pattern.getSignal()));
        }
        return result;
    }
}
