package com.querylab.search.intent;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier(new IntentProperties());

    @Test
    void emptyQueryIsUnknownWithZeroConfidence() {
        QueryIntent intent = classifier.classify("");

        assertThat(intent.getType()).isEqualTo(IntentType.UNKNOWN);
        assertThat(intent.getConfidence()).isZero();
        assertThat(intent.getSuggestedAdjustments().getUseDefaults()).isTrue();
    }

    @Test
    void questionIsInformational() {
        QueryIntent intent = classifier.classify("how to reset password");

        assertThat(intent.getType()).isEqualTo(IntentType.INFORMATIONAL);
        assertThat(intent.getSignals()).contains("question_word");
        assertThat(intent.getConfidence()).isEqualTo(1.0);
        assertThat(intent.isHighConfidence()).isTrue();
        assertThat(intent.getSuggestedAdjustments().getExpandSynonyms()).isTrue();
    }

    @Test
    void shortUiTermIsNavigational() {
        QueryIntent intent = classifier.classify("dashboard");

        assertThat(intent.getType()).isEqualTo(IntentType.NAVIGATIONAL);
        assertThat(intent.getSignals()).containsExactly("ui_element", "single_term");
        assertThat(intent.getSuggestedAdjustments().getLimitResults()).isEqualTo(5);
        assertThat(intent.getSuggestedAdjustments().skipsFuzzy()).isTrue();
    }

    @Test
    void leadingActionVerbIsTransactional() {
        QueryIntent intent = classifier.classify("create new api key");

        assertThat(intent.getType()).isEqualTo(IntentType.TRANSACTIONAL);
        assertThat(intent.getSignals()).containsExactly("action_verb");
        assertThat(intent.getSuggestedAdjustments().filtersActiveOnly()).isTrue();
    }

    @Test
    void browsingIsExploratory() {
        QueryIntent intent = classifier.classify("browse similar options");

        assertThat(intent.getType()).isEqualTo(IntentType.EXPLORATORY);
        assertThat(intent.getSignals()).containsExactly("exploration_command", "related_content", "options_seeking");
        assertThat(intent.getSuggestedAdjustments().increasesLimit()).isTrue();
    }

    @Test
    void weakSignalFallsBackToDefaultIntent() {
        QueryIntent intent = classifier.classify("zzzz qqqq yyyy");

        assertThat(intent.getType()).isEqualTo(IntentType.INFORMATIONAL);
        assertThat(intent.getConfidence()).isEqualTo(0.3);
        assertThat(intent.getSignals()).containsExactly("default_fallback");
    }

    @Test
    void tiesGoToTheEarlierIntent() {
        IntentClassifier custom = new IntentClassifier(
            List.of(
                IntentPattern.of("\\bgamma\\b", IntentType.TRANSACTIONAL, 1.0, "gamma"),
                IntentPattern.of("\\balpha\\b", IntentType.INFORMATIONAL, 1.0, "alpha")
            ),
            IntentType.INFORMATIONAL,
            0.3
        );

        QueryIntent intent = custom.classify("alpha beta gamma");

        assertThat(intent.getType()).isEqualTo(IntentType.INFORMATIONAL);
        assertThat(intent.getConfidence()).isEqualTo(0.5);
        assertThat(intent.isHighConfidence()).isFalse();
    }

    @Test
    void customPatternsFromPropertiesAreScored() {
        IntentProperties properties = new IntentProperties();
        IntentProperties.CustomPattern pattern = new IntentProperties.CustomPattern();
        pattern.setIntent(IntentType.TRANSACTIONAL);
        pattern.setRegex("\\b(checkout|buy)\\b");
        pattern.setWeight(2.0);
        pattern.setSignal("purchase");
        properties.setCustomPatterns(List.of(pattern));

        QueryIntent intent = new IntentClassifier(properties).classify("buy the pro plan today");

        assertThat(intent.getType()).isEqualTo(IntentType.TRANSACTIONAL);
        assertThat(intent.getSignals()).containsExactly("purchase");
    }
}
