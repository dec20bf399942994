package com.identity.matching.decision;

import com.identity.matching.core.model.FieldVerdict;
import com.identity.matching.core.model.FieldVerdicts;
import com.identity.matching.core.model.RecommendationTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecommendationEngine Tests")
class RecommendationEngineTest {

    private final RecommendationEngine engine = new RecommendationEngine();

    /**
     * ABSENT means the local record has no value for the field.
     */
    @ParameterizedTest(name = "name={0} email={1} phone={2} -> {3}")
    @CsvSource({
            "PERFECT, ABSENT, ABSENT, MATCH",
            "PERFECT, ABSENT, PERFECT, MATCH",
            "PERFECT, ABSENT, CLOSE, MATCH",
            "PERFECT, ABSENT, NO_MATCH, NO_MATCH",
            "PERFECT, PERFECT, ABSENT, MATCH",
            "PERFECT, PERFECT, PERFECT, MATCH",
            "PERFECT, PERFECT, CLOSE, MATCH",
            "PERFECT, PERFECT, NO_MATCH, MATCH",
            "PERFECT, CLOSE, ABSENT, MATCH",
            "PERFECT, CLOSE, PERFECT, MATCH",
            "PERFECT, CLOSE, CLOSE, MATCH",
            "PERFECT, CLOSE, NO_MATCH, REVIEW",
            "PERFECT, NO_MATCH, ABSENT, NO_MATCH",
            "PERFECT, NO_MATCH, PERFECT, MATCH",
            "PERFECT, NO_MATCH, CLOSE, REVIEW",
            "PERFECT, NO_MATCH, NO_MATCH, NO_MATCH",
            "CLOSE, ABSENT, ABSENT, NO_MATCH",
            "CLOSE, ABSENT, PERFECT, MATCH",
            "CLOSE, ABSENT, CLOSE, REVIEW",
            "CLOSE, ABSENT, NO_MATCH, NO_MATCH",
            "CLOSE, PERFECT, ABSENT, MATCH",
            "CLOSE, PERFECT, PERFECT, MATCH",
            "CLOSE, PERFECT, CLOSE, MATCH",
            "CLOSE, PERFECT, NO_MATCH, REVIEW",
            "CLOSE, CLOSE, ABSENT, REVIEW",
            "CLOSE, CLOSE, PERFECT, MATCH",
            "CLOSE, CLOSE, CLOSE, REVIEW",
            "CLOSE, CLOSE, NO_MATCH, REVIEW",
            "CLOSE, NO_MATCH, ABSENT, NO_MATCH",
            "CLOSE, NO_MATCH, PERFECT, REVIEW",
            "CLOSE, NO_MATCH, CLOSE, REVIEW",
            "CLOSE, NO_MATCH, NO_MATCH, NO_MATCH",
            "NO_MATCH, ABSENT, ABSENT, NO_MATCH",
            "NO_MATCH, ABSENT, PERFECT, NO_MATCH",
            "NO_MATCH, ABSENT, CLOSE, NO_MATCH",
            "NO_MATCH, ABSENT, NO_MATCH, NO_MATCH",
            "NO_MATCH, PERFECT, ABSENT, NO_MATCH",
            "NO_MATCH, PERFECT, PERFECT, NO_MATCH",
            "NO_MATCH, PERFECT, CLOSE, NO_MATCH",
            "NO_MATCH, PERFECT, NO_MATCH, NO_MATCH",
            "NO_MATCH, CLOSE, ABSENT, NO_MATCH",
            "NO_MATCH, CLOSE, PERFECT, NO_MATCH",
            "NO_MATCH, CLOSE, CLOSE, NO_MATCH",
            "NO_MATCH, CLOSE, NO_MATCH, NO_MATCH",
            "NO_MATCH, NO_MATCH, ABSENT, NO_MATCH",
            "NO_MATCH, NO_MATCH, PERFECT, NO_MATCH",
            "NO_MATCH, NO_MATCH, CLOSE, NO_MATCH",
            "NO_MATCH, NO_MATCH, NO_MATCH, NO_MATCH"
    })
    void fusesVerdicts(String name, String email, String phone, RecommendationTier expected) {
        boolean emailPresent = !"ABSENT".equals(email);
        boolean phonePresent = !"ABSENT".equals(phone);

        RecommendationTier tier = engine.recommend(FieldVerdict.valueOf(name),
                emailPresent ? FieldVerdict.valueOf(email) : FieldVerdict.NO_MATCH,
                phonePresent ? FieldVerdict.valueOf(phone) : FieldVerdict.NO_MATCH,
                emailPresent, phonePresent);

        assertEquals(expected, tier);
    }

    @Test
    @DisplayName("A verdict on an absent field is ignored")
    void absentFieldsDoNotCount() {
        FieldVerdicts verdicts = new FieldVerdicts(FieldVerdict.CLOSE, FieldVerdict.PERFECT, FieldVerdict.PERFECT,
                false, false);

        assertEquals(RecommendationTier.NO_MATCH, engine.recommend(verdicts));
    }

    @Test
    void nameAloneIsEnoughOnlyWhenPerfect() {
        assertEquals(RecommendationTier.MATCH,
                engine.recommend(new FieldVerdicts(FieldVerdict.PERFECT, null, null, false, false)));
        assertEquals(RecommendationTier.NO_MATCH,
                engine.recommend(new FieldVerdicts(FieldVerdict.CLOSE, null, null, false, false)));
    }
}
