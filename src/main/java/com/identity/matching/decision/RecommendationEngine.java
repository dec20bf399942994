package com.identity.matching.decision;

import com.identity.matching.core.model.FieldVerdict;
import com.identity.matching.core.model.FieldVerdicts;
import com.identity.matching.core.model.RecommendationTier;

/**
 * Fuses the per-field verdicts of a pairing into a {@link RecommendationTier}.
 *
 * <p>Only populated fields take part: the name always, the email and phone only
 * when the local record has them. The first rule that applies wins:</p>
 * <ol>
 *   <li>name NO_MATCH: NO_MATCH</li>
 *   <li>no populated field NO_MATCH and at least one PERFECT: MATCH</li>
 *   <li>at least two populated fields PERFECT: MATCH</li>
 *   <li>name PERFECT and another populated field CLOSE or PERFECT: REVIEW</li>
 *   <li>name CLOSE and another populated field PERFECT: REVIEW</li>
 *   <li>name CLOSE and another populated field CLOSE: REVIEW</li>
 *   <li>otherwise: NO_MATCH</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class RecommendationEngine {

    public RecommendationTier recommend(FieldVerdicts verdicts) {
        FieldVerdict name = verdicts.name();
        if (name == FieldVerdict.NO_MATCH) {
            return RecommendationTier.NO_MATCH;
        }

        int perfect = 0;
        int noMatch = 0;
        for (FieldVerdict verdict : populated(verdicts)) {
            if (verdict == FieldVerdict.PERFECT) {
                perfect++;
            } else if (verdict == FieldVerdict.NO_MATCH) {
                noMatch++;
            }
        }

        if (noMatch == 0 && perfect >= 1) {
            return RecommendationTier.MATCH;
        }
        if (perfect >= 2) {
            return RecommendationTier.MATCH;
        }

        FieldVerdict bestOther = bestOtherField(verdicts);
        if (name == FieldVerdict.PERFECT && bestOther.isAtLeast(FieldVerdict.CLOSE)) {
            return RecommendationTier.REVIEW;
        }
        if (name == FieldVerdict.CLOSE && bestOther.isAtLeast(FieldVerdict.CLOSE)) {
            return RecommendationTier.REVIEW;
        }
        return RecommendationTier.NO_MATCH;
    }

    public RecommendationTier recommend(FieldVerdict name, FieldVerdict email, FieldVerdict phone,
                                        boolean emailPresent, boolean phonePresent) {
        return recommend(new FieldVerdicts(name, email, phone, emailPresent, phonePresent));
    }

    private FieldVerdict[] populated(FieldVerdicts verdicts) {
        if (verdicts.emailPresent() && verdicts.phonePresent()) {
            return new FieldVerdict[]{verdicts.name(), verdicts.email(), verdicts.phone()};
        }
        if (verdicts.emailPresent()) {
            return new FieldVerdict[]{verdicts.name(), verdicts.email()};
        }
        if (verdicts.phonePresent()) {
            return new FieldVerdict[]{verdicts.name(), verdicts.phone()};
        }
        return new FieldVerdict[]{verdicts.name()};
    }

    // absent fields are already NO_MATCH in FieldVerdicts
    private FieldVerdict bestOtherField(FieldVerdicts verdicts) {
        return FieldVerdict.best(verdicts.email(), verdicts.phone());
    }
}
