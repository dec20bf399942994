package com.identity.matching.core.model;

import java.util.Objects;

/**
 * The three per-field verdicts of one pairing, together with which optional
 * local fields were populated. Email and phone verdicts are always
 * {@link FieldVerdict#NO_MATCH} when the local field is absent.
 *
 * @param name         name verdict, always computed
 * @param email        email verdict
 * @param phone        phone verdict
 * @param emailPresent whether the local record has an email
 * @param phonePresent whether the local record has a phone
 */
public record FieldVerdicts(
        FieldVerdict name,
        FieldVerdict email,
        FieldVerdict phone,
        boolean emailPresent,
        boolean phonePresent
) {
    public FieldVerdicts {
        Objects.requireNonNull(name, "name verdict is required");
        email = emailPresent && email != null ? email : FieldVerdict.NO_MATCH;
        phone = phonePresent && phone != null ? phone : FieldVerdict.NO_MATCH;
    }

    /**
     * Verdicts for a local record that has no candidate to compare against.
     */
    public static FieldVerdicts none(boolean emailPresent, boolean phonePresent) {
        return new FieldVerdicts(FieldVerdict.NO_MATCH, FieldVerdict.NO_MATCH, FieldVerdict.NO_MATCH,
                emailPresent, phonePresent);
    }

    /**
     * Sum of the verdict ranks, used to break ties between candidates of the same tier.
     */
    public int rankSum() {
        return name.rank() + email.rank() + phone.rank();
    }

    /**
     * Returns true if every populated field is {@link FieldVerdict#PERFECT}.
     */
    public boolean allPopulatedPerfect() {
        return name == FieldVerdict.PERFECT
                && (!emailPresent || email == FieldVerdict.PERFECT)
                && (!phonePresent || phone == FieldVerdict.PERFECT);
    }
}
