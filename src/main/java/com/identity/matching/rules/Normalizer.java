package com.identity.matching.rules;

/**
 * Canonicalizes free-text names, emails and phone numbers for comparison.
 * All methods are pure; null or empty input yields an empty string.
 *
 * <p>Phone numbers are treated as North American: ten digits get the "1"
 * country code, eleven digits starting with "1" are kept, and any other
 * digit count is returned as the bare digit string.</p>
 */
public class Normalizer {

    private static final String NANP_COUNTRY_CODE = "1";

    private final NormalizationEngine engine;

    public Normalizer() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public Normalizer(NormalizationEngine engine) {
        this.engine = engine;
    }

    /**
     * Lowercases, turns punctuation into spaces, collapses whitespace and trims.
     * Idempotent.
     */
    public String normalizeName(String name) {
        return engine.normalize(name, FieldType.NAME);
    }

    public String normalizeEmail(String email) {
        return engine.normalize(email, FieldType.EMAIL);
    }

    public String normalizePhone(String phone) {
        String digits = engine.normalize(phone, FieldType.PHONE);
        if (digits.length() == 10) {
            return NANP_COUNTRY_CODE + digits;
        }
        return digits;
    }

    /**
     * Formats a phone number for display: {@code (555) 123-4567} for ten digits,
     * {@code +1 (555) 123-4567} for eleven digits starting with 1, the input unchanged otherwise.
     */
    public String formatPhoneForDisplay(String phone) {
        if (phone == null || phone.isBlank()) {
            return "";
        }
        String digits = engine.normalize(phone, FieldType.PHONE);
        if (digits.length() == 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        if (digits.length() == 11 && digits.startsWith(NANP_COUNTRY_CODE)) {
            return "+1 (" + digits.substring(1, 4) + ") " + digits.substring(4, 7) + "-" + digits.substring(7);
        }
        return phone;
    }

    public NormalizationEngine getEngine() {
        return engine;
    }
}
