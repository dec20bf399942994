package com.identity.matching.rules;

import java.util.List;

/**
 * Built-in rules for person names, email addresses and phone numbers.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getNameRules());
        engine.addRules(getPhoneRules());
        return engine;
    }

    /**
     * Name punctuation ("O'Brien", "Smith-Jones", "J.R.") becomes a word separator.
     */
    public static List<NormalizationRule> getNameRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("name-punctuation")
                        .pattern("[^\\w\\s]")
                        .replacement(" ")
                        .applicableFields(FieldType.NAME)
                        .priority(10)
                        .build()
        );
    }

    /**
     * Phone numbers keep their digits only. Country code handling happens in {@link Normalizer}.
     */
    public static List<NormalizationRule> getPhoneRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("phone-digits-only")
                        .pattern("\\D")
                        .replacement("")
                        .applicableFields(FieldType.PHONE)
                        .priority(10)
                        .build()
        );
    }
}
