package com.identity.matching.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    void nameRulesDoNotApplyToPhones() {
        assertEquals("5551234", engine.normalize("555-1234", FieldType.PHONE));
        assertEquals("555 1234", engine.normalize("555-1234", FieldType.NAME));
    }

    @Test
    void emailHasNoRulesBeyondCaseAndWhitespace() {
        assertEquals("first.last+tag@example.org", engine.normalize(" First.Last+Tag@Example.org", FieldType.EMAIL));
    }

    @Test
    void rulesApplyInPriorityOrder() {
        NormalizationEngine custom = new NormalizationEngine(List.of(
                NormalizationRule.builder()
                        .name("strip-title")
                        .pattern("^(?i)dr ")
                        .replacement("")
                        .applicableFields(FieldType.NAME)
                        .priority(20)
                        .build(),
                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[.]")
                        .replacement(" ")
                        .applicableFields(FieldType.NAME)
                        .priority(10)
                        .build()
        ));

        assertEquals("punctuation", custom.getRules().get(0).getName());
        // "Dr.Jones" -> "Dr Jones" -> "Jones"
        assertEquals("jones", custom.normalize("Dr.Jones", FieldType.NAME));
    }

    @Test
    void removeRuleByName() {
        assertTrue(engine.removeRule("name-punctuation"));
        assertEquals("o'brien", engine.normalize("O'Brien", FieldType.NAME));
        assertFalse(engine.removeRule("name-punctuation"));
    }

    @Test
    void areEquivalentComparesNormalizedValues() {
        assertTrue(engine.areEquivalent("(555) 123-4567", "555.123.4567", FieldType.PHONE));
        assertFalse(engine.areEquivalent("John", "Jon", FieldType.NAME));
    }

    @Test
    void addingRuleWithSameNameReplacesIt() {
        engine.addRule(NormalizationRule.builder()
                .name("name-punctuation")
                .pattern("'")
                .replacement("")
                .applicableFields(FieldType.NAME)
                .build());

        assertEquals(2, engine.getRules().size());
        assertEquals("obrien", engine.normalize("O'Brien", FieldType.NAME));
    }

    @Test
    void invalidPatternIsRejectedWithRuleName() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> NormalizationRule.builder().name("broken").pattern("[a-").replacement("").build());

        assertTrue(e.getMessage().contains("broken"));
        assertThrows(IllegalArgumentException.class,
                () -> NormalizationRule.builder().name("no-pattern").replacement("").build());
    }
}
