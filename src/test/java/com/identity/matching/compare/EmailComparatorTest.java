package com.identity.matching.compare;

import com.identity.matching.api.MatchingOptions;
import com.identity.matching.core.model.FieldVerdict;
import com.identity.matching.rules.Normalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EmailComparator Tests")
class EmailComparatorTest {

    private final EmailComparator comparator = new EmailComparator(new Normalizer(), MatchingOptions.defaults());

    @ParameterizedTest(name = "{0} vs {1} -> {2}")
    @CsvSource({
            "bob@gmail.com, bob@gmail.com, PERFECT",
            "' Bob@Gmail.COM ', bob@gmail.com, PERFECT",
            "bob@gmail.con, bob@gmail.com, CLOSE",
            "bob@yahoo.com, bob@yahoo.co.uk, CLOSE",
            "alice@church.org, bob@church.org, CLOSE",
            "bob@gmail.com, bob@outlook.com, NO_MATCH",
            "bob@gmail.com, alice@outlook.com, NO_MATCH",
            "bob, bob@x.com, NO_MATCH"
    })
    void comparesSingleAddress(String local, String candidate, FieldVerdict expected) {
        assertEquals(expected, comparator.compare(local, List.of(candidate)));
    }

    @Test
    void exactMatchOnAnyAddressWins() {
        assertEquals(FieldVerdict.PERFECT,
                comparator.compare("ann@x.org", List.of("ann@x.com", "ann@x.org")));
    }

    @Test
    void noAddressesIsNoMatch() {
        assertEquals(FieldVerdict.NO_MATCH, comparator.compare("ann@x.org", List.of()));
        assertEquals(FieldVerdict.NO_MATCH, comparator.compare("", List.of("ann@x.org")));
        assertEquals(FieldVerdict.NO_MATCH, comparator.compare(null, List.of("ann@x.org")));
    }

    @Test
    void splitsAtAt() {
        EmailComparator.EmailParts parts = EmailComparator.EmailParts.of("bob@mail.example.org");

        assertEquals("bob", parts.localPart());
        assertEquals("mail.example.org", parts.domain());
        assertEquals("mail", parts.provider());
    }
}
