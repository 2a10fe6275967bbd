package naturaldate.domain.extract;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StructuredDateRuleTest {
    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 1, 15, 9, 20, 0, 0, ZoneOffset.UTC);

    private DateTimeFields apply(final StructuredDateRule rule, final String text) {
        final DateTimeFields fields = DateTimeFields.from(NOW);
        rule.apply(new ExtractionInput(text, NOW), fields);
        return fields;
    }

    private void assertDate(final int year, final int month, final int day, final DateTimeFields fields) {
        assertEquals(year, fields.getYear());
        assertEquals(month, fields.getMonth());
        assertEquals(day, fields.getDay());
    }

    @Test
    void testSlashIsMonthFirst() {
        assertDate(2024, 1, 31, apply(StructuredDateRule.SLASH, "01/31/2024"));
    }

    @Test
    void testShortDotKeepsYear() {
        assertDate(2025, 2, 28, apply(StructuredDateRule.SHORT_DOT, "28.02"));
    }

    @Test
    void testDot() {
        assertDate(2024, 1, 31, apply(StructuredDateRule.DOT, "31.01.2024"));
    }

    @Test
    void testReverseDot() {
        assertDate(2024, 3, 9, apply(StructuredDateRule.REVERSE_DOT, "2024.3.9"));
    }

    @Test
    void testHyphenated() {
        assertDate(2024, 12, 24, apply(StructuredDateRule.HYPHENATED, "2024-12-24"));
    }

    @Test
    void testReverseHyphenated() {
        assertDate(2024, 12, 24, apply(StructuredDateRule.REVERSE_HYPHENATED, "24-12-2024"));
    }

    @Test
    void testFirstMatchOnly() {
        assertDate(2024, 12, 24, apply(StructuredDateRule.HYPHENATED, "2024-12-24 or 2023-11-23"));
    }

    @Test
    void testNoMatchLeavesFields() {
        assertDate(2025, 1, 15, apply(StructuredDateRule.SLASH, "31.01.2024"));
    }

    @Test
    void testApplicationOrder() {
        assertEquals(
                List.of(StructuredDateRule.SLASH,
                        StructuredDateRule.SHORT_DOT,
                        StructuredDateRule.DOT,
                        StructuredDateRule.REVERSE_DOT,
                        StructuredDateRule.HYPHENATED,
                        StructuredDateRule.REVERSE_HYPHENATED),
                List.of(StructuredDateRule.values()));
    }
}
