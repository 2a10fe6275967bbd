package naturaldate.domain.extract;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AtClauseTimeRuleTest {
    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 1, 15, 9, 20, 0, 0, ZoneOffset.UTC);

    private final AtClauseTimeRule rule = new AtClauseTimeRule();

    private DateTimeFields apply(final String text) {
        final DateTimeFields fields = DateTimeFields.from(NOW);
        rule.apply(new ExtractionInput(text, NOW), fields);
        return fields;
    }

    @Test
    void testHourOnly() {
        final DateTimeFields fields = apply("at 7");

        assertEquals(7, fields.getHour());
        assertEquals(0, fields.getMinute());
    }

    @Test
    void testHourMinuteSecond() {
        final DateTimeFields fields = apply("friday at 10:15:30");

        assertEquals(10, fields.getHour());
        assertEquals(15, fields.getMinute());
        assertEquals(30, fields.getSecond());
    }

    @Test
    void testDigitRunsAreSplitInTwo() {
        final DateTimeFields fields = apply("at 2025");

        assertEquals(20, fields.getHour());
        assertEquals(25, fields.getMinute());
    }

    @Test
    void testAtInsideWord() {
        final DateTimeFields fields = apply("chat 5 12");

        assertEquals(5, fields.getHour());
        assertEquals(12, fields.getMinute());
    }

    @Test
    void testNoAtLeavesFields() {
        final DateTimeFields fields = apply("10:15");

        assertEquals(9, fields.getHour());
        assertEquals(0, fields.getMinute());
    }
}
