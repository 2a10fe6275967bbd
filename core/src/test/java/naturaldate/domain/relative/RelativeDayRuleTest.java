package naturaldate.domain.relative;

import naturaldate.domain.extract.DateTimeFields;
import naturaldate.domain.extract.ExtractionInput;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RelativeDayRuleTest {
    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 1, 15, 9, 20, 0, 0, ZoneOffset.UTC);

    private final RelativeDayRule rule = new RelativeDayRule();

    private int day(final String text, final OffsetDateTime now) {
        final DateTimeFields fields = DateTimeFields.from(now);
        fields.setDay(3);
        rule.apply(new ExtractionInput(text, now), fields);
        return fields.getDay();
    }

    @Test
    void testRelativeDays() {
        assertEquals(14, day("yesterday", NOW));
        assertEquals(15, day("today", NOW));
        assertEquals(16, day("tomorrow", NOW));
    }

    @Test
    void testLaterCheckWins() {
        assertEquals(16, day("tomorrow, not yesterday", NOW));
    }

    @Test
    void testYesterdayOnTheFirst() {
        assertEquals(0, day("yesterday", OffsetDateTime.of(2025, 3, 1, 6, 0, 0, 0, ZoneOffset.UTC)));
    }

    @Test
    void testNoKeywordLeavesFields() {
        assertEquals(3, day("next week", NOW));
    }
}
