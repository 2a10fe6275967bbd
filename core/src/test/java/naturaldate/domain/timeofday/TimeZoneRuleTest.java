package naturaldate.domain.timeofday;

import naturaldate.domain.extract.DateTimeFields;
import naturaldate.domain.extract.ExtractionInput;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TimeZoneRuleTest {
    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 1, 15, 9, 20, 0, 0, ZoneOffset.UTC);

    private final TimeZoneRule rule = new TimeZoneRule();

    private int offset(final String text) {
        final DateTimeFields fields = DateTimeFields.from(NOW);
        rule.apply(new ExtractionInput(text, NOW), fields);
        return fields.getUtcOffsetHours();
    }

    @Test
    void testAbbreviations() {
        assertEquals(2, offset("at 10 cest"));
        assertEquals(-8, offset("at 10 pst"));
        assertEquals(11, offset("at 10 aedt"));
        assertEquals(3, offset("at 10 msk"));
    }

    @Test
    void testAbbreviationNeedsLeadingSpace() {
        assertEquals(0, offset("10pst"));
    }

    @Test
    void testLaterTableEntryWins() {
        assertEquals(2, offset("at 10 est or cest"));
    }

    @Test
    void testExplicitOffsets() {
        assertEquals(-5, offset("today 9:00 utc-5"));
        assertEquals(3, offset("today 9:00 gmt+3"));
    }

    @Test
    void testExplicitOffsetOverridesAbbreviation() {
        assertEquals(-5, offset("today 9:00 pst utc-5"));
    }

    @Test
    void testUtcOffsetOverridesGmtOffset() {
        assertEquals(1, offset("gmt+4 utc+1"));
    }

    @Test
    void testNoZone() {
        assertEquals(0, offset("tomorrow"));
    }
}
