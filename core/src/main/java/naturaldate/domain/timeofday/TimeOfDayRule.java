package naturaldate.domain.timeofday;

import naturaldate.domain.extract.DateTimeFields;
import naturaldate.domain.extract.ExtractionInput;
import naturaldate.domain.extract.ExtractionRule;

import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default times for parts of the day. "afternoon" contains "noon" and "midnight" contains "night",
 * so the longer keyword is checked later and wins.
 */
public class TimeOfDayRule implements ExtractionRule {
    private static final Map<String, LocalTime> TIMES_OF_DAY;

    static {
        final Map<String, LocalTime> times = new LinkedHashMap<>();
        times.put("morning", LocalTime.of(8, 0));
        times.put("noon", LocalTime.NOON);
        times.put("afternoon", LocalTime.of(14, 0));
        times.put("evening", LocalTime.of(18, 0));
        times.put("night", LocalTime.of(22, 0));
        times.put("midnight", LocalTime.MIDNIGHT);
        TIMES_OF_DAY = Collections.unmodifiableMap(times);
    }

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        TIMES_OF_DAY.forEach((keyword, time) -> {
            if (input.text().contains(keyword)) {
                fields.setTime(time.getHour(), time.getMinute(), time.getSecond());
            }
        });
    }
}
