package naturaldate.domain.relative;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weekday names in the order they are looked up. "weekend" means the coming Saturday.
 */
public final class WeekdayTable {
    public static final Map<String, DayOfWeek> ENTRIES;

    static {
        final Map<String, DayOfWeek> entries = new LinkedHashMap<>();
        entries.put("monday", DayOfWeek.MONDAY);
        entries.put("tuesday", DayOfWeek.TUESDAY);
        entries.put("wednesday", DayOfWeek.WEDNESDAY);
        entries.put("thursday", DayOfWeek.THURSDAY);
        entries.put("friday", DayOfWeek.FRIDAY);
        entries.put("saturday", DayOfWeek.SATURDAY);
        entries.put("sunday", DayOfWeek.SUNDAY);
        entries.put("weekend", DayOfWeek.SATURDAY);
        ENTRIES = Collections.unmodifiableMap(entries);
    }

    private WeekdayTable() {
    }
}
