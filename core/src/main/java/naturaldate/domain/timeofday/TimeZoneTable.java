package naturaldate.domain.timeofday;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Time zone abbreviations with a fixed whole-hour offset. There is no daylight saving logic, summer
 * abbreviations are separate entries.
 */
public final class TimeZoneTable {
    public static final Map<String, Integer> ENTRIES;

    static {
        final Map<String, Integer> entries = new LinkedHashMap<>();
        entries.put("utc", 0);
        entries.put("gmt", 0);
        entries.put("pst", -8);
        entries.put("pdt", -7);
        entries.put("mst", -7);
        entries.put("mdt", -6);
        entries.put("cst", -6);
        entries.put("cdt", -5);
        entries.put("est", -5);
        entries.put("edt", -4);
        entries.put("bst", 1);
        entries.put("cet", 1);
        entries.put("cest", 2);
        entries.put("eet", 2);
        entries.put("eest", 3);
        entries.put("msk", 3);
        entries.put("jst", 9);
        entries.put("aest", 10);
        entries.put("aedt", 11);
        ENTRIES = Collections.unmodifiableMap(entries);
    }

    private TimeZoneTable() {
    }
}
