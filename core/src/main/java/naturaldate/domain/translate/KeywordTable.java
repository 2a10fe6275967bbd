package naturaldate.domain.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Polish tokens and their canonical English replacements. Keys are already lower-cased and transliterated.
 * Declaration order matters: it decides which key wins when keys overlap ("dzisiaj" before "dzis",
 * "polnoc" before "po").
 */
public final class KeywordTable {
    public static final Map<String, String> ENTRIES;

    static {
        final Map<String, String> entries = new LinkedHashMap<>();
        entries.put("styczen", "january");
        entries.put("luty", "february");
        entries.put("marzec", "march");
        entries.put("kwiecien", "april");
        entries.put("maj", "may");
        entries.put("czerwiec", "june");
        entries.put("lipiec", "july");
        entries.put("sierpien", "august");
        entries.put("wrzesien", "september");
        entries.put("pazdziernik", "october");
        entries.put("listopad", "november");
        entries.put("grudzien", "december");
        entries.put("poniedzialek", "monday");
        entries.put("wtorek", "tuesday");
        entries.put("sroda", "wednesday");
        entries.put("srode", "wednesday");
        entries.put("czwartek", "thursday");
        entries.put("piatek", "friday");
        entries.put("sobota", "saturday");
        entries.put("sobote", "saturday");
        entries.put("niedziela", "sunday");
        entries.put("niedziele", "sunday");
        entries.put("wczoraj", "yesterday");
        entries.put("dzisiaj", "today");
        entries.put("dzis", "today");
        entries.put("jutro", "tomorrow");
        entries.put("rano", "morning");
        entries.put("poludnie", "noon");
        entries.put("poludnia", "noon");
        entries.put("poludniu", "noon");
        entries.put("wieczor", "evening");
        entries.put("noc", "night");
        entries.put("polnoc", "midnight");
        entries.put("kolo", "at");
        entries.put("okolo", "at");
        entries.put("w okolicy", "at");
        entries.put("przed", " at ");
        entries.put("o", " at ");
        entries.put("po", " at");
        entries.put("teraz", "now");
        entries.put("ostatni", "last");
        entries.put("ostatna", "last");
        entries.put("poprzedni", "last");
        entries.put("poprzedna", "last");
        entries.put("nastepny", "next");
        entries.put("nastepna", "next");
        entries.put("przyszly", "next");
        entries.put("przyszla", "next");
        ENTRIES = Collections.unmodifiableMap(entries);
    }

    private KeywordTable() {
    }
}
