package naturaldate.domain.extract;

import java.util.List;

/**
 * Month names and their three letter abbreviations, matched anywhere in the text. Every month is checked,
 * in calendar order, so the latest month mentioned in the calendar wins.
 */
public class MonthNameRule implements ExtractionRule {
    private static final List<List<String>> MONTH_NAMES = List.of(
            List.of("january", "jan"),
            List.of("february", "feb"),
            List.of("march", "mar"),
            List.of("april", "apr"),
            List.of("may", "may"),
            List.of("june", "jun"),
            List.of("july", "jul"),
            List.of("august", "aug"),
            List.of("september", "sep"),
            List.of("october", "oct"),
            List.of("november", "nov"),
            List.of("december", "dec"));

    @Override
    public void apply(final ExtractionInput input, final DateTimeFields fields) {
        for (int i = 0; i < MONTH_NAMES.size(); ++i) {
            if (MONTH_NAMES.get(i).stream().anyMatch(input.text()::contains)) {
                fields.setMonth(i + 1);
            }
        }
    }
}
