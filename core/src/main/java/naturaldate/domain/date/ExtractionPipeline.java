package naturaldate.domain.date;

import jakarta.enterprise.context.ApplicationScoped;
import naturaldate.domain.extract.AtClauseTimeRule;
import naturaldate.domain.extract.ClockTimeRule;
import naturaldate.domain.extract.DateTimeFields;
import naturaldate.domain.extract.DayRule;
import naturaldate.domain.extract.ExtractionInput;
import naturaldate.domain.extract.ExtractionRule;
import naturaldate.domain.extract.MonthNameRule;
import naturaldate.domain.extract.OrdinalDayRule;
import naturaldate.domain.extract.StructuredDateRule;
import naturaldate.domain.extract.YearRule;
import naturaldate.domain.relative.RelativeDayRule;
import naturaldate.domain.relative.RelativeWeekdayRule;
import naturaldate.domain.timeofday.MeridiemRule;
import naturaldate.domain.timeofday.TimeOfDayRule;
import naturaldate.domain.timeofday.TimeZoneRule;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs the extraction rules over a translated expression. The list order is the precedence: there is no
 * arbitration between rules, a later rule that matches simply overwrites what earlier rules set.
 */
@ApplicationScoped
public class ExtractionPipeline {
    public static final List<ExtractionRule> RULES = List.of(
            new YearRule(),
            new AtClauseTimeRule(),
            new DayRule(),
            new RelativeWeekdayRule(),
            StructuredDateRule.SLASH,
            StructuredDateRule.SHORT_DOT,
            StructuredDateRule.DOT,
            StructuredDateRule.REVERSE_DOT,
            StructuredDateRule.HYPHENATED,
            StructuredDateRule.REVERSE_HYPHENATED,
            new MonthNameRule(),
            new OrdinalDayRule(),
            new RelativeDayRule(),
            new TimeOfDayRule(),
            new ClockTimeRule(),
            new MeridiemRule(),
            new TimeZoneRule());

    public DateTimeFields extract(final ExtractionInput input) {
        checkNotNull(input);

        final DateTimeFields fields = DateTimeFields.from(input.now());
        RULES.forEach(rule -> rule.apply(input, fields));
        return fields;
    }
}
