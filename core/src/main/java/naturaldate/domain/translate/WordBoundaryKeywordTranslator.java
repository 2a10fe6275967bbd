package naturaldate.domain.translate;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replaces keywords only where they appear as whole words. All keys are combined into a single alternation,
 * so at any position the key declared first wins.
 */
@ApplicationScoped
public class WordBoundaryKeywordTranslator implements KeywordTranslator {
    public static final String MATCHING = "word";

    private static final Pattern KEYWORD_PATTERN = Pattern.compile(
            KeywordTable.ENTRIES.keySet().stream()
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|", "\\b(", ")\\b")));

    @Override
    public String getMatching() {
        return MATCHING;
    }

    @Override
    public String replaceKeywords(final String text) {
        return KEYWORD_PATTERN.matcher(text)
                .replaceAll(match -> Matcher.quoteReplacement(KeywordTable.ENTRIES.get(match.group(1))));
    }
}
