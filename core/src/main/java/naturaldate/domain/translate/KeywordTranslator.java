package naturaldate.domain.translate;

import naturaldate.domain.strings.LatinCharacters;

import java.util.Locale;

/**
 * Rewrites a raw expression into the canonical English vocabulary understood by the extraction rules.
 */
public interface KeywordTranslator {
    /**
     * @return The name used to select this translator with the nd.translator.matching setting
     */
    String getMatching();

    /**
     * Replace the keyword table entries found in text that has already been normalized.
     */
    String replaceKeywords(String text);

    /**
     * Trim, lower-case and transliterate the raw expression, then replace the keywords.
     *
     * @param raw The expression as the user typed it
     * @return The translated string
     */
    default String translate(final String raw) {
        return replaceKeywords(LatinCharacters.toLatin(raw.trim().toLowerCase(Locale.ROOT)));
    }
}
