package naturaldate.domain.translate;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * Replaces every occurrence of every key, one key at a time in declaration order. Short keys like "o"
 * also match inside other words, and replacements made by earlier keys are visible to later ones.
 */
@ApplicationScoped
public class SubstringKeywordTranslator implements KeywordTranslator {
    public static final String MATCHING = "substring";

    @Override
    public String getMatching() {
        return MATCHING;
    }

    @Override
    public String replaceKeywords(final String text) {
        String result = text;
        for (final Map.Entry<String, String> entry : KeywordTable.ENTRIES.entrySet()) {
            result = StringUtils.replace(result, entry.getKey(), entry.getValue());
        }
        return result;
    }
}
