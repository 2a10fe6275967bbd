package naturaldate.domain.translate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.logging.Logger;

/**
 * Provides a way to select the keyword translator based on the configured matching mode.
 */
@ApplicationScoped
public class KeywordTranslatorSelector {

    @Inject
    @ConfigProperty(name = "nd.translator.matching", defaultValue = WordBoundaryKeywordTranslator.MATCHING)
    private String matching;

    @Inject
    @Any
    private Instance<KeywordTranslator> translators;

    @Inject
    private WordBoundaryKeywordTranslator wordBoundaryKeywordTranslator;

    @Inject
    private Logger logger;

    public KeywordTranslator getKeywordTranslator() {
        return getKeywordTranslator(matching);
    }

    public KeywordTranslator getKeywordTranslator(final String matching) {
        return translators.stream()
                .filter(t -> t.getMatching().equalsIgnoreCase(matching.trim()))
                .findFirst()
                .orElseGet(() -> {
                    logger.warning("Unknown keyword matching mode \"" + matching + "\", using " + WordBoundaryKeywordTranslator.MATCHING);
                    return wordBoundaryKeywordTranslator;
                });
    }
}
