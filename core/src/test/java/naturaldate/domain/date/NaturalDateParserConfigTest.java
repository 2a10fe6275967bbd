package naturaldate.domain.date;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import naturaldate.domain.clock.ClockProducer;
import naturaldate.domain.exceptionhandling.StandardExceptionMapping;
import naturaldate.domain.logger.Loggers;
import naturaldate.domain.normalize.ClampingDateNormalizer;
import naturaldate.domain.normalize.DateNormalizerSelector;
import naturaldate.domain.normalize.RollingDateNormalizer;
import naturaldate.domain.translate.KeywordTranslatorSelector;
import naturaldate.domain.translate.SubstringKeywordTranslator;
import naturaldate.domain.translate.WordBoundaryKeywordTranslator;
import naturaldate.domain.validate.impl.ValidateStringImpl;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Parses with the clamping normalizer, substring keyword matching and a clock fixed to Thursday 2025-01-30.
 */
@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(NaturalDateParser.class)
@AddBeanClasses(DateParserIso8601.class)
@AddBeanClasses(ExtractionPipeline.class)
@AddBeanClasses(KeywordTranslatorSelector.class)
@AddBeanClasses(WordBoundaryKeywordTranslator.class)
@AddBeanClasses(SubstringKeywordTranslator.class)
@AddBeanClasses(DateNormalizerSelector.class)
@AddBeanClasses(RollingDateNormalizer.class)
@AddBeanClasses(ClampingDateNormalizer.class)
@AddBeanClasses(StandardExceptionMapping.class)
@AddBeanClasses(ValidateStringImpl.class)
@AddBeanClasses(ClockProducer.class)
@AddBeanClasses(Loggers.class)
class NaturalDateParserConfigTest {

    @Inject
    DateParser dateParser;

    /**
     * <a href="https://github.com/weld/weld-testing/issues/81#issuecomment-1564002983">...</a>
     */
    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of(
                        "nd.normalizer.policy", ClampingDateNormalizer.POLICY,
                        "nd.translator.matching", SubstringKeywordTranslator.MATCHING,
                        "nd.clock.fixed", "2025-01-30T12:00:00Z"),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @AfterEach
    void releaseConfig() {
        final var configProviderResolver = ConfigProviderResolver.instance();
        configProviderResolver.releaseConfig(configProviderResolver.getConfig());
    }

    @Test
    void testFixedClock() {
        assertEquals(
                OffsetDateTime.of(2025, 1, 29, 12, 0, 0, 0, ZoneOffset.UTC),
                dateParser.parseDate("yesterday"));
    }

    @Test
    void testClampsInsteadOfRolling() {
        assertEquals(
                OffsetDateTime.of(2025, 1, 31, 12, 0, 0, 0, ZoneOffset.UTC),
                dateParser.parseDate("next friday"));
    }

    @Test
    void testSubstringMatchingBreaksWeekdays() {
        // "monday" is translated to "m at nday", which no longer names a weekday
        assertEquals(
                OffsetDateTime.of(2025, 1, 30, 12, 0, 0, 0, ZoneOffset.UTC),
                dateParser.parseDate("monday"));
    }
}
