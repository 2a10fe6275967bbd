package naturaldate.domain.normalize;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.logging.Logger;

/**
 * Provides a way to select the date normalizer based on the configured policy.
 */
@ApplicationScoped
public class DateNormalizerSelector {

    @Inject
    @ConfigProperty(name = "nd.normalizer.policy", defaultValue = RollingDateNormalizer.POLICY)
    private String policy;

    @Inject
    @Any
    private Instance<DateNormalizer> normalizers;

    @Inject
    private RollingDateNormalizer rollingDateNormalizer;

    @Inject
    private Logger logger;

    public DateNormalizer getDateNormalizer() {
        return getDateNormalizer(policy);
    }

    public DateNormalizer getDateNormalizer(final String policy) {
        return normalizers.stream()
                .filter(n -> n.getPolicy().equalsIgnoreCase(policy.trim()))
                .findFirst()
                .orElseGet(() -> {
                    logger.warning("Unknown normalizer policy \"" + policy + "\", using " + RollingDateNormalizer.POLICY);
                    return rollingDateNormalizer;
                });
    }
}
