package naturaldate.domain.extract;

/**
 * A single step of the extraction cascade. A rule that matches overwrites its fields unconditionally.
 */
@FunctionalInterface
public interface ExtractionRule {
    void apply(ExtractionInput input, DateTimeFields fields);
}
