package naturaldate.domain.extract;

import java.time.OffsetDateTime;

/**
 * The translated expression and the instant it is relative to (in UTC).
 *
 * @param text The translated string
 * @param now  The current instant
 */
public record ExtractionInput(String text, OffsetDateTime now) {
    public static final String AT = "at";

    /**
     * The first occurrence of "at" anywhere in the text, including inside other words.
     */
    public int atIndex() {
        return text.indexOf(AT);
    }

    public boolean hasAt() {
        return atIndex() != -1;
    }

    /**
     * @return The text before "at", or the whole text if there is no "at"
     */
    public String beforeAt() {
        return hasAt() ? text.substring(0, atIndex()) : text;
    }

    /**
     * @return The text after "at", or an empty string if there is no "at"
     */
    public String afterAt() {
        return hasAt() ? text.substring(atIndex() + AT.length()) : "";
    }
}
