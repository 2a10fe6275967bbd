package naturaldate.domain.normalize;

import java.time.LocalDate;

/**
 * Turns a year, month and possibly out of range day of the month into a valid date.
 */
public interface DateNormalizer {
    /**
     * @return The name used to select this normalizer with the nd.normalizer.policy setting
     */
    String getPolicy();

    /**
     * @param year  The year
     * @param month The month, which must be between 1 and 12
     * @param day   The day of the month, which may be outside the month
     * @return The normalized date
     * @throws java.time.DateTimeException if the month or year is out of range
     */
    LocalDate normalize(int year, int month, int day);
}
