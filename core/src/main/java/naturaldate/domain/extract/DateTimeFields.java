package naturaldate.domain.extract;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The date and time fields collected while the extraction rules run. Values may be out of range until
 * the date normalizer has run; each rule overwrites the fields it sets.
 */
public class DateTimeFields {
    private int year;
    private int month;
    private int day;
    private int hour;
    private int minute;
    private int second;
    private int utcOffsetHours;

    /**
     * Start from the current date and hour in UTC, with minute and second set to zero.
     */
    public static DateTimeFields from(final OffsetDateTime now) {
        checkNotNull(now);

        final OffsetDateTime utc = now.withOffsetSameInstant(ZoneOffset.UTC);
        final DateTimeFields fields = new DateTimeFields();
        fields.setDate(utc.getYear(), utc.getMonthValue(), utc.getDayOfMonth());
        fields.setTime(utc.getHour(), 0, 0);
        fields.setUtcOffsetHours(0);
        return fields;
    }

    public void setDate(final int year, final int month, final int day) {
        this.year = year;
        this.month = month;
        this.day = day;
    }

    public void setTime(final int hour, final int minute, final int second) {
        this.hour = hour;
        this.minute = minute;
        this.second = second;
    }

    public int getYear() {
        return year;
    }

    public void setYear(final int year) {
        this.year = year;
    }

    public int getMonth() {
        return month;
    }

    public void setMonth(final int month) {
        this.month = month;
    }

    public int getDay() {
        return day;
    }

    public void setDay(final int day) {
        this.day = day;
    }

    public int getHour() {
        return hour;
    }

    public void setHour(final int hour) {
        this.hour = hour;
    }

    public int getMinute() {
        return minute;
    }

    public void setMinute(final int minute) {
        this.minute = minute;
    }

    public int getSecond() {
        return second;
    }

    public void setSecond(final int second) {
        this.second = second;
    }

    public int getUtcOffsetHours() {
        return utcOffsetHours;
    }

    public void setUtcOffsetHours(final int utcOffsetHours) {
        this.utcOffsetHours = utcOffsetHours;
    }

    @Override
    public String toString() {
        return "DateTimeFields{" + year + "-" + month + "-" + day + " " + hour + ":" + minute + ":" + second
                + " utc" + (utcOffsetHours < 0 ? "" : "+") + utcOffsetHours + "}";
    }
}
