package com.transitgate.domain.dataset.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Time of day on a service day, counted from midnight.
 * Timetables legitimately run past midnight ("25:10:00"), so hours are not capped at 23.
 *
 * @param secondsAfterMidnight seconds since the start of the service day, never negative
 */
public record ServiceTime(int secondsAfterMidnight) implements Comparable<ServiceTime> {

    private static final Pattern TIME_PATTERN = Pattern.compile("(\\d{1,2}):([0-5]\\d)(?::([0-5]\\d))?");

    public ServiceTime {
        if (secondsAfterMidnight < 0) {
            throw new IllegalArgumentException("Service time cannot be negative: " + secondsAfterMidnight);
        }
    }

    /**
     * Parse {@code H:mm} or {@code H:mm:ss}.
     *
     * @return the parsed time, or empty if the text is not a service time
     */
    public static Optional<ServiceTime> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = TIME_PATTERN.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        int hours = Integer.parseInt(m.group(1));
        int minutes = Integer.parseInt(m.group(2));
        int seconds = m.group(3) != null ? Integer.parseInt(m.group(3)) : 0;
        return Optional.of(new ServiceTime(hours * 3600 + minutes * 60 + seconds));
    }

    @Override
    public int compareTo(ServiceTime other) {
        return Integer.compare(secondsAfterMidnight, other.secondsAfterMidnight);
    }

    @Override
    public String toString() {
        int hours = secondsAfterMidnight / 3600;
        int minutes = (secondsAfterMidnight % 3600) / 60;
        int seconds = secondsAfterMidnight % 60;
        return String.format("%02d:%02d:%02d", hours, minutes, seconds);
    }
}
