package com.knotcore.model.domain;

import com.knotcore.exception.ValidationException;
import lombok.Value;

import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Daily do-not-disturb window [start, end) in whole local hours. The window may span
 * midnight; start == end disables it.
 */
@Value
public class QuietHours {

    public static final QuietHours DEFAULT = new QuietHours(22, 8);

    int start;
    int end;

    public QuietHours(int start, int end) {
        if (start < 0 || start > 23 || end < 0 || end > 23) {
            throw new ValidationException(
                    String.format("Quiet hours must be between 0 and 23, got start=%d end=%d", start, end));
        }
        this.start = start;
        this.end = end;
    }

    public boolean isDisabled() {
        return start == end;
    }

    /**
     * Whether the given local hour falls inside the window.
     */
    public boolean contains(int hour) {
        if (isDisabled()) {
            return false;
        }
        if (start < end) {
            return hour >= start && hour < end;
        }
        return hour >= start || hour < end;
    }

    /**
     * Move a local time out of the window to the next window end. Times outside the window
     * are returned unchanged. Built with zone rules, so a quiet end inside a DST gap lands
     * on the first valid instant after it.
     *
     * @param localTime Local time in the recipient's zone
     * @return Earliest allowed local time not before {@code localTime}
     */
    public ZonedDateTime shiftOut(ZonedDateTime localTime) {
        if (!contains(localTime.getHour())) {
            return localTime;
        }
        // Before the end hour we are in the morning part of the window
        boolean sameDay = localTime.getHour() < end;
        return ZonedDateTime.of(
                sameDay ? localTime.toLocalDate() : localTime.toLocalDate().plusDays(1),
                LocalTime.of(end, 0),
                localTime.getZone());
    }
}
