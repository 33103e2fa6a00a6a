package com.knotcore.service.scheduling;

import com.knotcore.model.domain.QuietHours;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Computes when a reminder is delivered: the send hour, L days before the occurrence, in the
 * recipient's zone, pushed out of quiet hours.
 */
@Component
public class DeliveryTimeCalculator {

    private final int sendHour;

    public DeliveryTimeCalculator(@Value("${knot.scheduler.send-hour:9}") int sendHour) {
        if (sendHour < 0 || sendHour > 23) {
            throw new IllegalArgumentException("Send hour must be between 0 and 23, got " + sendHour);
        }
        this.sendHour = sendHour;
    }

    public Instant deliveryInstant(LocalDate occurrence, int leadDays, ZoneId zone, QuietHours quietHours) {
        ZonedDateTime target = ZonedDateTime.of(occurrence.minusDays(leadDays), LocalTime.of(sendHour, 0), zone);
        return quietHours.shiftOut(target).toInstant();
    }

    /**
     * Earliest instant at or after {@code now} outside quiet hours.
     */
    public Instant nextAllowed(Instant now, ZoneId zone, QuietHours quietHours) {
        return quietHours.shiftOut(now.atZone(zone)).toInstant();
    }
}
