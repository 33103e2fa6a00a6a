package com.knotcore.service.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves the zone a user's notifications are computed in: the user's IANA zone if valid,
 * else the zone of the vault's US state, else the configured default.
 */
@Slf4j
@Component
public class TimeZoneResolver {

    private static final Map<String, String> STATE_ZONES = new HashMap<>();

    static {
        String eastern = "America/New_York";
        String central = "America/Chicago";
        String mountain = "America/Denver";
        String pacific = "America/Los_Angeles";
        for (String state : new String[]{"CT", "DC", "DE", "FL", "GA", "MA", "MD", "ME", "NC", "NH", "NJ", "NY",
                "OH", "PA", "RI", "SC", "VA", "VT", "WV"}) {
            STATE_ZONES.put(state, eastern);
        }
        for (String state : new String[]{"AL", "AR", "IA", "IL", "KS", "LA", "MN", "MO", "MS", "ND", "NE", "OK",
                "SD", "TX", "WI"}) {
            STATE_ZONES.put(state, central);
        }
        for (String state : new String[]{"CO", "MT", "NM", "UT", "WY", "ID"}) {
            STATE_ZONES.put(state, mountain);
        }
        for (String state : new String[]{"CA", "NV", "OR", "WA"}) {
            STATE_ZONES.put(state, pacific);
        }
        STATE_ZONES.put("AZ", "America/Phoenix");
        STATE_ZONES.put("IN", "America/Indiana/Indianapolis");
        STATE_ZONES.put("KY", "America/Kentucky/Louisville");
        STATE_ZONES.put("MI", "America/Detroit");
        STATE_ZONES.put("TN", central);
        STATE_ZONES.put("AK", "America/Anchorage");
        STATE_ZONES.put("HI", "Pacific/Honolulu");
    }

    private final ZoneId defaultZone;

    public TimeZoneResolver(@Value("${knot.scheduler.default-timezone:America/New_York}") String defaultZone) {
        this.defaultZone = ZoneId.of(defaultZone);
    }

    /**
     * @param userZone IANA zone id of the user, may be null
     * @param state Two-letter US state of the vault, may be null
     */
    public ZoneId resolve(String userZone, String state) {
        if (userZone != null && !userZone.isBlank()) {
            try {
                return ZoneId.of(userZone.trim());
            } catch (DateTimeException e) {
                log.warn("Ignoring invalid timezone '{}': {}", userZone, e.getMessage());
            }
        }
        if (state != null) {
            String zone = STATE_ZONES.get(state.trim().toUpperCase(Locale.ROOT));
            if (zone != null) {
                return ZoneId.of(zone);
            }
        }
        return defaultZone;
    }
}
