package com.knotcore.model.domain;

import com.knotcore.model.entity.UserAccount;
import com.knotcore.model.entity.Vault;
import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;

/**
 * Recipient of a milestone's notifications with its resolved zone and quiet hours.
 */
@Value
@Builder
public class DeliveryTarget {
    UserAccount user;
    Vault vault;
    ZoneId zone;
    QuietHours quietHours;
}
