package com.knotcore.model.entity;

import com.knotcore.model.enums.DevicePlatform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * App user with delivery settings for milestone reminders.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("users")
public class UserAccount {

    @Id
    private UUID id;

    @Column("email")
    private String email;

    @Column("device_token")
    private String deviceToken;

    @Column("device_platform")
    private DevicePlatform devicePlatform;

    @Builder.Default
    @Column("notifications_enabled")
    private boolean notificationsEnabled = true;

    @Builder.Default
    @Column("quiet_hours_start")
    private int quietHoursStart = 22;

    @Builder.Default
    @Column("quiet_hours_end")
    private int quietHoursEnd = 8;

    // IANA zone id, optional
    @Column("timezone")
    private String timezone;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;
}
