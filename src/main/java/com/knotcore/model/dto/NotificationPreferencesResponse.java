package com.knotcore.model.dto;

import com.knotcore.model.entity.UserAccount;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreferencesResponse {
    private UUID userId;
    private boolean notificationsEnabled;
    private int quietHoursStart;
    private int quietHoursEnd;
    private String timezone;

    public static NotificationPreferencesResponse from(UserAccount user) {
        return NotificationPreferencesResponse.builder()
                .userId(user.getId())
                .notificationsEnabled(user.isNotificationsEnabled())
                .quietHoursStart(user.getQuietHoursStart())
                .quietHoursEnd(user.getQuietHoursEnd())
                .timezone(user.getTimezone())
                .build();
    }
}
