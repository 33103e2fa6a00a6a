package com.knotcore.model.dto;

import com.knotcore.model.enums.DevicePlatform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceTokenResponse {
    // "registered" for a first token, "updated" when one was replaced
    private String status;
    private String deviceToken;
    private DevicePlatform platform;
}
