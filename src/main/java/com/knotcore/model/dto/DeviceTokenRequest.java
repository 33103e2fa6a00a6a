package com.knotcore.model.dto;

import com.knotcore.model.enums.DevicePlatform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering the push token of the user's device.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceTokenRequest {

    @NotBlank(message = "Device token is required")
    @Size(max = 200, message = "Device token cannot exceed 200 characters")
    private String deviceToken;

    @Builder.Default
    private DevicePlatform platform = DevicePlatform.IOS;
}
