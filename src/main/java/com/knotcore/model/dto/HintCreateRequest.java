package com.knotcore.model.dto;

import com.knotcore.model.enums.HintSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for capturing a hint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HintCreateRequest {

    @NotBlank(message = "Hint text is required")
    @Size(max = 500, message = "Hint text cannot exceed 500 characters")
    private String text;

    @Builder.Default
    private HintSource source = HintSource.TEXT_INPUT;
}
