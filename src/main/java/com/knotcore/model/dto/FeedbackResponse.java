package com.knotcore.model.dto;

import com.knotcore.model.entity.Feedback;
import com.knotcore.model.enums.FeedbackAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackResponse {
    private UUID id;
    private UUID recommendationId;
    private FeedbackAction action;
    private Integer rating;
    private Instant createdAt;

    public static FeedbackResponse from(Feedback feedback) {
        return FeedbackResponse.builder()
                .id(feedback.getId())
                .recommendationId(feedback.getRecommendationId())
                .action(feedback.getAction())
                .rating(feedback.getRating())
                .createdAt(feedback.getCreatedAt())
                .build();
    }
}
