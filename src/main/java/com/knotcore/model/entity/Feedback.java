package com.knotcore.model.entity;

import com.knotcore.model.enums.FeedbackAction;
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
 * Append-only feedback event on a recommendation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("recommendation_feedback")
public class Feedback {

    @Id
    private UUID id;

    @Column("recommendation_id")
    private UUID recommendationId;

    @Column("user_id")
    private UUID userId;

    @Column("action")
    private FeedbackAction action;

    @Column("rating")
    private Integer rating;

    @Column("feedback_text")
    private String text;

    @Column("created_at")
    private Instant createdAt;
}
