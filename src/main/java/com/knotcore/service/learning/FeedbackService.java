package com.knotcore.service.learning;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.exception.ValidationException;
import com.knotcore.model.dto.FeedbackRequest;
import com.knotcore.model.dto.FeedbackResponse;
import com.knotcore.model.entity.Feedback;
import com.knotcore.model.enums.FeedbackAction;
import com.knotcore.repository.FeedbackRepository;
import com.knotcore.repository.RecommendationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Appends feedback events. Has no synchronous effect on scoring; the learner picks events up on its next run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    private final FeedbackRepository feedbackRepository;
    private final RecommendationRepository recommendationRepository;
    private final Clock clock;

    /**
     * Record feedback on a recommendation.
     *
     * @param recommendationId Recommendation ID
     * @param request Feedback request
     * @return Stored feedback
     */
    public Mono<FeedbackResponse> record(UUID recommendationId, FeedbackRequest request) {
        return Mono.defer(() -> {
                    validate(request);
                    return recommendationRepository.existsById(recommendationId);
                })
                .flatMap(exists -> {
                    if (!exists) {
                        return Mono.error(new ResourceNotFoundException("Recommendation", recommendationId));
                    }
                    return append(recommendationId, request.getUserId(), request.getAction(),
                            request.getRating(), request.getText());
                })
                .map(FeedbackResponse::from);
    }

    /**
     * Append an event without request validation, for internal callers.
     */
    public Mono<Feedback> append(UUID recommendationId, UUID userId, FeedbackAction action, Integer rating, String text) {
        Feedback feedback = Feedback.builder()
                .recommendationId(recommendationId)
                .userId(userId)
                .action(action)
                .rating(rating)
                .text(text)
                .createdAt(clock.instant())
                .build();
        return feedbackRepository.save(feedback)
                .doOnNext(saved -> log.debug("Recorded {} feedback on recommendation {}", action, recommendationId));
    }

    private static void validate(FeedbackRequest request) {
        Integer rating = request.getRating();
        if (request.getAction() == FeedbackAction.RATED && rating == null) {
            throw new ValidationException("A rating is required for RATED feedback");
        }
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new ValidationException("rating", rating, "must be between 1 and 5");
        }
    }
}
