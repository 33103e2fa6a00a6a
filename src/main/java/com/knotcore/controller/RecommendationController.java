package com.knotcore.controller;

import com.knotcore.model.dto.FeedbackRequest;
import com.knotcore.model.dto.FeedbackResponse;
import com.knotcore.model.dto.RecommendationRequest;
import com.knotcore.model.dto.RecommendationResponse;
import com.knotcore.model.dto.SelectionRequest;
import com.knotcore.service.learning.FeedbackService;
import com.knotcore.service.scoring.RecommendationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for recommendations and the feedback recorded on them.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationService recommendationService;
    private final FeedbackService feedbackService;

    @PostMapping("/vaults/{vaultId}/recommendations")
    public Flux<RecommendationResponse> generateRecommendations(
            @PathVariable UUID vaultId,
            @Valid @RequestBody RecommendationRequest request) {
        return recommendationService.generate(vaultId, request);
    }

    @PostMapping("/recommendations/{recommendationId}/select")
    public Mono<RecommendationResponse> selectRecommendation(
            @PathVariable UUID recommendationId,
            @Valid @RequestBody SelectionRequest request) {
        return recommendationService.confirmSelection(recommendationId, request.getUserId());
    }

    @PostMapping("/recommendations/{recommendationId}/feedback")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<FeedbackResponse> recordFeedback(
            @PathVariable UUID recommendationId,
            @Valid @RequestBody FeedbackRequest request) {
        return feedbackService.record(recommendationId, request);
    }
}
