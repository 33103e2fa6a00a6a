package com.knotcore.controller;

import com.knotcore.model.dto.AnalysisResult;
import com.knotcore.model.dto.PreferenceWeightsResponse;
import com.knotcore.service.learning.FeedbackAnalysisService;
import com.knotcore.service.learning.PreferenceWeightsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for learned preference weights.
 */
@RestController
@RequestMapping("/v1/users/{userId}/preference-weights")
@RequiredArgsConstructor
public class PreferenceWeightsController {

    private final PreferenceWeightsService preferenceWeightsService;
    private final FeedbackAnalysisService feedbackAnalysisService;

    @GetMapping
    public Mono<PreferenceWeightsResponse> getWeights(@PathVariable UUID userId) {
        return preferenceWeightsService.getWeights(userId);
    }

    /**
     * Recompute the weights of one user now instead of waiting for the weekly run.
     */
    @PostMapping("/analyze")
    public Mono<AnalysisResult> analyze(@PathVariable UUID userId) {
        return feedbackAnalysisService.analyzeUser(userId);
    }
}
