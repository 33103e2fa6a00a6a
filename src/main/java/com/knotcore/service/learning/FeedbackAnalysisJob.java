package com.knotcore.service.learning;

import com.knotcore.model.dto.AnalysisSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic recomputation of learned weights for all users.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedbackAnalysisJob {

    private final FeedbackAnalysisService feedbackAnalysisService;

    @Scheduled(cron = "${knot.learner.cron:0 0 3 * * MON}")
    public void run() {
        log.info("Running scheduled feedback analysis....");
        try {
            AnalysisSummary summary = feedbackAnalysisService.analyzeAll().block(Duration.ofMinutes(30));
            if (summary != null) {
                log.info("Feedback analysis finished: {} applied, {} rejected, {} failed",
                        summary.getApplied(), summary.getRejected(), summary.getFailed());
            }
        } catch (Exception e) {
            log.error("Feedback analysis run failed: {}", e.getMessage(), e);
        }
    }
}
