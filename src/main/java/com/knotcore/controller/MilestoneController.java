package com.knotcore.controller;

import com.knotcore.model.dto.MilestoneRequest;
import com.knotcore.model.dto.MilestoneResponse;
import com.knotcore.service.MilestoneService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Controller for milestone management.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class MilestoneController {

    private final MilestoneService milestoneService;

    @PostMapping("/vaults/{vaultId}/milestones")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<MilestoneResponse> createMilestone(
            @PathVariable UUID vaultId,
            @Valid @RequestBody MilestoneRequest request) {
        return milestoneService.create(vaultId, request);
    }

    @GetMapping("/vaults/{vaultId}/milestones")
    public Flux<MilestoneResponse> listMilestones(@PathVariable UUID vaultId) {
        return milestoneService.list(vaultId);
    }

    @PutMapping("/milestones/{milestoneId}")
    public Mono<MilestoneResponse> updateMilestone(
            @PathVariable UUID milestoneId,
            @Valid @RequestBody MilestoneRequest request) {
        return milestoneService.update(milestoneId, request);
    }

    @DeleteMapping("/milestones/{milestoneId}")
    public Mono<Map<String, Boolean>> deleteMilestone(@PathVariable UUID milestoneId) {
        return milestoneService.delete(milestoneId)
                .thenReturn(Map.of("deleted", true));
    }
}
