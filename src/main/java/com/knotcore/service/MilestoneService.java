package com.knotcore.service;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.exception.ValidationException;
import com.knotcore.model.dto.MilestoneRequest;
import com.knotcore.model.dto.MilestoneResponse;
import com.knotcore.model.entity.Milestone;
import com.knotcore.model.enums.BudgetTier;
import com.knotcore.model.enums.Recurrence;
import com.knotcore.repository.MilestoneRepository;
import com.knotcore.service.scheduling.MilestoneChangedEvent;
import com.knotcore.service.scheduling.MilestoneEventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Service for milestone management. Every change is published to the notification scheduler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MilestoneService {

    private final MilestoneRepository milestoneRepository;
    private final VaultService vaultService;
    private final MilestoneEventHandler milestoneEventHandler;
    private final Clock clock;

    /**
     * Create a milestone and schedule its reminders.
     *
     * @param vaultId Vault ID
     * @param request Milestone request
     * @return Created milestone
     */
    @Transactional
    public Mono<MilestoneResponse> create(UUID vaultId, MilestoneRequest request) {
        return vaultService.getVault(vaultId)
                .flatMap(vault -> {
                    Instant now = clock.instant();
                    Milestone milestone = Milestone.builder()
                            .vaultId(vaultId)
                            .createdAt(now)
                            .build();
                    apply(milestone, request, now);
                    return milestoneRepository.save(milestone);
                })
                .flatMap(saved -> publish(MilestoneChangedEvent.Kind.CREATED, saved))
                .map(MilestoneResponse::from);
    }

    /**
     * Update a milestone; its pending reminders move with it.
     *
     * @param milestoneId Milestone ID
     * @param request Milestone request
     * @return Updated milestone
     */
    @Transactional
    public Mono<MilestoneResponse> update(UUID milestoneId, MilestoneRequest request) {
        return milestoneRepository.findById(milestoneId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Milestone", milestoneId)))
                .flatMap(existing -> {
                    apply(existing, request, clock.instant());
                    return milestoneRepository.save(existing);
                })
                .flatMap(saved -> publish(MilestoneChangedEvent.Kind.UPDATED, saved))
                .map(MilestoneResponse::from);
    }

    /**
     * Delete a milestone after cancelling its pending reminders.
     *
     * @param milestoneId Milestone ID
     */
    @Transactional
    public Mono<Void> delete(UUID milestoneId) {
        return milestoneRepository.findById(milestoneId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Milestone", milestoneId)))
                .flatMap(milestone -> publish(MilestoneChangedEvent.Kind.DELETED, milestone))
                .flatMap(milestoneRepository::delete);
    }

    public Flux<MilestoneResponse> list(UUID vaultId) {
        return milestoneRepository.findByVaultIdOrderByDateAsc(vaultId)
                .map(MilestoneResponse::from);
    }

    /**
     * Budget tier to store: the explicit one, else the type's default.
     */
    public static BudgetTier deriveBudgetTier(MilestoneRequest request) {
        if (request.getBudgetTier() != null) {
            return request.getBudgetTier();
        }
        BudgetTier tier = BudgetTier.defaultFor(request.getType());
        if (tier == null) {
            throw new ValidationException("budgetTier", null, request.getType() + " milestones need an explicit budget tier");
        }
        return tier;
    }

    private static void apply(Milestone milestone, MilestoneRequest request, Instant now) {
        milestone.setType(request.getType());
        milestone.setName(request.getName().trim());
        milestone.setDate(request.getDate());
        milestone.setRecurrence(request.getRecurrence() != null ? request.getRecurrence() : Recurrence.YEARLY);
        milestone.setBudgetTier(deriveBudgetTier(request));
        milestone.setUpdatedAt(now);
    }

    private Mono<Milestone> publish(MilestoneChangedEvent.Kind kind, Milestone milestone) {
        return milestoneEventHandler.handle(new MilestoneChangedEvent(kind, milestone))
                .thenReturn(milestone);
    }
}
