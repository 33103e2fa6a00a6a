package com.knotcore.service.scheduling;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.model.domain.DeliveryTarget;
import com.knotcore.model.domain.QuietHours;
import com.knotcore.model.entity.Milestone;
import com.knotcore.repository.UserAccountRepository;
import com.knotcore.repository.VaultRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Finds the user behind a milestone together with their zone and quiet hours.
 */
@Component
@RequiredArgsConstructor
public class DeliveryTargetResolver {

    private final VaultRepository vaultRepository;
    private final UserAccountRepository userAccountRepository;
    private final TimeZoneResolver timeZoneResolver;

    public Mono<DeliveryTarget> forMilestone(Milestone milestone) {
        return vaultRepository.findById(milestone.getVaultId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Vault", milestone.getVaultId())))
                .flatMap(vault -> userAccountRepository.findById(vault.getUserId())
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", vault.getUserId())))
                        .map(user -> DeliveryTarget.builder()
                                .user(user)
                                .vault(vault)
                                .zone(timeZoneResolver.resolve(user.getTimezone(), vault.getLocationState()))
                                .quietHours(new QuietHours(user.getQuietHoursStart(), user.getQuietHoursEnd()))
                                .build()));
    }
}
