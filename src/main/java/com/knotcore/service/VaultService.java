package com.knotcore.service;

import com.knotcore.exception.ResourceNotFoundException;
import com.knotcore.model.domain.VaultProfile;
import com.knotcore.model.entity.Interest;
import com.knotcore.model.entity.Vault;
import com.knotcore.model.entity.VaultLoveLanguage;
import com.knotcore.model.entity.VaultVibe;
import com.knotcore.model.enums.InterestPolarity;
import com.knotcore.model.enums.LoveLanguage;
import com.knotcore.model.enums.LoveLanguageRank;
import com.knotcore.repository.InterestRepository;
import com.knotcore.repository.NotificationRepository;
import com.knotcore.repository.VaultLoveLanguageRepository;
import com.knotcore.repository.VaultRepository;
import com.knotcore.repository.VaultVibeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read access to partner vaults for scoring, and vault deletion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VaultService {

    private final VaultRepository vaultRepository;
    private final InterestRepository interestRepository;
    private final VaultVibeRepository vaultVibeRepository;
    private final VaultLoveLanguageRepository vaultLoveLanguageRepository;
    private final NotificationRepository notificationRepository;

    public Mono<Vault> getVault(UUID vaultId) {
        return vaultRepository.findById(vaultId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Vault", vaultId)));
    }

    /**
     * Load the static preference facts of a vault.
     *
     * @param vaultId Vault ID
     * @return Validated profile
     */
    public Mono<VaultProfile> loadProfile(UUID vaultId) {
        return getVault(vaultId)
                .flatMap(vault -> Mono.zip(
                                interestRepository.findByVaultId(vaultId).collectList(),
                                vaultVibeRepository.findByVaultId(vaultId).collectList(),
                                vaultLoveLanguageRepository.findByVaultId(vaultId).collectList())
                        .map(parts -> toProfile(vault, parts.getT1(), parts.getT2(), parts.getT3())));
    }

    /**
     * Delete a vault. Pending notifications of its owner are cancelled first, in the same transaction.
     *
     * @param vaultId Vault ID
     */
    @Transactional
    public Mono<Void> deleteVault(UUID vaultId) {
        return getVault(vaultId)
                .flatMap(vault -> notificationRepository.cancelPendingByUserId(vault.getUserId())
                        .doOnNext(cancelled -> log.info("Cancelled {} pending notifications of vault {}", cancelled, vaultId))
                        .then(vaultRepository.delete(vault)));
    }

    private static VaultProfile toProfile(Vault vault, List<Interest> interests, List<VaultVibe> vibes,
                                          List<VaultLoveLanguage> loveLanguages) {
        return VaultProfile.builder()
                .vaultId(vault.getId())
                .userId(vault.getUserId())
                .likes(interests.stream()
                        .filter(interest -> interest.getPolarity() == InterestPolarity.LIKE)
                        .map(Interest::getCategory)
                        .collect(Collectors.toSet()))
                .dislikes(interests.stream()
                        .filter(interest -> interest.getPolarity() == InterestPolarity.DISLIKE)
                        .map(Interest::getCategory)
                        .collect(Collectors.toSet()))
                .vibes(vibes.stream().map(VaultVibe::getVibe).collect(Collectors.toSet()))
                .primaryLoveLanguage(loveLanguage(loveLanguages, LoveLanguageRank.PRIMARY))
                .secondaryLoveLanguage(loveLanguage(loveLanguages, LoveLanguageRank.SECONDARY))
                .locationState(vault.getLocationState())
                .build();
    }

    private static LoveLanguage loveLanguage(List<VaultLoveLanguage> loveLanguages, LoveLanguageRank rank) {
        return loveLanguages.stream()
                .filter(entry -> entry.getRank() == rank)
                .map(VaultLoveLanguage::getLanguage)
                .findFirst()
                .orElse(null);
    }
}
