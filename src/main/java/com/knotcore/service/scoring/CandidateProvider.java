package com.knotcore.service.scoring;

import com.knotcore.model.domain.Candidate;
import com.knotcore.model.domain.VaultProfile;
import com.knotcore.model.entity.Milestone;
import reactor.core.publisher.Flux;

/**
 * Source of recommendation candidates for a vault.
 */
public interface CandidateProvider {

    /**
     * @param profile Vault profile
     * @param milestone Milestone the candidates are for, or null for an ad-hoc request
     */
    Flux<Candidate> candidatesFor(VaultProfile profile, Milestone milestone);
}
