package com.knotcore.controller;

import com.knotcore.model.dto.HintCreateRequest;
import com.knotcore.model.dto.HintResponse;
import com.knotcore.model.dto.HintSearchRequest;
import com.knotcore.model.dto.HintSearchResponse;
import com.knotcore.service.embedding.HintService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * Controller for hint capture and semantic hint search.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class HintController {

    private final HintService hintService;

    @PostMapping("/vaults/{vaultId}/hints")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<HintResponse> addHint(
            @PathVariable UUID vaultId,
            @Valid @RequestBody HintCreateRequest request) {
        return hintService.addHint(vaultId, request);
    }

    @GetMapping("/vaults/{vaultId}/hints")
    public Flux<HintResponse> listHints(@PathVariable UUID vaultId) {
        return hintService.listHints(vaultId);
    }

    @PostMapping("/vaults/{vaultId}/hints/search")
    public Mono<HintSearchResponse> searchHints(
            @PathVariable UUID vaultId,
            @Valid @RequestBody HintSearchRequest request) {
        return hintService.search(vaultId, request);
    }

    @DeleteMapping("/hints/{hintId}")
    public Mono<Map<String, Boolean>> deleteHint(@PathVariable UUID hintId) {
        return hintService.deleteHint(hintId)
                .thenReturn(Map.of("deleted", true));
    }
}
