package com.knotcore.controller;

import com.knotcore.service.VaultService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1/vaults")
@RequiredArgsConstructor
public class VaultController {

    private final VaultService vaultService;

    @DeleteMapping("/{vaultId}")
    public Mono<Map<String, Boolean>> deleteVault(@PathVariable UUID vaultId) {
        return vaultService.deleteVault(vaultId)
                .thenReturn(Map.of("deleted", true));
    }
}
