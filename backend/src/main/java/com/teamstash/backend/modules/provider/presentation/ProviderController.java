package com.teamstash.backend.modules.provider.presentation;

import java.util.List;
import java.util.UUID;

import com.teamstash.backend.global.security.JwtAuthenticationPrincipal;
import com.teamstash.backend.modules.provider.application.ProviderService;
import com.teamstash.backend.modules.provider.presentation.dto.ProviderRequest;
import com.teamstash.backend.modules.provider.presentation.dto.ProviderResponse;
import com.teamstash.backend.modules.team.domain.ActiveTeam;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/providers")
@Tag(name = "Providers")
public class ProviderController {

    private final ProviderService providerService;

    public ProviderController(ProviderService providerService) {
        this.providerService = providerService;
    }

    @GetMapping
    public ResponseEntity<List<ProviderResponse>> listProviders(ActiveTeam activeTeam) {
        return ResponseEntity.ok(providerService.listProviders(activeTeam));
    }

    @PostMapping
    public ResponseEntity<ProviderResponse> createProvider(
            ActiveTeam activeTeam,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody ProviderRequest request
    ) {
        ProviderResponse created = providerService.createProvider(
                activeTeam, principal.userId(), request.name(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{providerId}")
    public ResponseEntity<ProviderResponse> updateProvider(
            ActiveTeam activeTeam,
            @PathVariable UUID providerId,
            @Valid @RequestBody ProviderRequest request
    ) {
        return ResponseEntity.ok(providerService.updateProvider(activeTeam, providerId, request.name(), request.description()));
    }

    @DeleteMapping("/{providerId}")
    public ResponseEntity<Void> deleteProvider(ActiveTeam activeTeam, @PathVariable UUID providerId) {
        providerService.deleteProvider(activeTeam, providerId);
        return ResponseEntity.noContent().build();
    }
}
