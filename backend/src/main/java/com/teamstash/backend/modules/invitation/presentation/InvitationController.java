package com.teamstash.backend.modules.invitation.presentation;

import java.util.List;
import java.util.UUID;

import com.teamstash.backend.global.security.JwtAuthenticationPrincipal;
import com.teamstash.backend.modules.invitation.application.InvitationService;
import com.teamstash.backend.modules.invitation.domain.InvitationStatus;
import com.teamstash.backend.modules.invitation.presentation.dto.CreateInvitationRequest;
import com.teamstash.backend.modules.invitation.presentation.dto.InvitationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Invitations")
public class InvitationController {

    private final InvitationService invitationService;

    public InvitationController(InvitationService invitationService) {
        this.invitationService = invitationService;
    }

    @PostMapping("/teams/{teamId}/invitations")
    @Operation(summary = "Invite an email address to the team with a proposed role")
    public ResponseEntity<InvitationResponse> createInvitation(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId,
            @Valid @RequestBody CreateInvitationRequest request
    ) {
        InvitationResponse created = invitationService.createInvitation(
                teamId, principal.userId(), request.email(), request.role());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/teams/{teamId}/invitations")
    public ResponseEntity<List<InvitationResponse>> listTeamInvitations(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId,
            @RequestParam(name = "status", required = false) InvitationStatus status
    ) {
        return ResponseEntity.ok(invitationService.listTeamInvitations(teamId, principal.userId(), status));
    }

    @GetMapping("/invitations")
    @Operation(summary = "Pending invitations addressed to the caller's verified email")
    public ResponseEntity<List<InvitationResponse>> listMyInvitations(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(invitationService.listMyPendingInvitations(principal.userId()));
    }

    @PostMapping("/invitations/{invitationId}/accept")
    public ResponseEntity<InvitationResponse> accept(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID invitationId
    ) {
        return ResponseEntity.ok(invitationService.acceptInvitation(invitationId, principal.userId()));
    }

    @PostMapping("/invitations/{invitationId}/decline")
    public ResponseEntity<InvitationResponse> decline(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID invitationId
    ) {
        return ResponseEntity.ok(invitationService.declineInvitation(invitationId, principal.userId()));
    }
}
