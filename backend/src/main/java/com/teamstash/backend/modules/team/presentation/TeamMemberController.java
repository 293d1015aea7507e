package com.teamstash.backend.modules.team.presentation;

import java.util.List;
import java.util.UUID;

import com.teamstash.backend.global.security.JwtAuthenticationPrincipal;
import com.teamstash.backend.modules.team.application.TeamMembershipService;
import com.teamstash.backend.modules.team.presentation.dto.AddMemberRequest;
import com.teamstash.backend.modules.team.presentation.dto.TeamMemberResponse;
import com.teamstash.backend.modules.team.presentation.dto.UpdateMemberRoleRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/teams/{teamId}/members")
@Tag(name = "Team members")
public class TeamMemberController {

    private final TeamMembershipService teamMembershipService;

    public TeamMemberController(TeamMembershipService teamMembershipService) {
        this.teamMembershipService = teamMembershipService;
    }

    @GetMapping
    public ResponseEntity<List<TeamMemberResponse>> listMembers(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId
    ) {
        return ResponseEntity.ok(teamMembershipService.listMembers(teamId, principal.userId()));
    }

    @PostMapping
    @Operation(summary = "Add an existing account to the team")
    public ResponseEntity<TeamMemberResponse> addMember(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId,
            @Valid @RequestBody AddMemberRequest request
    ) {
        TeamMemberResponse added = teamMembershipService.addMember(teamId, principal.userId(), request.email(), request.role());
        return ResponseEntity.status(HttpStatus.CREATED).body(added);
    }

    @PatchMapping("/{memberId}")
    public ResponseEntity<TeamMemberResponse> changeRole(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId,
            @PathVariable UUID memberId,
            @Valid @RequestBody UpdateMemberRoleRequest request
    ) {
        return ResponseEntity.ok(teamMembershipService.changeRole(teamId, principal.userId(), memberId, request.role()));
    }

    @DeleteMapping("/{memberId}")
    @Operation(summary = "Remove a member, or leave the team when memberId is the caller")
    public ResponseEntity<Void> removeMember(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId,
            @PathVariable UUID memberId
    ) {
        teamMembershipService.removeMember(teamId, principal.userId(), memberId);
        return ResponseEntity.noContent().build();
    }
}
