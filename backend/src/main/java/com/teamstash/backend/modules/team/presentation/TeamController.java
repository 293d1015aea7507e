package com.teamstash.backend.modules.team.presentation;

import java.util.List;
import java.util.UUID;

import com.teamstash.backend.global.security.JwtAuthenticationPrincipal;
import com.teamstash.backend.modules.team.application.TeamService;
import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.presentation.dto.ActiveTeamResponse;
import com.teamstash.backend.modules.team.presentation.dto.CreateTeamRequest;
import com.teamstash.backend.modules.team.presentation.dto.RenameTeamRequest;
import com.teamstash.backend.modules.team.presentation.dto.SelectActiveTeamRequest;
import com.teamstash.backend.modules.team.presentation.dto.TeamDetailResponse;
import com.teamstash.backend.modules.team.presentation.dto.TeamSummaryResponse;
import com.teamstash.backend.modules.team.presentation.dto.TransferOwnershipRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/teams")
@Tag(name = "Teams")
public class TeamController {

    private final TeamService teamService;
    private final ActiveTeamCookieSupport cookieSupport;

    public TeamController(TeamService teamService, ActiveTeamCookieSupport cookieSupport) {
        this.teamService = teamService;
        this.cookieSupport = cookieSupport;
    }

    @PostMapping
    @Operation(summary = "Create a team with the caller as its first admin")
    public ResponseEntity<TeamSummaryResponse> createTeam(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateTeamRequest request
    ) {
        TeamSummaryResponse created = teamService.createTeam(principal.userId(), request.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ResponseEntity<List<TeamSummaryResponse>> listTeams(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(teamService.listTeams(principal.userId()));
    }

    @GetMapping("/active")
    @Operation(summary = "Team the caller's requests currently operate against")
    public ResponseEntity<ActiveTeamResponse> getActiveTeam(ActiveTeam activeTeam) {
        return ResponseEntity.ok(ActiveTeamResponse.from(activeTeam));
    }

    @PutMapping("/active")
    @Operation(summary = "Remember a team as the caller's active team")
    public ResponseEntity<ActiveTeamResponse> selectActiveTeam(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody SelectActiveTeamRequest request,
            HttpServletResponse response
    ) {
        ActiveTeam selected = teamService.selectActiveTeam(principal.userId(), request.teamId());
        cookieSupport.write(response, selected.teamId());
        return ResponseEntity.ok(ActiveTeamResponse.from(selected));
    }

    @GetMapping("/{teamId}")
    public ResponseEntity<TeamDetailResponse> getTeam(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId
    ) {
        return ResponseEntity.ok(teamService.getTeam(teamId, principal.userId()));
    }

    @PatchMapping("/{teamId}")
    public ResponseEntity<TeamSummaryResponse> renameTeam(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId,
            @Valid @RequestBody RenameTeamRequest request
    ) {
        return ResponseEntity.ok(teamService.renameTeam(teamId, principal.userId(), request.name()));
    }

    @DeleteMapping("/{teamId}")
    public ResponseEntity<Void> deleteTeam(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId
    ) {
        teamService.deleteTeam(teamId, principal.userId());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{teamId}/owner")
    public ResponseEntity<Void> transferOwnership(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID teamId,
            @Valid @RequestBody TransferOwnershipRequest request
    ) {
        teamService.transferOwnership(teamId, principal.userId(), request.memberId());
        return ResponseEntity.noContent().build();
    }
}
