package com.teamstash.backend.modules.account.presentation;

import com.teamstash.backend.global.security.JwtAuthenticationPrincipal;
import com.teamstash.backend.modules.account.application.AccountService;
import com.teamstash.backend.modules.account.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Profile")
public class ProfileController {

    private final AccountService accountService;

    public ProfileController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping("/profile/me")
    @Operation(summary = "Current account as mirrored from the identity provider")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(accountService.loadProfile(principal.userId()));
    }
}
