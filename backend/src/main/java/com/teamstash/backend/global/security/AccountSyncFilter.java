package com.teamstash.backend.global.security;

import java.io.IOException;

import com.teamstash.backend.modules.account.application.AccountService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Mirrors the authenticated identity into the local account directory so that
 * invitations can be matched by email and members can be listed by name.
 */
@Component
public class AccountSyncFilter extends OncePerRequestFilter {

    private final AccountService accountService;

    public AccountSyncFilter(AccountService accountService) {
        this.accountService = accountService;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            accountService.syncAccount(principal);
        }
        filterChain.doFilter(request, response);
    }
}
