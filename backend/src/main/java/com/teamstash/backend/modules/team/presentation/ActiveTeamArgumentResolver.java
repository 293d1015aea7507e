package com.teamstash.backend.modules.team.presentation;

import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.global.security.SecurityUtils;
import com.teamstash.backend.modules.team.application.ActiveTeamResolution;
import com.teamstash.backend.modules.team.application.TeamResolver;
import com.teamstash.backend.modules.team.domain.ActiveTeam;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies an {@link ActiveTeam} controller argument, resolved once per request from the
 * caller's memberships and preference cookie. Refreshes or clears the cookie as needed.
 */
@Component
public class ActiveTeamArgumentResolver implements HandlerMethodArgumentResolver {

    private final TeamResolver teamResolver;
    private final ActiveTeamCookieSupport cookieSupport;

    public ActiveTeamArgumentResolver(TeamResolver teamResolver, ActiveTeamCookieSupport cookieSupport) {
        this.teamResolver = teamResolver;
        this.cookieSupport = cookieSupport;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ActiveTeam.class.equals(parameter.getParameterType());
    }

    @Override
    public ActiveTeam resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory
    ) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        HttpServletResponse response = webRequest.getNativeResponse(HttpServletResponse.class);
        UUID principalId = SecurityUtils.getCurrentUserId();
        String preference = request != null ? cookieSupport.read(request) : null;

        Optional<ActiveTeamResolution> resolution = teamResolver.resolveActiveTeam(principalId, preference);
        if (resolution.isEmpty()) {
            if (preference != null && response != null) {
                cookieSupport.clear(response);
            }
            throw new ProblemException(HttpStatus.CONFLICT, "team.onboarding_required",
                    "Create a team or accept an invitation to get started.");
        }

        ActiveTeam activeTeam = resolution.get().activeTeam();
        if (resolution.get().preferenceChanged() && response != null) {
            cookieSupport.write(response, activeTeam.teamId());
        }
        return activeTeam;
    }
}
