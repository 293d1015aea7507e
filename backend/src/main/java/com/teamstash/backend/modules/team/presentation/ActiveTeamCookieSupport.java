package com.teamstash.backend.modules.team.presentation;

import java.time.Duration;
import java.util.UUID;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

/**
 * Transport for the caller's preferred active team. The value is opaque to everything except {@code TeamResolver}.
 */
@Component
public class ActiveTeamCookieSupport {

    private final String cookieName;
    private final Duration maxAge;
    private final boolean secure;

    public ActiveTeamCookieSupport(
            @Value("${teamstash.active-team.cookie-name:active_team_id}") String cookieName,
            @Value("${teamstash.active-team.cookie-max-age-days:30}") long maxAgeDays,
            @Value("${teamstash.active-team.cookie-secure:true}") boolean secure
    ) {
        this.cookieName = cookieName;
        this.maxAge = Duration.ofDays(maxAgeDays);
        this.secure = secure;
    }

    public String read(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, cookieName);
        return cookie != null ? cookie.getValue() : null;
    }

    public void write(HttpServletResponse response, UUID teamId) {
        response.addHeader(HttpHeaders.SET_COOKIE, build(teamId.toString(), maxAge).toString());
    }

    public void clear(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, build("", Duration.ZERO).toString());
    }

    public String getCookieName() {
        return cookieName;
    }

    private ResponseCookie build(String value, Duration age) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Lax")
                .path("/")
                .maxAge(age)
                .build();
    }
}
