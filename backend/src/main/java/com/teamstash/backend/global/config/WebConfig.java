package com.teamstash.backend.global.config;

import java.util.List;

import com.teamstash.backend.modules.team.presentation.ActiveTeamArgumentResolver;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ActiveTeamArgumentResolver activeTeamArgumentResolver;

    public WebConfig(ActiveTeamArgumentResolver activeTeamArgumentResolver) {
        this.activeTeamArgumentResolver = activeTeamArgumentResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(activeTeamArgumentResolver);
    }
}
