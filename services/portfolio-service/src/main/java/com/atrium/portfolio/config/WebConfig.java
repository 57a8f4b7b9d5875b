package com.atrium.portfolio.config;

import com.atrium.portfolio.infrastructure.web.BearerAuthenticationInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for local frontends and bearer authentication for every
 * {@code /api/v1} endpoint except sign-up, login, refresh and service info.
 *
 * <p>Production origins belong in environment configuration.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final BearerAuthenticationInterceptor authenticationInterceptor;

    public WebConfig(BearerAuthenticationInterceptor authenticationInterceptor) {
        this.authenticationInterceptor = authenticationInterceptor;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("Authorization", "Content-Type", "X-Correlation-ID")
                .exposedHeaders("X-Correlation-ID")
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authenticationInterceptor)
                .addPathPatterns("/api/v1/**")
                .excludePathPatterns("/api/v1/auth/**", "/api/v1/info");
    }
}
