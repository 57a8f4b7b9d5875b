package com.atrium.portfolio;

import com.atrium.portfolio.config.AtriumProperties;
import com.atrium.portfolio.config.PasswordProperties;
import com.atrium.portfolio.config.TokenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Atrium portfolio service: organizations, users, tags and projects behind a bearer-token
 * REST API, every call authorized and every mutation audited.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation ({@code X-Correlation-ID})
 *   <li>RFC 7807 ProblemDetail error bodies
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({
    AtriumProperties.class,
    TokenProperties.class,
    PasswordProperties.class
})
public class PortfolioServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(PortfolioServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PortfolioServiceApplication.class, args);
        log.info("Atrium portfolio service started");
    }
}
