package com.atrium.portfolio.api;

import com.atrium.access.CredentialAuthenticator;
import com.atrium.portfolio.api.dto.LoginRequest;
import com.atrium.portfolio.api.dto.RefreshRequest;
import com.atrium.portfolio.api.dto.RegisterRequest;
import com.atrium.portfolio.api.dto.TokenResponse;
import com.atrium.portfolio.service.RegistrationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated entry points: sign-up, login and token refresh. */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final RegistrationService registrationService;
    private final CredentialAuthenticator authenticator;

    public AuthController(RegistrationService registrationService, CredentialAuthenticator authenticator) {
        this.registrationService = registrationService;
        this.authenticator = authenticator;
    }

    @PostMapping("/register")
    public TokenResponse register(@Valid @RequestBody RegisterRequest body) {
        return TokenResponse.from(
                registrationService.register(body.orgName(), body.email(), body.password()));
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest body) {
        return TokenResponse.from(authenticator.authenticate(body.email(), body.password()));
    }

    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshRequest body) {
        return TokenResponse.from(authenticator.refresh(body.refreshToken()));
    }
}
