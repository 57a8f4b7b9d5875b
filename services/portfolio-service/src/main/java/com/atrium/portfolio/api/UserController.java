package com.atrium.portfolio.api;

import com.atrium.portfolio.api.dto.UserCreateRequest;
import com.atrium.portfolio.api.dto.UserResponse;
import com.atrium.portfolio.infrastructure.web.BearerAuthenticationInterceptor;
import com.atrium.portfolio.service.UserService;
import com.atrium.security.Principal;
import com.atrium.security.Role;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public UserResponse create(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller,
            @Valid @RequestBody UserCreateRequest body) {
        Role role = Role.fromString(body.role())
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + body.role()));
        return UserResponse.from(userService.create(caller, body.email(), body.password(), role));
    }

    @GetMapping
    public List<UserResponse> list(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller) {
        return userService.list(caller).stream()
                .map(UserResponse::from)
                .toList();
    }
}
