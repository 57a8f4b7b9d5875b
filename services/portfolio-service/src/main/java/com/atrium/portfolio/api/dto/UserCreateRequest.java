package com.atrium.portfolio.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UserCreateRequest(
        @NotBlank @Email String email,
        @NotNull @Size(min = 8, max = 128) String password,
        @NotNull @Pattern(regexp = "^(admin|editor|viewer)$") String role) {

    @Override
    public String toString() {
        return "UserCreateRequest[email=%s, role=%s]".formatted(email, role);
    }
}
