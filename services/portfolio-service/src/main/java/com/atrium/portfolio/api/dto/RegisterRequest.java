package com.atrium.portfolio.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank @Size(min = 2, max = 200) String orgName,
        @NotBlank @Email String email,
        @NotNull @Size(min = 8, max = 128) String password) {

    @Override
    public String toString() {
        return "RegisterRequest[orgName=%s, email=%s]".formatted(orgName, email);
    }
}
