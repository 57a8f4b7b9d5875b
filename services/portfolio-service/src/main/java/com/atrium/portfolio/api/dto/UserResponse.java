package com.atrium.portfolio.api.dto;

import com.atrium.access.spi.UserAccount;

public record UserResponse(long id, long orgId, String email, String role) {

    public static UserResponse from(UserAccount user) {
        return new UserResponse(user.id(), user.tenantId(), user.email(), user.role().value());
    }
}
