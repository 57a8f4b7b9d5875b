package com.atrium.portfolio.api.dto;

import com.atrium.portfolio.domain.Organization;

public record OrganizationResponse(long id, String name) {

    public static OrganizationResponse from(Organization org) {
        return new OrganizationResponse(org.id(), org.name());
    }
}
