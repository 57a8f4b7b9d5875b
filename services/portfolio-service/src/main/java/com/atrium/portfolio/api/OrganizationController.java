package com.atrium.portfolio.api;

import com.atrium.portfolio.api.dto.OrganizationResponse;
import com.atrium.portfolio.infrastructure.web.BearerAuthenticationInterceptor;
import com.atrium.portfolio.service.OrganizationService;
import com.atrium.security.Principal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/orgs")
public class OrganizationController {

    private final OrganizationService organizationService;

    public OrganizationController(OrganizationService organizationService) {
        this.organizationService = organizationService;
    }

    @GetMapping("/me")
    public OrganizationResponse me(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller) {
        return OrganizationResponse.from(organizationService.current(caller));
    }
}
