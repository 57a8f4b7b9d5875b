package com.atrium.portfolio.api.dto;

import com.atrium.portfolio.domain.ProjectDetails;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record ProjectResponse(
        long id,
        long orgId,
        long ownerId,
        String title,
        String description,
        String githubUrl,
        @JsonProperty("is_public") boolean isPublic,
        List<TagResponse> tags,
        Instant createdAt,
        Instant updatedAt) {

    public static ProjectResponse from(ProjectDetails details) {
        var p = details.project();
        return new ProjectResponse(
                p.id(),
                p.tenantId(),
                p.ownerUserId(),
                p.title(),
                p.description(),
                p.githubUrl(),
                p.isPublic(),
                details.tags().stream().map(TagResponse::from).toList(),
                p.createdAt(),
                p.updatedAt());
    }
}
