package com.atrium.portfolio.api.dto;

import com.atrium.portfolio.domain.ProjectChanges;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

/** PATCH body; every field is optional. */
public record ProjectUpdateRequest(
        @Size(min = 2, max = 200) String title,
        @Size(min = 1) String description,
        @Size(max = 500) String githubUrl,
        @JsonProperty("is_public") Boolean isPublic,
        List<@NotNull @Size(max = 50) String> tagNames) {

    public ProjectChanges toChanges() {
        return new ProjectChanges(title, description, githubUrl, isPublic, tagNames);
    }
}
