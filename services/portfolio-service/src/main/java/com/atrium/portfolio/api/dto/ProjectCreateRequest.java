package com.atrium.portfolio.api.dto;

import com.atrium.portfolio.domain.NewProject;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record ProjectCreateRequest(
        @NotBlank @Size(min = 2, max = 200) String title,
        @NotNull @Size(min = 1) String description,
        @Size(max = 500) String githubUrl,
        @JsonProperty("is_public") Boolean isPublic,
        List<@NotNull @Size(max = 50) String> tagNames) {

    public NewProject toNewProject() {
        return new NewProject(title, description, githubUrl, Boolean.TRUE.equals(isPublic), tagNames);
    }
}
