package com.atrium.portfolio.domain;

import java.util.List;

/** Fields supplied when creating a project; tenant and owner come from the caller. */
public record NewProject(
        String title, String description, String githubUrl, boolean isPublic, List<String> tagNames) {

    public NewProject {
        tagNames = tagNames == null ? List.of() : List.copyOf(tagNames);
    }
}
