package com.atrium.portfolio.domain;

import java.util.List;

/** Partial project update. Null fields are left unchanged. */
public record ProjectChanges(
        String title, String description, String githubUrl, Boolean isPublic, List<String> tagNames) {}
