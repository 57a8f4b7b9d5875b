package com.atrium.portfolio.domain;

import java.util.List;

/** A project together with its resolved tags. */
public record ProjectDetails(Project project, List<Tag> tags) {}
