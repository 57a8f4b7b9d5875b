package com.atrium.portfolio.domain;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * Filters and paging for the project listing.
 *
 * @param text case-insensitive substring matched against title and description, or null
 * @param tag tag name the project must carry, or null
 * @param publicOnly only public projects when true
 * @param sort ordering
 * @param limit page size, 1 to 50
 * @param offset number of projects to skip
 */
public record ProjectQuery(
        String text, String tag, boolean publicOnly, ProjectSort sort, int limit, int offset) {

    public static final int MAX_LIMIT = 50;

    public ProjectQuery {
        if (limit < 1 || limit > MAX_LIMIT || offset < 0) {
            throw new IllegalArgumentException("limit must be 1-50 and offset >= 0");
        }
        if (sort == null) {
            sort = ProjectSort.NEWEST;
        }
        text = text == null || text.isBlank() ? null : text.toLowerCase(Locale.ROOT);
        tag = tag == null || tag.isBlank() ? null : Tag.normalize(tag);
    }

    /** Matches title/description text and the public flag; tag filtering needs the tag id. */
    public Predicate<Project> matchesFields() {
        return project -> (!publicOnly || project.isPublic())
                && (text == null
                        || project.title().toLowerCase(Locale.ROOT).contains(text)
                        || project.description().toLowerCase(Locale.ROOT).contains(text));
    }
}
