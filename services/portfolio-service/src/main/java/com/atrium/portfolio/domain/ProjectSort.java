package com.atrium.portfolio.domain;

import java.util.Comparator;
import java.util.Locale;

/** Orderings offered by the project listing. */
public enum ProjectSort {
    NEWEST(Comparator.comparingLong(Project::id).reversed()),
    OLDEST(Comparator.comparingLong(Project::id)),
    TITLE_ASC(Comparator.comparing(Project::title).thenComparingLong(Project::id)),
    TITLE_DESC(Comparator.comparing(Project::title).reversed().thenComparingLong(Project::id));

    private final Comparator<Project> comparator;

    ProjectSort(Comparator<Project> comparator) {
        this.comparator = comparator;
    }

    public Comparator<Project> comparator() {
        return comparator;
    }

    /**
     * @param value one of {@code newest}, {@code oldest}, {@code title_asc}, {@code title_desc}
     * @throws IllegalArgumentException for any other value
     */
    public static ProjectSort fromParameter(String value) {
        for (ProjectSort sort : values()) {
            if (sort.name().toLowerCase(Locale.ROOT).equals(value)) {
                return sort;
            }
        }
        throw new IllegalArgumentException("Unknown sort: " + value);
    }
}
