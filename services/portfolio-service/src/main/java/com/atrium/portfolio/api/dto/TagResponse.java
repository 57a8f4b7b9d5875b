package com.atrium.portfolio.api.dto;

import com.atrium.portfolio.domain.Tag;

public record TagResponse(long id, String name) {

    public static TagResponse from(Tag tag) {
        return new TagResponse(tag.id(), tag.name());
    }
}
