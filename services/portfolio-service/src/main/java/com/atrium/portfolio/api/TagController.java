package com.atrium.portfolio.api;

import com.atrium.portfolio.api.dto.TagCreateRequest;
import com.atrium.portfolio.api.dto.TagResponse;
import com.atrium.portfolio.infrastructure.web.BearerAuthenticationInterceptor;
import com.atrium.portfolio.service.TagService;
import com.atrium.security.Principal;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tags")
public class TagController {

    private final TagService tagService;

    public TagController(TagService tagService) {
        this.tagService = tagService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TagResponse create(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller,
            @Valid @RequestBody TagCreateRequest body) {
        return TagResponse.from(tagService.create(caller, body.name()));
    }

    @GetMapping
    public List<TagResponse> list(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller) {
        return tagService.list(caller).stream()
                .map(TagResponse::from)
                .toList();
    }
}
