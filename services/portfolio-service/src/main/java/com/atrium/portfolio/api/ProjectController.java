package com.atrium.portfolio.api;

import com.atrium.portfolio.api.dto.ProjectCreateRequest;
import com.atrium.portfolio.api.dto.ProjectResponse;
import com.atrium.portfolio.api.dto.ProjectUpdateRequest;
import com.atrium.portfolio.domain.ProjectQuery;
import com.atrium.portfolio.domain.ProjectSort;
import com.atrium.portfolio.infrastructure.web.BearerAuthenticationInterceptor;
import com.atrium.portfolio.service.ProjectService;
import com.atrium.security.Principal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProjectResponse create(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller,
            @Valid @RequestBody ProjectCreateRequest body) {
        return ProjectResponse.from(projectService.create(caller, body.toNewProject()));
    }

    @GetMapping
    public List<ProjectResponse> list(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller,
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String tag,
            @RequestParam(name = "public_only", defaultValue = "false") boolean publicOnly,
            @RequestParam(defaultValue = "newest")
                    @Pattern(regexp = "^(newest|oldest|title_asc|title_desc)$") String sort,
            @RequestParam(defaultValue = "10") @Min(1) @Max(ProjectQuery.MAX_LIMIT) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        var query = new ProjectQuery(q, tag, publicOnly, ProjectSort.fromParameter(sort), limit, offset);
        return projectService.list(caller, query).stream()
                .map(ProjectResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public ProjectResponse get(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller,
            @PathVariable long id) {
        return ProjectResponse.from(projectService.get(caller, id));
    }

    @PatchMapping("/{id}")
    public ProjectResponse update(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller,
            @PathVariable long id,
            @Valid @RequestBody ProjectUpdateRequest body) {
        return ProjectResponse.from(projectService.update(caller, id, body.toChanges()));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller,
            @PathVariable long id) {
        projectService.delete(caller, id);
        return Map.of("ok", true);
    }
}
