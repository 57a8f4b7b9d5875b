package com.atrium.portfolio.api;

import com.atrium.portfolio.api.dto.ActivityResponse;
import com.atrium.portfolio.infrastructure.web.BearerAuthenticationInterceptor;
import com.atrium.portfolio.service.ActivityService;
import com.atrium.security.Principal;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/activity")
public class ActivityController {

    private final ActivityService activityService;

    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    @GetMapping
    public List<ActivityResponse> list(
            @RequestAttribute(BearerAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) Principal caller,
            @RequestParam(defaultValue = "20") @Min(1) @Max(ActivityService.MAX_LIMIT) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        return activityService.list(caller, limit, offset).stream()
                .map(ActivityResponse::from)
                .toList();
    }
}
