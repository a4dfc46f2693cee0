package com.cmagents.api;

import com.cmagents.session.SessionRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final SessionRegistry sessionRegistry;
    private final Clock clock;

    public HealthController(SessionRegistry sessionRegistry, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.clock = clock;
    }

    @GetMapping
    public HealthResponse health() {
        return new HealthResponse("ok", sessionRegistry.size(), clock.instant());
    }
}
