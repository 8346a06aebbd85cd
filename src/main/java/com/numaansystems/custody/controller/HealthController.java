package com.numaansystems.custody.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for load balancers. Public, never touches the store or Google.
 * Operational counters are under {@code /internal/status}.
 */
@RestController
public class HealthController {

    @GetMapping("/healthz")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", "token-custody");
        return body;
    }
}
