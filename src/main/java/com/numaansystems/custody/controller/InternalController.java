package com.numaansystems.custody.controller;

import com.numaansystems.custody.ratelimit.FixedWindowRateLimiter;
import com.numaansystems.custody.security.AccessGate;
import com.numaansystems.custody.state.ConsumedNonceLedger;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Endpoints for internal callers only.
 *
 * <ul>
 *   <li>GET /internal/ping - connectivity check; reaching it proves the API key and address are accepted</li>
 *   <li>GET /internal/status - operational counters of this instance</li>
 * </ul>
 */
@RestController
@RequestMapping("/internal")
public class InternalController {

    private final ConsumedNonceLedger nonceLedger;
    private final FixedWindowRateLimiter rateLimiter;
    private final AccessGate accessGate;

    public InternalController(ConsumedNonceLedger nonceLedger, FixedWindowRateLimiter rateLimiter,
                              AccessGate accessGate) {
        this.nonceLedger = nonceLedger;
        this.rateLimiter = rateLimiter;
        this.accessGate = accessGate;
    }

    @GetMapping("/ping")
    public Map<String, Object> ping() {
        return Map.of("ok", true);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("consumedStates", nonceLedger.getConsumedCount());
        body.put("singleUseStates", nonceLedger.isEnabled());
        body.put("rateLimitSubjects", rateLimiter.activeSubjects());
        body.put("allowListMisconfigured", accessGate.isMisconfigured());
        return body;
    }
}
