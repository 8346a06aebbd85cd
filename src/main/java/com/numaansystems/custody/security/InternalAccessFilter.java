package com.numaansystems.custody.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.custody.error.CustodyException;
import com.numaansystems.custody.error.ForbiddenOriginException;
import com.numaansystems.custody.error.InvalidUserIdentityException;
import com.numaansystems.custody.error.RateLimitExceededException;
import com.numaansystems.custody.error.UnauthorizedCallerException;
import com.numaansystems.custody.ratelimit.RequestAdmission;
import com.numaansystems.custody.store.UserIdentity;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Guards the internal-only endpoints with the {@link AccessGate} and then
 * {@link RequestAdmission}.
 *
 * <h2>Protected Endpoints</h2>
 * <ul>
 *   <li>/auth/google/token, /auth/google/revoke</li>
 *   <li>/google/** - proxied Google resources</li>
 *   <li>/internal/**</li>
 *   <li>/swagger-ui/**, /v3/api-docs/**, /api-docs/** - API documentation</li>
 * </ul>
 *
 * <p>Rejections are written directly as JSON: 401 or 403 with
 * {@code access_denied}, 429 with {@code rate_limited} and a
 * {@code Retry-After} header.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class InternalAccessFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(InternalAccessFilter.class);

    private static final List<String> EXACT_PATHS = List.of("/auth/google/token", "/auth/google/revoke");
    private static final List<String> PATH_PREFIXES = List.of(
            "/google/", "/internal/", "/swagger-ui", "/v3/api-docs", "/api-docs");

    private final AccessGate accessGate;
    private final RequestAdmission admission;
    private final ObjectMapper objectMapper;

    public InternalAccessFilter(AccessGate accessGate, RequestAdmission admission, ObjectMapper objectMapper) {
        this.accessGate = accessGate;
        this.admission = admission;
        this.objectMapper = objectMapper;
    }

    /**
     * @param path request path without the context path
     * @return true if the path is only reachable by internal callers
     */
    public static boolean isInternalPath(String path) {
        if (EXACT_PATHS.contains(path)) {
            return true;
        }
        for (String prefix : PATH_PREFIXES) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !isInternalPath(pathOf(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String apiKey = request.getHeader(AccessGate.API_KEY_HEADER);
        try {
            accessGate.check(apiKey, request.getRemoteAddr());
            admission.admit(apiKey, subjectUser(request));
        } catch (UnauthorizedCallerException e) {
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, e, false);
            return;
        } catch (ForbiddenOriginException e) {
            writeError(response, HttpServletResponse.SC_FORBIDDEN, e, false);
            return;
        } catch (RateLimitExceededException e) {
            logger.info("Rate limited {} {} (retry after {}s)", request.getMethod(), pathOf(request),
                    e.getRetryAfterSeconds());
            response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(e.getRetryAfterSeconds()));
            writeError(response, 429, e, true);
            return;
        }
        chain.doFilter(request, response);
    }

    private static UserIdentity subjectUser(HttpServletRequest request) {
        String userId = request.getParameter("user_id");
        if (userId == null) {
            return null;
        }
        try {
            return UserIdentity.of(userId);
        } catch (InvalidUserIdentityException e) {
            // the controller rejects it with a 400
            return null;
        }
    }

    private void writeError(HttpServletResponse response, int status, CustodyException error, boolean withMessage)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error.errorCode());
        if (withMessage) {
            body.put("message", error.getMessage());
        }
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getOutputStream(), body);
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
