package com.numaansystems.custody.controller;

import com.numaansystems.custody.error.ConsentDeniedException;
import com.numaansystems.custody.error.CustodyException;
import com.numaansystems.custody.error.DecryptionException;
import com.numaansystems.custody.error.ForbiddenOriginException;
import com.numaansystems.custody.error.InvalidRequestException;
import com.numaansystems.custody.error.InvalidStateException;
import com.numaansystems.custody.error.NotConnectedException;
import com.numaansystems.custody.error.RateLimitExceededException;
import com.numaansystems.custody.error.ReauthRequiredException;
import com.numaansystems.custody.error.UnauthorizedCallerException;
import com.numaansystems.custody.error.UpstreamExchangeException;
import com.numaansystems.custody.error.UpstreamTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns failures into {@code {"success":false,"error":code,"message":text}}
 * responses.
 *
 * <table>
 *   <caption>Status codes</caption>
 *   <tr><td>invalid_state, consent_denied, invalid_request</td><td>400</td></tr>
 *   <tr><td>access_denied</td><td>401 / 403, no message</td></tr>
 *   <tr><td>not_connected</td><td>404</td></tr>
 *   <tr><td>reauth_required, credential_unusable</td><td>409</td></tr>
 *   <tr><td>rate_limited</td><td>429 with Retry-After</td></tr>
 *   <tr><td>upstream_exchange_failed</td><td>502</td></tr>
 *   <tr><td>upstream_timeout</td><td>504</td></tr>
 *   <tr><td>anything else</td><td>500 internal_error</td></tr>
 * </table>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestControllerAdvice
public class CustodyExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(CustodyExceptionHandler.class);

    @ExceptionHandler(CustodyException.class)
    public ResponseEntity<Map<String, Object>> handleCustodyException(CustodyException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            logger.error("Request failed with {}: {}", ex.errorCode(), ex.getMessage());
        } else {
            logger.info("Request rejected with {}: {}", ex.errorCode(), ex.getMessage());
        }

        boolean securityError = ex instanceof UnauthorizedCallerException || ex instanceof ForbiddenOriginException;
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (ex instanceof RateLimitExceededException rateLimited) {
            response.header(HttpHeaders.RETRY_AFTER, Long.toString(rateLimited.getRetryAfterSeconds()));
        }
        return response.body(body(ex.errorCode(), securityError ? null : ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            if (status.is4xxClientError()) {
                logger.info("Request rejected: {}", ex.getMessage());
                return ResponseEntity.status(status).body(body("invalid_request", ex.getMessage()));
            }
        }
        logger.error("Unexpected error while handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("internal_error", "Internal server error"));
    }

    static HttpStatus statusOf(CustodyException ex) {
        if (ex instanceof InvalidStateException
                || ex instanceof ConsentDeniedException
                || ex instanceof InvalidRequestException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof UnauthorizedCallerException) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (ex instanceof ForbiddenOriginException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof NotConnectedException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof ReauthRequiredException || ex instanceof DecryptionException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof RateLimitExceededException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        if (ex instanceof UpstreamTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        if (ex instanceof UpstreamExchangeException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        if (message != null) {
            body.put("message", message);
        }
        return body;
    }
}
