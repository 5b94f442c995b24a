package com.songbook.common.web;

import com.songbook.common.api.ApiCodes;
import com.songbook.common.api.Result;
import com.songbook.common.error.AuthenticationRequiredException;
import com.songbook.common.error.ConflictException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.common.ratelimit.RateLimitExceededException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void handleNoResourceFound_ShouldReturn404ResultEnvelope() {
        ResponseEntity<Result<Void>> resp = handler.handleNoResourceFound(new NoResourceFoundException(HttpMethod.POST, "group/nope"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.NOT_FOUND);
    }

    @Test
    void governanceErrors_ShouldMapToStatusAndPassReasonThrough() {
        assertFailure(handler.handleUnauthorized(new UnauthorizedException("insufficient_seniority")),
                HttpStatus.FORBIDDEN, ApiCodes.FORBIDDEN, "insufficient_seniority");
        assertFailure(handler.handleAuthenticationRequired(new AuthenticationRequiredException("registered_user_required")),
                HttpStatus.UNAUTHORIZED, ApiCodes.UNAUTHORIZED, "registered_user_required");
        assertFailure(handler.handleNotFound(new NotFoundException("group_not_found")),
                HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND, "group_not_found");
        assertFailure(handler.handleInvalidState(new InvalidStateException("request_not_pending")),
                HttpStatus.CONFLICT, ApiCodes.INVALID_STATE, "request_not_pending");
        assertFailure(handler.handleConflict(new ConflictException(ConflictException.CONCURRENT_MODIFICATION)),
                HttpStatus.CONFLICT, ApiCodes.CONFLICT, "concurrent_modification");
    }

    @Test
    void handleBadRequest_ShouldFallBackToGenericReason() {
        assertFailure(handler.handleBadRequest(new IllegalArgumentException("missing_name")),
                HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST, "missing_name");
        assertFailure(handler.handleBadRequest(new IllegalArgumentException()),
                HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST, "bad_request");
    }

    @Test
    void handleRateLimit_ShouldSetRetryAfterHeader() {
        ResponseEntity<Result<Void>> resp = handler.handleRateLimit(new RateLimitExceededException("too_many_requests", 42));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(resp.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("42");
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.TOO_MANY_REQUESTS);
    }

    private static void assertFailure(ResponseEntity<Result<Void>> resp, HttpStatus status, int code, String reason) {
        assertThat(resp.getStatusCode()).isEqualTo(status);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(code);
        assertThat(resp.getBody().message()).isEqualTo(reason);
    }
}
