package com.songbook.common.web;

import com.songbook.common.api.ApiCodes;
import com.songbook.common.api.Result;
import com.songbook.common.error.AuthenticationRequiredException;
import com.songbook.common.error.ConflictException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.common.ratelimit.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理：把引擎的错误分类“翻译”为统一的 Result JSON 和对应的 HTTP 状态码。
 *
 * <p>message 原样透传原因码，不拼接展示文案。</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ResponseEntity<Result<Void>> handleAuthenticationRequired(AuthenticationRequiredException e) {
        return fail(HttpStatus.UNAUTHORIZED, ApiCodes.UNAUTHORIZED, e.reason());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Result<Void>> handleUnauthorized(UnauthorizedException e) {
        return fail(HttpStatus.FORBIDDEN, ApiCodes.FORBIDDEN, e.reason());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Result<Void>> handleNotFound(NotFoundException e) {
        return fail(HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND, e.reason());
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<Result<Void>> handleInvalidState(InvalidStateException e) {
        return fail(HttpStatus.CONFLICT, ApiCodes.INVALID_STATE, e.reason());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Result<Void>> handleConflict(ConflictException e) {
        return fail(HttpStatus.CONFLICT, ApiCodes.CONFLICT, e.reason());
    }

    /**
     * Spring Validation（@Valid）触发的参数错误，取第一条即可。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getAllErrors().isEmpty()
                ? "invalid_request"
                : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return fail(HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST, msg);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Result<Void>> handleBadParameter(Exception e) {
        return fail(HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST, "bad_request");
    }

    /**
     * 输入本身不合法（空名称、非法枚举值等），service 层用 IllegalArgumentException 表达。
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleBadRequest(IllegalArgumentException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "bad_request" : e.getMessage();
        return fail(HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST, msg);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Result<Void>> handleRateLimit(RateLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(Result.fail(ApiCodes.TOO_MANY_REQUESTS, e.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Result<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return fail(HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND, "not_found");
    }

    /**
     * 兜底：避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled exception", e);
        return fail(HttpStatus.INTERNAL_SERVER_ERROR, ApiCodes.INTERNAL_ERROR, "internal_error");
    }

    private static ResponseEntity<Result<Void>> fail(HttpStatus status, int code, String reason) {
        return ResponseEntity.status(status).body(Result.fail(code, reason));
    }
}
