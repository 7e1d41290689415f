package com.vistaplan.orchestrator.api;

import com.vistaplan.orchestrator.api.dto.ErrorResponse;
import com.vistaplan.orchestrator.learning.RuleOverrideException;
import com.vistaplan.orchestrator.ledger.IllegalJobStateException;
import com.vistaplan.orchestrator.ledger.JobNotFoundException;
import com.vistaplan.orchestrator.ledger.LockLostException;
import com.vistaplan.orchestrator.phase.TransitionException;
import com.vistaplan.orchestrator.service.DispatchRefusedException;
import com.vistaplan.orchestrator.service.RunNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain exceptions to HTTP statuses with an {@code {error, kind, message}} body.
 *
 * Stack traces never leave the service: unknown errors are logged in full and
 * answered with a generic 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TransitionException.class)
    public ResponseEntity<ErrorResponse> transition(TransitionException ex, HttpServletRequest req) {
        HttpStatus status = switch (ex.getKind()) {
            case RUN_NOT_FOUND      -> HttpStatus.NOT_FOUND;
            case UNKNOWN_PHASE      -> HttpStatus.BAD_REQUEST;
            case ILLEGAL_TRANSITION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STALE_PHASE        -> HttpStatus.CONFLICT;
        };
        return respond(status, ex.getKind().name(), ex, req);
    }

    @ExceptionHandler({RunNotFoundException.class, JobNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(RuntimeException ex, HttpServletRequest req) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex, req);
    }

    @ExceptionHandler(DispatchRefusedException.class)
    public ResponseEntity<ErrorResponse> dispatchRefused(DispatchRefusedException ex, HttpServletRequest req) {
        return respond(HttpStatus.CONFLICT, ex.getReason().name(), ex, req);
    }

    @ExceptionHandler(LockLostException.class)
    public ResponseEntity<ErrorResponse> lockLost(LockLostException ex, HttpServletRequest req) {
        return respond(HttpStatus.CONFLICT, "LOCK_LOST", ex, req);
    }

    @ExceptionHandler(IllegalJobStateException.class)
    public ResponseEntity<ErrorResponse> jobState(IllegalJobStateException ex, HttpServletRequest req) {
        return respond(HttpStatus.CONFLICT, "ILLEGAL_JOB_STATE", ex, req);
    }

    @ExceptionHandler(RuleOverrideException.class)
    public ResponseEntity<ErrorResponse> ruleOverride(RuleOverrideException ex, HttpServletRequest req) {
        HttpStatus status = ex.getKind() == RuleOverrideException.Kind.RULE_NOT_FOUND
                ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
        return respond(status, ex.getKind().name(), ex, req);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> badRequest(Exception ex, HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex, req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unknown(Exception ex, HttpServletRequest req) {
        log.error("{} {} failed: {}", req.getMethod(), req.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase(),
                        "INTERNAL", "Internal error, see server logs"));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String kind,
                                                         Exception ex, HttpServletRequest req) {
        log.warn("{} {} -> {} {}: {}", req.getMethod(), req.getRequestURI(), status.value(), kind, ex.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.getReasonPhrase(), kind, truncate(ex.getMessage(), 500)));
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
