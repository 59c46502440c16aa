package com.taskflow.api.rest;

import com.taskflow.core.exception.CompletionFailedException;
import com.taskflow.core.exception.DependencyNotFoundException;
import com.taskflow.core.exception.InvalidPlanException;
import com.taskflow.core.exception.InvalidStateTransitionException;
import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.exception.PlanParseException;
import com.taskflow.core.exception.TaskflowException;
import com.taskflow.core.exception.WorkflowBusyException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps taskflow error codes to HTTP statuses with a uniform error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(TaskflowException.class)
    public ResponseEntity<ErrorResponse> handleTaskflowException(TaskflowException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getErrorCode());
        List<String> details = ex instanceof InvalidPlanException
            ? ((InvalidPlanException) ex).getViolations()
            : List.of();
        if (status.is5xxServerError()) {
            log.error("HTTP_ERROR path={}, method={}, traceId={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), traceId(), ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, traceId={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), traceId(), ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), details));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), traceId(), BAD_REQUEST, ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(BAD_REQUEST, ex.getMessage(), List.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, errorCode={}, errorMessage={}",
            request.getRequestURI(), request.getMethod(), traceId(), INTERNAL_ERROR, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(INTERNAL_ERROR, "Internal server error", List.of()));
    }

    static HttpStatus statusFor(String errorCode) {
        if (errorCode == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (errorCode) {
            case NotFoundException.ERROR_CODE -> HttpStatus.NOT_FOUND;
            case DependencyNotFoundException.ERROR_CODE -> HttpStatus.BAD_REQUEST;
            case InvalidStateTransitionException.ERROR_CODE, WorkflowBusyException.ERROR_CODE -> HttpStatus.CONFLICT;
            case InvalidPlanException.ERROR_CODE, PlanParseException.ERROR_CODE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CompletionFailedException.ERROR_CODE -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static String traceId() {
        String traceId = MDC.get("traceId");
        return traceId != null ? traceId : "-";
    }

    public record ErrorResponse(String code, String message, List<String> details) {}
}
