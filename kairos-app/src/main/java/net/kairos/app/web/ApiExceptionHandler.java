package net.kairos.app.web;

import net.kairos.core.error.ExecutionNotFoundException;
import net.kairos.core.error.ScheduleNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/** 오류 본문은 {"detail": ...} */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ScheduleNotFoundException.class)
    public ResponseEntity<Map<String, String>> scheduleNotFound(ScheduleNotFoundException e) {
        return detail(HttpStatus.NOT_FOUND, "Schedule " + e.scheduleId() + " not found");
    }

    @ExceptionHandler(ExecutionNotFoundException.class)
    public ResponseEntity<Map<String, String>> executionNotFound(ExecutionNotFoundException e) {
        return detail(HttpStatus.NOT_FOUND, "Execution " + e.executionId() + " not found");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> status(ResponseStatusException e) {
        return detail(HttpStatus.valueOf(e.getStatusCode().value()), e.getReason());
    }

    @ExceptionHandler(TypeMismatchException.class)
    public ResponseEntity<Map<String, String>> typeMismatch(TypeMismatchException e) {
        return detail(HttpStatus.BAD_REQUEST, "Invalid value for " + e.getPropertyName());
    }

    // 404(경로 없음), 405, 필수 파라미터 누락 등 스프링이 상태를 정해 둔 예외
    @ExceptionHandler({NoResourceFoundException.class,
                       HttpRequestMethodNotSupportedException.class,
                       MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, String>> framework(Exception e) {
        var status = HttpStatus.valueOf(((ErrorResponse) e).getStatusCode().value());
        return detail(status, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        return detail(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> unexpected(Exception e) {
        log.error("Request failed", e);
        return detail(HttpStatus.INTERNAL_SERVER_ERROR, e.toString());
    }

    private static ResponseEntity<Map<String, String>> detail(HttpStatus status, String detail) {
        return ResponseEntity.status(status).body(Map.of("detail", detail == null ? status.getReasonPhrase() : detail));
    }
}
