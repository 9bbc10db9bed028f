package net.kairos.agent.web;

import net.kairos.agent.task.TaskCommandUnavailableException;
import net.kairos.agent.task.TaskExecutionException;
import net.kairos.agent.task.TaskTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/** 오류 본문은 {"detail": ...}. 스케줄러는 detail 을 실행 기록의 오류로 남긴다 */
@RestControllerAdvice
public class AgentExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(AgentExceptionHandler.class);

    @ExceptionHandler(TaskTimeoutException.class)
    public ResponseEntity<Map<String, String>> timeout(TaskTimeoutException e) {
        return detail(HttpStatus.GATEWAY_TIMEOUT, e.getMessage());
    }

    @ExceptionHandler(TaskCommandUnavailableException.class)
    public ResponseEntity<Map<String, String>> unavailable(TaskCommandUnavailableException e) {
        log.error("{}", e.getMessage(), e.getCause());
        return detail(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(TaskExecutionException.class)
    public ResponseEntity<Map<String, String>> failed(TaskExecutionException e) {
        return detail(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> status(ResponseStatusException e) {
        return detail(HttpStatus.valueOf(e.getStatusCode().value()), e.getReason());
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<Map<String, String>> framework(Exception e) {
        return detail(HttpStatus.valueOf(((ErrorResponse) e).getStatusCode().value()), e.getMessage());
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
