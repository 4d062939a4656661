package eu.hhmmss.devactivity.controller;

import eu.hhmmss.devactivity.validation.ActivityParseException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps report failures to JSON error bodies.
 *
 * Details are logged server-side under a reference ID; the response carries
 * the ID, the error code and a short message only.
 */
@ControllerAdvice
@Slf4j
public class ReportExceptionHandler {

    @ExceptionHandler(ActivityParseException.class)
    public ResponseEntity<Map<String, Object>> handleParseFailure(ActivityParseException exc,
                                                                  HttpServletRequest request) {
        String errorId = generateErrorId();

        log.warn("[Error ID: {}] Unparseable input ({}): {} - Path: {}",
                errorId, exc.getErrorCode(), exc.getMessage(), request.getRequestURI());

        return errorBody(HttpStatus.UNPROCESSABLE_ENTITY, exc.getErrorCode().name(),
                "The history text does not look like a git log. Reference ID: " + errorId, errorId);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException exc,
                                                                    HttpServletRequest request) {
        String errorId = generateErrorId();

        log.warn("[Error ID: {}] Unreadable request body: {} - Path: {}",
                errorId, exc.getMessage(), request.getRequestURI());

        return errorBody(HttpStatus.BAD_REQUEST, "UNREADABLE_REQUEST",
                "The request body could not be read. Reference ID: " + errorId, errorId);
    }

    private ResponseEntity<Map<String, Object>> errorBody(HttpStatus status, String code,
                                                          String message, String errorId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("code", code);
        body.put("message", message);
        body.put("errorId", errorId);
        body.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(body);
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString();
    }
}
