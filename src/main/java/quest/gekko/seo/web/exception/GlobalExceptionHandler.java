package quest.gekko.seo.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.seo.exception.ConfigurationException;
import quest.gekko.seo.exception.NotConnectedException;
import quest.gekko.seo.exception.UpstreamApiException;
import quest.gekko.seo.web.dto.ErrorDTO;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorDTO> handleResponseStatusException(ResponseStatusException ex, HttpServletRequest request) {
        log.warn("Response status exception: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return error(HttpStatus.valueOf(ex.getStatusCode().value()), ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorDTO> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return error(HttpStatus.BAD_REQUEST, "Invalid request: " + ex.getMessage());
    }

    @ExceptionHandler(NotConnectedException.class)
    public ResponseEntity<ErrorDTO> handleNotConnected(NotConnectedException ex, HttpServletRequest request) {
        log.warn("{} for URL: {}", ex.getMessage(), request.getRequestURL());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorDTO> handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
        log.error("Configuration error: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(UpstreamApiException.class)
    public ResponseEntity<ErrorDTO> handleUpstream(UpstreamApiException ex, HttpServletRequest request) {
        log.warn("Upstream API returned {} for URL: {}", ex.status(), request.getRequestURL());
        log.debug("Upstream response body: {}", ex.responseBody());
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorDTO> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorDTO> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorDTO(message, status.value()));
    }
}
