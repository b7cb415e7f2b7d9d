package lab.utxo.common;

import jakarta.servlet.http.HttpServletRequest;
import lab.utxo.adapter.LedgerApiException;
import lab.utxo.adapter.LedgerNotConfiguredException;
import lab.utxo.orchestration.IdempotencyConflictException;
import lab.utxo.orchestration.InsufficientFundsException;
import lab.utxo.orchestration.InvalidRequestException;
import lab.utxo.orchestration.WithdrawalException;
import lab.utxo.orchestration.WithdrawalNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.regex.Pattern;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // Keys, views and signatures are long hex strings; never echo them back.
    private static final Pattern SENSITIVE_HEX_PATTERN = Pattern.compile("(0x)?[a-fA-F0-9]{64,}");

    @ExceptionHandler(WithdrawalException.class)
    public ResponseEntity<ErrorResponse> handleWithdrawal(WithdrawalException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex);
        if (ex instanceof InsufficientFundsException insufficient) {
            log.info("event=api.insufficient_funds available={} required={}",
                    insufficient.getAvailable().toPlainString(), insufficient.getRequired().toPlainString());
        }
        return respond(status, ex.getCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(LedgerNotConfiguredException.class)
    public ResponseEntity<ErrorResponse> handleNotConfigured(LedgerNotConfiguredException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "LEDGER_NOT_CONFIGURED", ex.getMessage(), request);
    }

    @ExceptionHandler(LedgerApiException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerApiException ex, HttpServletRequest request) {
        log.warn("event=api.ledger_error path={} ledgerCode={} message={}",
                request.getRequestURI(), ex.getCode(), sanitizeMessage(ex.getMessage()));
        return respond(HttpStatus.BAD_GATEWAY, "LEDGER_ERROR", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String message = "Invalid value '%s' for parameter '%s'".formatted(ex.getValue(), ex.getName());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        String message = "Invalid JSON body.";
        if (detail != null && !detail.isBlank()) {
            message += " Detail: " + detail;
        }
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message, request);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Missing required header: " + ex.getHeaderName(), request);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleRuntimeException(RuntimeException ex, HttpServletRequest request) {
        log.error("event=api.unexpected_error path={} type={}", request.getRequestURI(), ex.getClass().getName(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage(), request);
    }

    static HttpStatus statusOf(WithdrawalException ex) {
        if (ex instanceof InvalidRequestException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof IdempotencyConflictException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof WithdrawalNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(status.value(), code, sanitizeMessage(message), request.getRequestURI());
        return ResponseEntity.status(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body);
    }

    static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Unexpected server error";
        }
        return SENSITIVE_HEX_PATTERN.matcher(message).replaceAll("[REDACTED]");
    }

    public record ErrorResponse(
            int status,
            String code,
            String message,
            String path
    ) {}
}
