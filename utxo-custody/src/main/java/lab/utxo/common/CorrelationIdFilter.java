package lab.utxo.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a correlation id (caller supplied or generated) and the request's Idempotency-Key
 * into the MDC so every log line of a withdrawal can be traced back to the call that started it.
 */
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    public static final String MDC_CORRELATION_ID_KEY = "correlationId";
    public static final String MDC_IDEMPOTENCY_KEY = "idempotencyKey";
    public static final String MDC_REQUEST_KEY = "request";

    private static final int MAX_HEADER_LENGTH = 128;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(MDC_CORRELATION_ID_KEY, correlationId);
        MDC.put(MDC_REQUEST_KEY, request.getMethod() + " " + request.getRequestURI());
        String idempotencyKey = clean(request.getHeader(IDEMPOTENCY_KEY_HEADER));
        if (idempotencyKey != null) {
            MDC.put(MDC_IDEMPOTENCY_KEY, idempotencyKey);
        }
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_CORRELATION_ID_KEY);
            MDC.remove(MDC_REQUEST_KEY);
            MDC.remove(MDC_IDEMPOTENCY_KEY);
        }
    }

    private String resolveCorrelationId(String incoming) {
        String cleaned = clean(incoming);
        return cleaned == null ? UUID.randomUUID().toString() : cleaned;
    }

    // Header values end up in log lines; drop blanks and cap the length.
    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_HEADER_LENGTH ? trimmed.substring(0, MAX_HEADER_LENGTH) : trimmed;
    }
}
