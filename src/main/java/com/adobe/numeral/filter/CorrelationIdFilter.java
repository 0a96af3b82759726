package com.adobe.numeral.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * HTTP filter that tags every request with a correlation ID.
 * 
 * <p>An incoming {@code X-Correlation-ID} header is reused when it is present
 * and reasonably short; otherwise an 8-character id is generated. The id is put
 * in the MDC under {@code correlationId} (picked up by the log pattern and the
 * error handler) and echoed in the response header.</p>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@Component
@Order(0)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    /** Incoming ids longer than this are replaced. */
    static final int MAX_INCOMING_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        try {
            response.addHeader(CORRELATION_ID_HEADER, correlationId);
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * Returns the incoming id if usable, a fresh short UUID otherwise.
     * 
     * @param incoming the header value, may be null
     * @return the correlation ID
     */
    static String resolveCorrelationId(String incoming) {
        if (incoming == null || incoming.isBlank() || incoming.length() > MAX_INCOMING_LENGTH) {
            return UUID.randomUUID().toString().substring(0, 8);
        }
        return incoming.strip();
    }
}
