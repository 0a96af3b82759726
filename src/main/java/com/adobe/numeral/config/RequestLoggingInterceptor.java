package com.adobe.numeral.config;

import com.adobe.numeral.filter.CorrelationIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Conversion request log.
 * 
 * Writes one line per conversion request to the {@code http.request} logger:
 * method, path with query string, status, duration and correlation id.
 * Failed requests log at WARN.
 */
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger("http.request");
    static final String START_TIME_ATTR = "numeral.requestStartNanos";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, 
                             Object handler) {
        request.setAttribute(START_TIME_ATTR, System.nanoTime());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object start = request.getAttribute(START_TIME_ATTR);
        long durationMillis = start instanceof Long startNanos
            ? (System.nanoTime() - startNanos) / 1_000_000
            : 0;

        String query = request.getQueryString();
        String path = query != null ? request.getRequestURI() + "?" + query : request.getRequestURI();
        int status = response.getStatus();
        String correlationId = MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);

        if (status >= 400) {
            log.warn("method={} path={} status={} duration={}ms correlationId={}",
                     request.getMethod(), path, status, durationMillis, correlationId);
        } else {
            log.info("method={} path={} status={} duration={}ms correlationId={}",
                     request.getMethod(), path, status, durationMillis, correlationId);
        }
    }
}
