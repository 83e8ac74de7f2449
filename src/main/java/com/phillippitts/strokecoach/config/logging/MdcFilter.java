package com.phillippitts.strokecoach.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with a correlation id in Log4j2's ThreadContext.
 *
 * <p>The id comes from {@code X-Request-ID} when the client sends one and is generated
 * otherwise. It is echoed in the response header so clients can quote it when an
 * error body asks them to. {@code method} and {@code uri} are added as well. Analysis
 * jobs add {@code jobId} on the worker thread; the pool decorator carries
 * {@code requestId} across.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_KEY = "requestId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = requestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            ThreadContext.put(REQUEST_ID_KEY, requestId);
            ThreadContext.put("method", request.getMethod());
            ThreadContext.put("uri", request.getRequestURI());
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String requestId(HttpServletRequest request) {
        String supplied = request.getHeader(REQUEST_ID_HEADER);
        // cap client-supplied ids; they end up in every log line
        if (supplied == null || supplied.isBlank() || supplied.length() > 64) {
            return UUID.randomUUID().toString();
        }
        return supplied.trim();
    }
}
