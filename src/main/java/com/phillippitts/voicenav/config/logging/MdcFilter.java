package com.phillippitts.voicenav.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Correlates REST-driven utterances in the log. Puts {@code requestId} (from X-Request-ID or a
 * fresh UUID), {@code method} and {@code uri} into the Log4j2 ThreadContext and echoes the
 * requestId back as a response header. The utterance executor copies this context to its
 * worker, so command logs carry the same requestId.
 *
 * <p>The context is cleared when the request completes.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID = "requestId";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        String requestId = requestId(http);
        try {
            ThreadContext.put(MDC_REQUEST_ID, requestId);
            ThreadContext.put("method", http.getMethod());
            ThreadContext.put("uri", http.getRequestURI());
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String requestId(HttpServletRequest http) {
        String supplied = http.getHeader(REQUEST_ID_HEADER);
        return supplied == null || supplied.isBlank() ? UUID.randomUUID().toString() : supplied.trim();
    }
}
