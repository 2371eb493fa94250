package com.phillippitts.resumeguard.config.logging;

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
 * Tags every host call with the ids needed to follow it into recovery logs.
 *
 * <p>A visibility report or manual refresh arriving over HTTP may start a recovery run on the
 * recovery executor. The executor copies this ThreadContext onto the run's thread, where the
 * coordinator adds {@code recoveryRun}, so a run's log lines carry the {@code requestId} and
 * {@code consumerId} of the call that triggered it.
 *
 * <p>The request id is taken from {@code X-Request-ID} or generated, and echoed back on the
 * response so the host can quote it. {@code X-Consumer-ID} names the front-end component (the
 * same id it attaches with) and is optional. Header values are stripped of control characters
 * and capped before they reach the log pattern.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CONSUMER_ID_HEADER = "X-Consumer-ID";

    static final String REQUEST_ID = "requestId";
    static final String CONSUMER_ID = "consumerId";

    static final int MAX_ID_LENGTH = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = cleanId(http.getHeader(REQUEST_ID_HEADER));
                if (requestId == null) {
                    requestId = UUID.randomUUID().toString();
                }
                ThreadContext.put(REQUEST_ID, requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }

                String consumerId = cleanId(http.getHeader(CONSUMER_ID_HEADER));
                if (consumerId != null) {
                    ThreadContext.put(CONSUMER_ID, consumerId);
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    /** @return the header value without control characters, capped; {@code null} if nothing is left */
    static String cleanId(String raw) {
        if (raw == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(Math.min(raw.length(), MAX_ID_LENGTH));
        for (int i = 0; i < raw.length() && sb.length() < MAX_ID_LENGTH; i++) {
            char c = raw.charAt(i);
            if (!Character.isISOControl(c)) {
                sb.append(c);
            }
        }
        String cleaned = sb.toString().strip();
        return cleaned.isEmpty() ? null : cleaned;
    }
}
