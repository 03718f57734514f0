package com.recoveryos.config;

import com.recoveryos.security.ratelimit.ClientKeyStrategy;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts the request id in the logging MDC, binds the anonymized client key to
 * the handling thread and writes one access line per request. Bodies and
 * addresses are never logged.
 */
@Slf4j
public class RequestContextFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";

    private final ClientKeyStrategy clientKeyStrategy;

    public RequestContextFilter(ClientKeyStrategy clientKeyStrategy) {
        this.clientKeyStrategy = clientKeyStrategy;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (!StringUtils.hasText(requestId)) {
            requestId = UUID.randomUUID().toString();
        }
        long start = System.nanoTime();
        try {
            RequestContext.setClientKey(clientKeyStrategy.generate(request));
            MDC.put(MDC_REQUEST_ID, requestId);
            response.setHeader(REQUEST_ID_HEADER, requestId);
            filterChain.doFilter(request, response);
        } catch (ServletException | IOException | RuntimeException ex) {
            log.error("request failed path={} method={} error={}",
                    request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName());
            throw ex;
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            log.info("access path={} method={} status={} durationMs={}",
                    request.getRequestURI(), request.getMethod(), response.getStatus(), durationMs);
            MDC.remove(MDC_REQUEST_ID);
            RequestContext.clear();
        }
    }
}
