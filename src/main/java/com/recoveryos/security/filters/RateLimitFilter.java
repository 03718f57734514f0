package com.recoveryos.security.filters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recoveryos.config.RequestContext;
import com.recoveryos.security.ratelimit.ClientKeyStrategy;
import com.recoveryos.security.ratelimit.RateLimitDecision;
import com.recoveryos.security.ratelimit.RateLimitProperties;
import com.recoveryos.security.ratelimit.RateLimitService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimitProperties properties;
    private final RateLimitService service;
    private final ClientKeyStrategy clientKeyStrategy;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(
            RateLimitProperties properties,
            RateLimitService service,
            ClientKeyStrategy clientKeyStrategy,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.service = service;
        this.clientKeyStrategy = clientKeyStrategy;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        if (!properties.isEnabled()) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<RateLimitProperties.Rule> ruleOpt = properties.match(request.getRequestURI(), request.getMethod());
        if (ruleOpt.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        RateLimitDecision decision = service.check(ruleOpt.get(), clientKey(request));
        if (!decision.allowed()) {
            log.info("rate limited path={} retryAfter={}s", request.getRequestURI(), decision.retryAfterSeconds());
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setHeader("Retry-After", String.valueOf(decision.retryAfterSeconds()));
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getWriter(), Map.of(
                    "detail", "Too Many Requests. Try again in " + decision.retryAfterSeconds() + " second(s)."
            ));
            return;
        }

        filterChain.doFilter(request, response);
    }

    private String clientKey(HttpServletRequest request) {
        String clientKey = RequestContext.getClientKey();
        if (clientKey != null) {
            return clientKey;
        }
        return clientKeyStrategy.generate(request);
    }
}
