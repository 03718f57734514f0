package com.recoveryos.security.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the anonymized rate-limit bucket for a request. Implementations
 * must never return the raw address or user agent.
 */
@FunctionalInterface
public interface ClientKeyStrategy {
    String generate(HttpServletRequest request);
}
