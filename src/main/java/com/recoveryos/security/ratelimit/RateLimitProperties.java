package com.recoveryos.security.ratelimit;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.AntPathMatcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Data
@ConfigurationProperties(prefix = "rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;
    private String clientKeySalt = "";
    /**
     * Idle time after which a client's window may be dropped. Zero keeps every
     * window for the life of the process. A window is never dropped sooner than
     * its own length after the last admission attempt.
     */
    private long idleEvictionSeconds = 0;
    private List<Rule> endpoints = new ArrayList<>();

    private final AntPathMatcher matcher = new AntPathMatcher();

    public Optional<Rule> match(String path, String method) {
        String normalizedMethod = method == null ? "" : method.toUpperCase(Locale.ROOT);
        for (Rule rule : endpoints) {
            if (matcher.match(rule.getPath(), path) && rule.allowsMethod(normalizedMethod)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public Duration idleEviction() {
        return idleEvictionSeconds <= 0 ? Duration.ZERO : Duration.ofSeconds(idleEvictionSeconds);
    }

    @Data
    public static class Rule {
        private String path = "";
        private List<String> methods = new ArrayList<>();
        private int windowSeconds = 60;
        private int maxRequests = 60;
        private String key;

        public boolean allowsMethod(String method) {
            if (methods == null || methods.isEmpty()) {
                return true;
            }
            return methods.stream().anyMatch(m -> m.equalsIgnoreCase(method));
        }

        public Duration window() {
            return Duration.ofSeconds(windowSeconds);
        }
    }
}
