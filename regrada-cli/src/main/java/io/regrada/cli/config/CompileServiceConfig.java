package io.regrada.cli.config;

import java.util.Objects;
import org.eclipse.microprofile.config.Config;

/// Settings of the compile-service client.
///
/// ### Properties
/// | property | default |
/// |---|---|
/// | `regrada.compile.url` | `http://localhost:8080` |
/// | `regrada.compile.poll-attempts` | `10` |
/// | `regrada.compile.poll-interval-ms` | `500` |
/// | `regrada.compile.timeout-ms` | `10000` |
///
/// @implNote Thread-safe. All fields are immutable after construction.
/// @see io.regrada.cli.compile.HttpCompileService
public final class CompileServiceConfig {

    public static final String URL = "regrada.compile.url";
    public static final String POLL_ATTEMPTS = "regrada.compile.poll-attempts";
    public static final String POLL_INTERVAL_MS = "regrada.compile.poll-interval-ms";
    public static final String TIMEOUT_MS = "regrada.compile.timeout-ms";

    private final String url;
    private final int pollAttempts;
    private final long pollIntervalMs;
    private final long timeoutMs;

    private CompileServiceConfig(Builder builder) {
        this.url = Objects.requireNonNull(builder.url, "URL required");
        this.pollAttempts = builder.pollAttempts;
        this.pollIntervalMs = builder.pollIntervalMs;
        this.timeoutMs = builder.timeoutMs;
    }

    /// Reads the settings from a MicroProfile config, falling back to the defaults.
    ///
    /// @param config source of the `regrada.compile.*` properties, not null
    /// @return settings, never null
    /// @throws IllegalStateException if a value is out of range
    public static CompileServiceConfig from(Config config) {
        Builder builder = builder();
        config.getOptionalValue(URL, String.class).ifPresent(builder::url);
        config.getOptionalValue(POLL_ATTEMPTS, Integer.class).ifPresent(builder::pollAttempts);
        config.getOptionalValue(POLL_INTERVAL_MS, Long.class).ifPresent(builder::pollIntervalMs);
        config.getOptionalValue(TIMEOUT_MS, Long.class).ifPresent(builder::timeoutMs);
        return builder.build();
    }

    /// Returns the service base URL, without a trailing slash.
    public String getUrl() {
        return url;
    }

    /// Returns how many times the result endpoint is polled before giving up.
    public int getPollAttempts() {
        return pollAttempts;
    }

    /// Returns the wait before each poll.
    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    /// Returns the connect and per-request timeout.
    public long getTimeoutMs() {
        return timeoutMs;
    }

    public Builder toBuilder() {
        return builder()
                .url(url)
                .pollAttempts(pollAttempts)
                .pollIntervalMs(pollIntervalMs)
                .timeoutMs(timeoutMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CompileServiceConfig{url=" + url + ", pollAttempts=" + pollAttempts
                + ", pollIntervalMs=" + pollIntervalMs + ", timeoutMs=" + timeoutMs + "}";
    }

    /// Fluent builder for [CompileServiceConfig].
    public static final class Builder {
        private String url = "http://localhost:8080";
        private int pollAttempts = 10;
        private long pollIntervalMs = 500;
        private long timeoutMs = 10_000;

        private Builder() {}

        /// @param url base URL; a trailing slash is removed
        public Builder url(String url) {
            this.url = url == null ? null : stripTrailingSlash(url.trim());
            return this;
        }

        public Builder pollAttempts(int pollAttempts) {
            this.pollAttempts = pollAttempts;
            return this;
        }

        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        /// Builds the settings.
        ///
        /// @throws IllegalStateException if the URL is blank or a number is out of range
        public CompileServiceConfig build() {
            validate();
            return new CompileServiceConfig(this);
        }

        private void validate() {
            if (url == null || url.isBlank()) {
                throw new IllegalStateException("Compile service URL must not be blank");
            }
            if (pollAttempts < 1) {
                throw new IllegalStateException("Poll attempts must be at least 1, got " + pollAttempts);
            }
            if (pollIntervalMs < 0) {
                throw new IllegalStateException("Poll interval must not be negative, got " + pollIntervalMs);
            }
            if (timeoutMs < 1) {
                throw new IllegalStateException("Timeout must be positive, got " + timeoutMs);
            }
        }

        private static String stripTrailingSlash(String value) {
            String result = value;
            while (result.endsWith("/")) {
                result = result.substring(0, result.length() - 1);
            }
            return result;
        }
    }
}
