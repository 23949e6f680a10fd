package org.sqltx.retry;

import org.sqltx.commons.SqlStates;
import org.sqltx.commons.config.PropertyResolver;
import org.sqltx.commons.constants.CommonConstants;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable retry settings for {@link RetryingTransactionManager}.
 *
 * <pre>
 * RetryConfig config = RetryConfig.builder()
 *     .maxRetries(10)
 *     .baseBackoff(Duration.ofMillis(200))
 *     .build();
 * </pre>
 *
 * The backoff before retry {@code n} (1-based) is {@code min(maxBackoff, baseBackoff * 2^(n-1))}.
 */
public final class RetryConfig {

    public static final int DEFAULT_MAX_RETRIES = CommonConstants.DEFAULT_MAX_RETRIES;
    public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofMillis(CommonConstants.DEFAULT_BASE_BACKOFF_MS);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMillis(CommonConstants.DEFAULT_MAX_BACKOFF_MS);
    public static final Set<String> DEFAULT_RETRYABLE_SQL_STATES = Set.of(SqlStates.SERIALIZATION_FAILURE);

    private final int maxRetries;
    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final Set<String> retryableSqlStates;

    private RetryConfig(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.baseBackoff = builder.baseBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.retryableSqlStates = Collections.unmodifiableSet(new LinkedHashSet<>(builder.retryableSqlStates));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the settings from JVM properties or environment variables, falling back to the
     * defaults.
     */
    public static RetryConfig fromProperties() {
        return fromProperties(new Properties());
    }

    /**
     * Same as {@link #fromProperties()} with {@code properties} consulted last.
     */
    public static RetryConfig fromProperties(Properties properties) {
        PropertyResolver resolver = new PropertyResolver(properties);
        Builder builder = builder()
                .maxRetries(resolver.getInt(CommonConstants.RETRY_MAX_RETRIES_PROPERTY, DEFAULT_MAX_RETRIES))
                .baseBackoff(Duration.ofMillis(resolver.getLong(CommonConstants.RETRY_BASE_BACKOFF_MS_PROPERTY,
                        CommonConstants.DEFAULT_BASE_BACKOFF_MS)))
                .maxBackoff(Duration.ofMillis(resolver.getLong(CommonConstants.RETRY_MAX_BACKOFF_MS_PROPERTY,
                        CommonConstants.DEFAULT_MAX_BACKOFF_MS)));
        List<String> states = resolver.getList(CommonConstants.RETRY_SQL_STATES_PROPERTY, List.of());
        if (!states.isEmpty()) {
            builder.retryableSqlStates(new LinkedHashSet<>(states));
        }
        return builder.build();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getBaseBackoff() {
        return baseBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public Set<String> getRetryableSqlStates() {
        return retryableSqlStates;
    }

    /**
     * @param retry 1 for the first retry
     * @return the delay before that retry, in milliseconds
     */
    public long backoffMillis(int retry) {
        if (retry <= 0) {
            return 0L;
        }
        long base = baseBackoff.toMillis();
        long max = maxBackoff.toMillis();
        if (base == 0) {
            return 0L;
        }
        // Shift would overflow or exceed the cap
        if (retry > 62 || (1L << (retry - 1)) > max / base) {
            return max;
        }
        return Math.min(max, base << (retry - 1));
    }

    @Override
    public String toString() {
        return "RetryConfig{" +
                "maxRetries=" + maxRetries +
                ", baseBackoff=" + baseBackoff +
                ", maxBackoff=" + maxBackoff +
                ", retryableSqlStates=" + retryableSqlStates +
                '}';
    }

    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration baseBackoff = DEFAULT_BASE_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private Set<String> retryableSqlStates = DEFAULT_RETRYABLE_SQL_STATES;

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseBackoff(Duration baseBackoff) {
            this.baseBackoff = baseBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder retryableSqlStates(Set<String> retryableSqlStates) {
            this.retryableSqlStates = retryableSqlStates;
            return this;
        }

        public RetryConfig build() {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
            }
            if (baseBackoff == null || baseBackoff.isNegative()) {
                throw new IllegalArgumentException("baseBackoff must be a non-negative duration");
            }
            if (maxBackoff == null || maxBackoff.isNegative()) {
                throw new IllegalArgumentException("maxBackoff must be a non-negative duration");
            }
            if (maxBackoff.compareTo(baseBackoff) < 0) {
                throw new IllegalStateException("maxBackoff (" + maxBackoff + ") cannot be shorter than baseBackoff ("
                        + baseBackoff + ")");
            }
            if (retryableSqlStates == null || retryableSqlStates.isEmpty()) {
                throw new IllegalArgumentException("at least one retryable SQLSTATE is required");
            }
            return new RetryConfig(this);
        }
    }
}
