package org.l3.morpho.cascade;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration for compiling and running a Cascade.
 */
public class Configuration {

    public static final long DEFAULT_MAX_STEPS = 1_000_000L;

    /**
     * The largest number of search steps a single analysis or generation may take. Entering a state at an input
     * position, extending a partial output by one arc and feeding a string to a stage each count as one step. When
     * the steps are used up, the results found so far are returned and a warning is logged.
     */
    private final long maxSteps;

    /**
     * Wall-clock limit for a single analysis or generation, or null for none. Behaves like maxSteps when exceeded.
     */
    private final Duration timeout;

    /**
     * Weighting modes usable in {@code weighting = NAME} besides the built-in ones, keyed by upper-case name.
     */
    private final Map<String, Weighting<?>> weightings;

    private Configuration(final long maxSteps, @Nullable final Duration timeout,
                          final Map<String, Weighting<?>> weightings) {
        this.maxSteps = maxSteps;
        this.timeout = timeout;
        this.weightings = Collections.unmodifiableMap(new LinkedHashMap<>(weightings));
    }

    public static Configuration defaults() {
        return new Builder().build();
    }

    public long getMaxSteps() {
        return maxSteps;
    }

    @Nullable
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Find a weighting mode by name, ignoring case. Registered modes take precedence over built-in ones.
     *
     * @return the mode, or null if there is none with this name
     */
    @Nullable
    public Weighting<?> getWeighting(final String name) {
        String key = name.toUpperCase(Locale.ROOT);
        Weighting<?> registered = weightings.get(key);
        if (registered != null) {
            return registered;
        }
        switch (key) {
            case UnificationWeighting.NAME:
                return UnificationWeighting.INSTANCE;
            case ProbabilityWeighting.NAME:
                return ProbabilityWeighting.INSTANCE;
            case TropicalWeighting.NAME:
                return TropicalWeighting.INSTANCE;
            default:
                return null;
        }
    }

    public static class Builder {

        private long maxSteps = DEFAULT_MAX_STEPS;
        private Duration timeout = null;
        private final Map<String, Weighting<?>> weightings = new LinkedHashMap<>();

        public Builder withMaxSteps(long maxSteps) {
            if (maxSteps <= 0) {
                throw new IllegalArgumentException("maxSteps must be positive but was " + maxSteps);
            }
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder withTimeout(@Nullable Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive but was " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder withWeighting(Weighting<?> weighting) {
            weightings.put(weighting.name().toUpperCase(Locale.ROOT), weighting);
            return this;
        }

        public Configuration build() {
            return new Configuration(maxSteps, timeout, weightings);
        }
    }
}
