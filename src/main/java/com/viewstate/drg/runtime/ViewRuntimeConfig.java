package com.viewstate.drg.runtime;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Tuning knobs of a {@link ViewRuntime}.
 *
 * Built in code with {@code ViewRuntimeConfig.builder()}, or read from a
 * properties resource (keys prefixed with {@code viewgraph.}).
 */
@Getter
@Builder
@Log4j2
public final class ViewRuntimeConfig {
    public static final String DEFAULT_RESOURCE = "viewgraph.properties";

    public enum WaitStrategyType {
        BLOCKING, SLEEPING, YIELDING, BUSY_SPIN;

        WaitStrategy create() {
            switch (this) {
                case SLEEPING:
                    return new SleepingWaitStrategy();
                case YIELDING:
                    return new YieldingWaitStrategy();
                case BUSY_SPIN:
                    return new BusySpinWaitStrategy();
                default:
                    return new BlockingWaitStrategy();
            }
        }
    }

    /** Mailbox capacity; must be a power of two. */
    @Builder.Default
    private final int ringBufferSize = 1024;

    /** Threads running async compute functions. */
    @Builder.Default
    private final int workerThreads = 4;

    @Builder.Default
    private final WaitStrategyType waitStrategy = WaitStrategyType.BLOCKING;

    @Builder.Default
    private final long shutdownTimeoutMillis = 5000;

    /** Minimum interval between two error logs for the same node. */
    @Builder.Default
    private final long errorLogIntervalMillis = 1000;

    public static ViewRuntimeConfig defaults() {
        return builder().build();
    }

    /** Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if absent. */
    public static ViewRuntimeConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static ViewRuntimeConfig load(String resource) {
        try (InputStream in = ViewRuntimeConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", resource);
                return defaults();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /**
     * @throws IllegalArgumentException on a malformed value
     */
    public static ViewRuntimeConfig fromProperties(Properties props) {
        ViewRuntimeConfig d = defaults();
        return builder()
                .ringBufferSize(intProp(props, "viewgraph.ringBufferSize", d.ringBufferSize))
                .workerThreads(intProp(props, "viewgraph.workerThreads", d.workerThreads))
                .waitStrategy(WaitStrategyType.valueOf(props.getProperty("viewgraph.waitStrategy",
                        d.waitStrategy.name()).trim().toUpperCase(Locale.ROOT)))
                .shutdownTimeoutMillis(longProp(props, "viewgraph.shutdownTimeoutMillis", d.shutdownTimeoutMillis))
                .errorLogIntervalMillis(longProp(props, "viewgraph.errorLogIntervalMillis", d.errorLogIntervalMillis))
                .build();
    }

    private static int intProp(Properties props, String key, int def) {
        String v = props.getProperty(key);
        if (v == null)
            return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + v, e);
        }
    }

    private static long longProp(Properties props, String key, long def) {
        String v = props.getProperty(key);
        if (v == null)
            return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + v, e);
        }
    }
}
