package io.github.byzatic.inproc_scheduler.config;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Loads {@link SchedulerConfig} from a properties file on the classpath.
 *
 * Optional keys (defaults in brackets):
 *  - scheduler.precisionMillis [100]
 *  - scheduler.minPrecisionMillis [2000]
 *  - scheduler.interruptOnChange [true]
 *  - scheduler.useAdaptiveDelay [true]
 *  - scheduler.noJobDelayMillis [5]
 */
public final class SchedulerConfigLoader {
    private final static Logger logger = LoggerFactory.getLogger(SchedulerConfigLoader.class);

    public static final String PRECISION_MILLIS = "scheduler.precisionMillis";
    public static final String MIN_PRECISION_MILLIS = "scheduler.minPrecisionMillis";
    public static final String INTERRUPT_ON_CHANGE = "scheduler.interruptOnChange";
    public static final String USE_ADAPTIVE_DELAY = "scheduler.useAdaptiveDelay";
    public static final String NO_JOB_DELAY_MILLIS = "scheduler.noJobDelayMillis";

    private SchedulerConfigLoader() {
    }

    public static @NotNull SchedulerConfig loadFromClasspath(@NotNull String fileName) {
        Properties props = new Properties();
        try (InputStream in = SchedulerConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                throw new IllegalStateException("Config file not found on classpath: " + fileName);
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config: " + fileName, e);
        }
        SchedulerConfig config = fromProperties(props);
        logger.debug("Loaded {} from {}", config, fileName);
        return config;
    }

    public static @NotNull SchedulerConfig fromProperties(@NotNull Properties props) {
        SchedulerConfig defaults = SchedulerConfig.defaults();
        return new SchedulerConfig.Builder()
                .precision(getMillis(props, PRECISION_MILLIS, defaults.getPrecision()))
                .minPrecision(getMillis(props, MIN_PRECISION_MILLIS, defaults.getMinPrecision()))
                .interruptOnChange(getBoolean(props, INTERRUPT_ON_CHANGE, defaults.isInterruptOnChange()))
                .useAdaptiveDelay(getBoolean(props, USE_ADAPTIVE_DELAY, defaults.isUseAdaptiveDelay()))
                .noJobDelay(getMillis(props, NO_JOB_DELAY_MILLIS, defaults.getNoJobDelay()))
                .build();
    }

    private static Duration getMillis(Properties props, String key, Duration fallback) {
        String value = props.getProperty(key);
        if (value == null) return fallback;
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Config key " + key + " is not a number: " + value, e);
        }
    }

    private static boolean getBoolean(Properties props, String key, boolean fallback) {
        String value = props.getProperty(key);
        if (value == null) return fallback;
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new IllegalStateException("Config key " + key + " is not a boolean: " + value);
    }
}
