package io.botflow.core;

import io.botflow.core.kind.ChannelButtonLimit;
import io.botflow.core.kind.PayloadDefaults;
import io.botflow.core.schedule.ScheduleEvaluator;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.logging.Logger;

/// Configuration options for the flow editing environment.
///
/// ### Default Values
/// - `defaultTimezone`: `"America/Lima"` (used by schedules that declare none)
/// - `defaultButtonLimit`: `3`, the strictest channel limit (used by buttons nodes that
///   declare none)
/// - `openingHorizonDays`: `14` (how far next-opening searches look ahead)
///
/// ### Properties
/// | Key | Field |
/// |---|---|
/// | `botflow.scheduler.default-timezone` | `defaultTimezone` |
/// | `botflow.buttons.default-limit` | `defaultButtonLimit` |
/// | `botflow.scheduler.opening-horizon-days` | `openingHorizonDays` |
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link BotflowFactory}. Do not modify after environment
/// creation.
///
/// @see BotflowFactory#createEnvironment(BotflowConfig)
/// @see Builder
public class BotflowConfig {

    private static final Logger logger = Logger.getLogger(BotflowConfig.class.getName());

    public static final String DEFAULT_TIMEZONE_KEY = "botflow.scheduler.default-timezone";
    public static final String DEFAULT_BUTTON_LIMIT_KEY = "botflow.buttons.default-limit";
    public static final String OPENING_HORIZON_KEY = "botflow.scheduler.opening-horizon-days";

    private String defaultTimezone = PayloadDefaults.DEFAULT_TIMEZONE;
    private int defaultButtonLimit = ChannelButtonLimit.defaultLimit();
    private int openingHorizonDays = ScheduleEvaluator.DEFAULT_HORIZON_DAYS;

    /// Creates a configuration with default values.
    public BotflowConfig() {}

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    /// Returns the visible-button cap applied to buttons nodes that declare none.
    ///
    /// @return button limit, positive
    public int getDefaultButtonLimit() {
        return defaultButtonLimit;
    }

    public void setDefaultButtonLimit(int defaultButtonLimit) {
        this.defaultButtonLimit = defaultButtonLimit;
    }

    /// Returns how many days past the current one a next-opening search scans.
    ///
    /// @return horizon in days, not negative
    public int getOpeningHorizonDays() {
        return openingHorizonDays;
    }

    public void setOpeningHorizonDays(int openingHorizonDays) {
        this.openingHorizonDays = openingHorizonDays;
    }

    /// Reads a configuration from properties. Missing or blank keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a numeric key is not an integer
    public static BotflowConfig fromProperties(Properties properties) {
        BotflowConfig config = new BotflowConfig();
        String timezone = properties.getProperty(DEFAULT_TIMEZONE_KEY);
        if (timezone != null && !timezone.isBlank()) {
            config.defaultTimezone = timezone.trim();
        }
        config.defaultButtonLimit =
                intProperty(properties, DEFAULT_BUTTON_LIMIT_KEY, config.defaultButtonLimit);
        config.openingHorizonDays =
                intProperty(properties, OPENING_HORIZON_KEY, config.openingHorizonDays);
        return config;
    }

    /// Reads a configuration from a classpath properties resource.
    ///
    /// @param resource resource name, e.g. `"botflow.properties"`
    /// @return configuration from the resource, or the defaults if it does not exist
    /// @throws UncheckedIOException if the resource exists but cannot be read
    /// @throws IllegalArgumentException if a numeric key is not an integer
    public static BotflowConfig load(String resource) {
        ClassLoader loader = BotflowConfig.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("No " + resource + " on classpath, using defaults");
                return new BotflowConfig();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Property " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link BotflowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final BotflowConfig config = new BotflowConfig();

        public Builder defaultTimezone(String defaultTimezone) {
            config.defaultTimezone = defaultTimezone;
            return this;
        }

        public Builder defaultButtonLimit(int defaultButtonLimit) {
            config.defaultButtonLimit = defaultButtonLimit;
            return this;
        }

        public Builder openingHorizonDays(int openingHorizonDays) {
            config.openingHorizonDays = openingHorizonDays;
            return this;
        }

        /// Builds and returns the configured {@link BotflowConfig} instance.
        ///
        /// @return the configured instance, never null
        public BotflowConfig build() {
            return config;
        }
    }
}
