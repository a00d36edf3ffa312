package dev.mlagents.config;

import java.time.Duration;
import java.time.temporal.TemporalUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

class BaseConfig {
    /** Sentinel used to set null in the env. Only used for testing. */
    static final String NULL_OVERRIDE = "MLAGENTS_NULL_SENTINEL_" + System.currentTimeMillis();

    protected final Map<String, String> envOverrides;

    BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    protected <T> @Nonnull T getConfig(@Nonnull String settingName, @Nonnull T defaultValue) {
        Objects.requireNonNull(defaultValue);
        return Objects.requireNonNull(
                getConfig(settingName, defaultValue, (Class<T>) defaultValue.getClass()));
    }

    protected <T> @Nullable T getConfig(
            @Nonnull String settingName, @Nullable T defaultValue, @Nonnull Class<T> settingClass) {
        @Nullable String rawVal = getEnvValue(settingName);
        if (rawVal == null || rawVal.isBlank()) {
            return defaultValue;
        }
        try {
            return cast(rawVal.trim(), settingClass);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "%s must be a %s but was '%s'"
                            .formatted(settingName, settingClass.getSimpleName(), rawVal),
                    e);
        }
    }

    /** A positive whole-number setting. */
    protected int getPositiveConfig(@Nonnull String settingName, int defaultValue) {
        int value = getConfig(settingName, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException(
                    "%s must be positive but was %d".formatted(settingName, value));
        }
        return value;
    }

    /** A duration given as a non-negative number of {@code unit}s. */
    protected @Nonnull Duration getDurationConfig(
            @Nonnull String settingName, long defaultAmount, @Nonnull TemporalUnit unit) {
        long amount = getConfig(settingName, defaultAmount);
        if (amount < 0) {
            throw new IllegalArgumentException(
                    "%s must not be negative but was %d".formatted(settingName, amount));
        }
        return Duration.of(amount, unit);
    }

    protected @Nonnull String getRequiredConfig(@Nonnull String settingName) {
        return getRequiredConfig(settingName, String.class);
    }

    protected @Nonnull <T> T getRequiredConfig(String settingName, Class<T> settingClass) {
        T value = getConfig(settingName, null, settingClass);
        if (null == value) {
            throw new IllegalArgumentException("%s is required".formatted(settingName));
        }
        return value;
    }

    protected <T> T cast(@Nonnull String value, @Nonnull Class<T> clazz) {
        if (clazz.equals(String.class)) {
            return (T) value;
        } else if (List.of(Boolean.class, boolean.class).contains(clazz)) {
            return (T) Boolean.valueOf(value);
        } else if (List.of(Integer.class, int.class).contains(clazz)) {
            return (T) Integer.valueOf(value);
        } else if (List.of(Long.class, long.class).contains(clazz)) {
            return (T) Long.valueOf(value);
        } else if (List.of(Double.class, double.class).contains(clazz)) {
            return (T) Double.valueOf(value);
        } else {
            throw new IllegalArgumentException(
                    "Unsupported setting class: %s -- please implement or use a different default"
                            .formatted(clazz));
        }
    }

    protected @Nullable String getEnvValue(@Nonnull String settingName) {
        // first try the override map
        var settingValue = envOverrides.get(settingName);
        if (settingValue == null) {
            // then get it from the sysenv
            settingValue = System.getenv(settingName);
        }
        return NULL_OVERRIDE.equals(settingValue) ? null : settingValue;
    }
}
