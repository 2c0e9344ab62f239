package com.questrail.hil.config;

import com.questrail.hil.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DriverArguments
 * -----------------------------------------------------------------------------
 * Flat, already-resolved key/value namespace handed to an instrument by the
 * orchestration layer. Keys are long option names without the leading
 * dashes, such as {@code bk-port} or {@code lw-gather-timeout}. Values are kept
 * as text and converted on read. Durations are fractional seconds.
 *
 * <p>Absent keys and blank values read as empty.</p>
 */
public final class DriverArguments
{
    private static final DriverArguments EMPTY = new DriverArguments(Map.of());

    private final Map<String, String> values;

    private DriverArguments(Map<String, String> values)
    {
        this.values = values;
    }

    public static DriverArguments empty()
    {
        return EMPTY;
    }

    public static DriverArguments of(Map<String, ?> values)
    {
        Objects.requireNonNull(values, "values");
        Map<String, String> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null) {
                copy.put(Objects.requireNonNull(key, "key"), value.toString());
            }
        });
        return new DriverArguments(Collections.unmodifiableMap(copy));
    }

    /**
     * A copy with {@code key} set; a {@code null} value removes the key.
     */
    public DriverArguments with(String key, Object value)
    {
        Map<String, String> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(Objects.requireNonNull(key, "key"), value.toString());
        }
        return new DriverArguments(Collections.unmodifiableMap(copy));
    }

    public boolean contains(String key)
    {
        return getString(key).isPresent();
    }

    public Optional<String> getString(String key)
    {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    /**
     * Raw value, blanks included. Used for arguments whose meaningful values
     * are whitespace, such as a disruption string.
     */
    public Optional<String> getRaw(String key)
    {
        return Optional.ofNullable(values.get(key));
    }

    public String requireString(String key)
    {
        return getString(key).orElseThrow(() -> missing(key));
    }

    public Optional<Integer> getInt(String key)
    {
        return getString(key).map(value -> {
            try {
                return Integer.valueOf(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + key + " must be an integer, got " + value, e);
            }
        });
    }

    public int requireInt(String key)
    {
        return getInt(key).orElseThrow(() -> missing(key));
    }

    public Optional<Double> getDouble(String key)
    {
        return getString(key).map(value -> {
            try {
                return Double.valueOf(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + key + " must be a number, got " + value, e);
            }
        });
    }

    /**
     * Fractional seconds as a {@link Duration}.
     */
    public Optional<Duration> getSeconds(String key)
    {
        return getDouble(key).map(seconds -> {
            try {
                return MonotonicClock.ofSeconds(seconds);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("--" + key + ": " + e.getMessage(), e);
            }
        });
    }

    public Map<String, String> asMap()
    {
        return values;
    }

    private static IllegalArgumentException missing(String key)
    {
        return new IllegalArgumentException("missing required argument --" + key);
    }

    @Override
    public String toString()
    {
        return "DriverArguments" + values;
    }
}
