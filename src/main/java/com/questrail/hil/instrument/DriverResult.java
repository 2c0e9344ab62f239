package com.questrail.hil.instrument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result code plus named outputs of one instrument call. Zero means success.
 */
public record DriverResult(int resultCode, Map<String, Object> outputs)
{
    public DriverResult {
        Objects.requireNonNull(outputs, "outputs");
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static DriverResult success()
    {
        return new DriverResult(0, Map.of());
    }

    public static DriverResult success(Map<String, Object> outputs)
    {
        return new DriverResult(0, outputs);
    }

    public boolean isSuccess()
    {
        return resultCode == 0;
    }

    public <T> T output(String key, Class<T> type)
    {
        Object value = outputs.get(key);
        if (value == null) {
            throw new IllegalArgumentException("no output named " + key);
        }
        return type.cast(value);
    }
}
