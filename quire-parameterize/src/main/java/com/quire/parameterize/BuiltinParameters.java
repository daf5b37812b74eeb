package com.quire.parameterize;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Adds run-scoped values under the {@value #KEY} parameter for path templating:
 * {@code run_uuid}, {@code current_datetime_local}, {@code current_datetime_utc}.
 */
public final class BuiltinParameters {

    public static final String KEY = "pm";

    private BuiltinParameters() {
    }

    public static Map<String, Object> add(Map<String, Object> parameters) {
        return add(parameters, Clock.systemDefaultZone());
    }

    /** Returns a copy of {@code parameters} (null = empty) with the builtin map added. */
    public static Map<String, Object> add(Map<String, Object> parameters, Clock clock) {
        Map<String, Object> out = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
        Map<String, Object> builtins = new LinkedHashMap<>();
        builtins.put("run_uuid", UUID.randomUUID().toString());
        builtins.put("current_datetime_local", LocalDateTime.now(clock).toString());
        builtins.put("current_datetime_utc", LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).toString());
        out.put(KEY, builtins);
        return out;
    }
}
