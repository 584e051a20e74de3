package com.heronix.fleet.model.enums;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.springframework.http.HttpMethod;

import com.fasterxml.jackson.annotation.JsonValue;
import com.heronix.fleet.model.domain.CommandRoute;

import lombok.Getter;

/**
 * Device types the controller accepts.
 *
 * The set is closed: a registration carrying any other type is rejected.
 * Each type owns the static table of commands the controller may forward to it.
 */
@Getter
public enum DeviceType {

    /**
     * Rear camera actuator
     */
    REAR_CAMERA("rear-camera", "Rear Camera", 1, Map.of(
            "up", new CommandRoute(HttpMethod.POST, "/api/v1/rear-camera/up"),
            "down", new CommandRoute(HttpMethod.POST, "/api/v1/rear-camera/down"),
            "status", new CommandRoute(HttpMethod.GET, "/api/v1/rear-camera/status"),
            "reset", new CommandRoute(HttpMethod.POST, "/api/v1/rear-camera/reset")
    ));

    /**
     * Code used on the wire (e.g. "rear-camera")
     */
    private final String code;

    /**
     * Display name for the type
     */
    private final String displayName;

    /**
     * Population limit used when no limit is configured
     */
    private final int defaultLimit;

    /**
     * Command name -> device API route, sorted by name
     */
    private final Map<String, CommandRoute> commands;

    DeviceType(String code, String displayName, int defaultLimit, Map<String, CommandRoute> commands) {
        this.code = code;
        this.displayName = displayName;
        this.defaultLimit = defaultLimit;
        this.commands = Collections.unmodifiableMap(new TreeMap<>(commands));
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Optional<CommandRoute> routeFor(String command) {
        if (command == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(commands.get(command));
    }

    public static Optional<DeviceType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }
}
