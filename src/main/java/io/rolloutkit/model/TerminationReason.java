package io.rolloutkit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TerminationReason {
    CONTROL_PLANE_SIGNAL("control_plane_signal"),
    ENVIRONMENT_DONE("environment_done"),
    MAX_STEPS_REACHED("max_steps_reached"),
    INTERRUPTED("interrupted"),
    ERROR("error");

    private final String wireValue;

    TerminationReason(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static TerminationReason fromWire(String raw) {
        for (TerminationReason reason : values()) {
            if (reason.wireValue.equalsIgnoreCase(raw) || reason.name().equalsIgnoreCase(raw)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown termination reason: " + raw);
    }
}
