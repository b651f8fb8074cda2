package com.roomsignal.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.roomsignal.exception.ErrorType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound event. Serialized flat: {@code {"type": "...", <fields>}}.
 */
@JsonPropertyOrder({"type"})
public class SignalEvent {
    private final EventType type;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private SignalEvent(EventType type) {
        this.type = type;
    }

    public static SignalEvent of(EventType type) {
        return new SignalEvent(type);
    }

    public static SignalEvent error(ErrorType errorType, String message) {
        return of(EventType.ERROR)
                .with("errorType", errorType.getTag())
                .with("message", message);
    }

    public SignalEvent with(String name, Object value) {
        fields.put(name, value);
        return this;
    }

    public EventType getType() { return type; }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Object get(String name) {
        return fields.get(name);
    }

    @Override
    public String toString() {
        return type.getWireName() + fields.keySet();
    }
}
