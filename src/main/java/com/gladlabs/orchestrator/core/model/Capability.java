package com.gladlabs.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of agent capabilities a phase can be assigned to.
 * A provider advertises the capabilities it serves well; phases name one as their {@code agent}.
 */
public enum Capability {
    RESEARCH("research"),
    CONTENT("content"),
    QA("qa"),
    IMAGE("image"),
    PUBLISH("publish");

    private final String id;

    Capability(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public static Optional<Capability> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(c -> c.id.equals(normalized)).findFirst();
    }

    @JsonCreator
    public static Capability require(String value) {
        return fromId(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown capability: " + value));
    }
}
