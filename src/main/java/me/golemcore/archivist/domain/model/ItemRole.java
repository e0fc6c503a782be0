package me.golemcore.archivist.domain.model;

import java.util.Locale;

/**
 * Author of a raw conversation turn.
 */
public enum ItemRole {
    USER, ASSISTANT;

    /**
     * Lenient parsing for inbound payloads: anything but "assistant" is a user
     * turn.
     */
    public static ItemRole fromString(String value) {
        if (value != null && "assistant".equals(value.trim().toLowerCase(Locale.ROOT))) {
            return ASSISTANT;
        }
        return USER;
    }
}
