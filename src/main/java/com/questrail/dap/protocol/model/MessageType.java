package com.questrail.dap.protocol.model;

import java.util.Optional;

/**
 * Values of the {@code type} field of a protocol message.
 */
public enum MessageType {
    REQUEST("request"),
    RESPONSE("response"),
    EVENT("event");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the exact string used on the wire.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire {@code type} string.
     *
     * @return the matching type, or empty for {@code null} and unknown values
     */
    public static Optional<MessageType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
