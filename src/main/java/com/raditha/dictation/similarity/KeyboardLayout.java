package com.raditha.dictation.similarity;

import java.util.Locale;

/**
 * Keyboard layouts known to {@link KeyboardProximity}.
 */
public enum KeyboardLayout {
    /** German layout (default for this tool) */
    QWERTZ,

    /** US/UK layout */
    QWERTY,

    /** French layout */
    AZERTY,

    /** Keys count as adjacent if they are neighbours on any known layout */
    AUTO;

    /**
     * Parse a layout name, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static KeyboardLayout fromString(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown keyboard layout: " + value, e);
        }
    }
}
