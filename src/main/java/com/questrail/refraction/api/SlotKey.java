package com.questrail.refraction.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * SlotKey
 * -----------------------------------------------------------------------------
 * Closed vocabulary of slot keys a classifier may fill for a turn.
 *
 * <p>Slot <em>values</em> remain strings because the accepted values are a
 * per-step concern declared by the protocol table.</p>
 */
public enum SlotKey
{
    /** Lens pair / JCC flip / binocular comparison answer. */
    CLARITY_FEEDBACK("clarity_feedback"),

    /** Duochrome (red/green) answer. */
    COLOR_PREFERENCE("color_preference"),

    COMFORT("comfort"),
    HEALTH_STATUS("health_status"),
    READING_ABILITY("reading_ability");

    private final String key;

    SlotKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<SlotKey> fromKey(String key) {
        Objects.requireNonNull(key, "key");
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (SlotKey slot : values()) {
            if (slot.key.equals(normalized)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }
}
