package express.mvp.resilience.event;

import java.util.Locale;

/**
 * Lifecycle events published by the resilience core.
 *
 * <p>{@link #ERROR}, {@link #RETRY} and {@link #RECOVERY} are delivered synchronously within the
 * call that produced them. Breaker transitions reported by the registry are delivered deferred.
 */
public enum EventType {

    /** An attempt failed. Carries the classified error. */
    ERROR("error"),

    /** A failed attempt will be retried. Carries the classified error. */
    RETRY("retry"),

    /** A call succeeded after at least one failed attempt. Carries a low-severity notice. */
    RECOVERY("recovery"),

    /** A breaker opened, or a call was rejected by an open breaker. */
    CIRCUIT_BREAKER_OPENED("circuit-breaker-opened"),

    /** A half-open breaker closed again. */
    CIRCUIT_BREAKER_CLOSED("circuit-breaker-closed");

    private final String eventName;

    EventType(String eventName) {
        this.eventName = eventName;
    }

    /**
     * Returns the event's name, e.g. {@code "circuit-breaker-opened"}.
     *
     * @return the event name
     */
    public String eventName() {
        return eventName;
    }

    /**
     * Looks up an event type by its name.
     *
     * @param eventName the event name, case-insensitive
     * @return the event type
     * @throws IllegalArgumentException if no event has that name
     */
    public static EventType fromEventName(String eventName) {
        String lower = eventName.toLowerCase(Locale.ROOT);
        for (EventType type : values()) {
            if (type.eventName.equals(lower)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event: " + eventName);
    }

    @Override
    public String toString() {
        return eventName;
    }
}
