package express.mvp.resilience.event;

import express.mvp.resilience.error.ClassifiedError;
import java.util.Objects;
import java.util.Optional;

/**
 * One published event.
 *
 * <p>Per-attempt events and the open-breaker rejection carry a {@link ClassifiedError}. Breaker
 * transitions reported by the registry carry only the service key.
 */
public final class ResilienceEvent {

    private final EventType type;
    private final String serviceKey;
    private final ClassifiedError error;

    private ResilienceEvent(EventType type, String serviceKey, ClassifiedError error) {
        this.type = Objects.requireNonNull(type, "type");
        this.serviceKey = Objects.requireNonNull(serviceKey, "serviceKey");
        this.error = error;
    }

    /**
     * Creates an event carrying a classified error.
     *
     * @param type the event type
     * @param error the error
     * @return the event
     */
    public static ResilienceEvent of(EventType type, ClassifiedError error) {
        Objects.requireNonNull(error, "error");
        return new ResilienceEvent(type, error.serviceKey(), error);
    }

    /**
     * Creates an event carrying only a service key.
     *
     * @param type the event type
     * @param serviceKey the breaker's key
     * @return the event
     */
    public static ResilienceEvent ofServiceKey(EventType type, String serviceKey) {
        return new ResilienceEvent(type, serviceKey, null);
    }

    public EventType type() {
        return type;
    }

    public String serviceKey() {
        return serviceKey;
    }

    public Optional<ClassifiedError> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return error != null
                ? "ResilienceEvent[" + type + ", " + error + "]"
                : "ResilienceEvent[" + type + ", " + serviceKey + "]";
    }
}
