package express.mvp.resilience;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Describes one logical call site protected by the resilience core.
 *
 * <p>A context names the remote service and the operation being invoked. The pair forms the
 * {@linkplain #serviceKey() service key} that scopes one circuit breaker. An optional correlation
 * id (for example a project id) and free-form metadata travel with every classified error so that
 * event consumers can attribute failures.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * OperationContext context = OperationContext.builder("task-api", "create-task")
 *     .correlationId("project-42")
 *     .metadata("endpoint", "/tasks")
 *     .build();
 *
 * Task task = resilience.execute(() -> client.createTask(request), context);
 * }</pre>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class OperationContext {

    private final String service;
    private final String operation;
    private final String correlationId;
    private final Integer maxAttempts;
    private final Map<String, Object> metadata;

    private OperationContext(Builder builder) {
        this.service = builder.service;
        this.operation = builder.operation;
        this.correlationId = builder.correlationId;
        this.maxAttempts = builder.maxAttempts;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /**
     * Creates a context with no correlation id, attempt override or metadata.
     *
     * @param service the remote service name
     * @param operation the operation name
     * @return a new context
     */
    public static OperationContext of(String service, String operation) {
        return builder(service, operation).build();
    }

    /**
     * Returns a builder for a context.
     *
     * @param service the remote service name
     * @param operation the operation name
     * @return a new builder
     */
    public static Builder builder(String service, String operation) {
        return new Builder(service, operation);
    }

    /**
     * Returns the remote service name.
     *
     * @return the service name
     */
    public String service() {
        return service;
    }

    /**
     * Returns the operation name.
     *
     * @return the operation name
     */
    public String operation() {
        return operation;
    }

    /**
     * Returns the composite key {@code service:operation} identifying this call site's breaker.
     *
     * @return the service key
     */
    public String serviceKey() {
        return serviceKey(service, operation);
    }

    /**
     * Returns the correlation id, if one was given.
     *
     * @return the correlation id
     */
    public Optional<String> correlationId() {
        return Optional.ofNullable(correlationId);
    }

    /**
     * Returns the per-call attempt ceiling, if one was given.
     *
     * <p>When present it takes precedence over the retry policy's {@code maxAttempts}.
     *
     * @return the attempt override
     */
    public OptionalInt maxAttempts() {
        return maxAttempts == null ? OptionalInt.empty() : OptionalInt.of(maxAttempts);
    }

    /**
     * Returns the metadata attached to this context.
     *
     * @return an unmodifiable view of the metadata
     */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * Builds a service key from its parts.
     *
     * @param service the service name
     * @param operation the operation name
     * @return {@code service + ":" + operation}
     */
    public static String serviceKey(String service, String operation) {
        return service + ":" + operation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OperationContext)) {
            return false;
        }
        OperationContext that = (OperationContext) o;
        return service.equals(that.service)
                && operation.equals(that.operation)
                && Objects.equals(correlationId, that.correlationId)
                && Objects.equals(maxAttempts, that.maxAttempts)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, operation, correlationId, maxAttempts, metadata);
    }

    @Override
    public String toString() {
        return correlationId != null
                ? "OperationContext[" + serviceKey() + ", correlationId=" + correlationId + "]"
                : "OperationContext[" + serviceKey() + "]";
    }

    /** Builder for {@link OperationContext}. */
    public static final class Builder {
        private final String service;
        private final String operation;
        private String correlationId;
        private Integer maxAttempts;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String service, String operation) {
            this.service = Objects.requireNonNull(service, "service");
            this.operation = Objects.requireNonNull(operation, "operation");
            if (service.isBlank()) {
                throw new IllegalArgumentException("service must not be blank");
            }
            if (operation.isBlank()) {
                throw new IllegalArgumentException("operation must not be blank");
            }
        }

        /**
         * Sets the correlation id, e.g. the project the call is made for.
         *
         * @param correlationId the id (may be null)
         * @return this builder
         */
        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        /**
         * Overrides the attempt ceiling for calls made with this context.
         *
         * @param maxAttempts max attempts (must be >= 1)
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Adds one metadata entry.
         *
         * @param key the key
         * @param value the value
         * @return this builder
         */
        public Builder metadata(String key, Object value) {
            metadata.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        /**
         * Adds all given metadata entries.
         *
         * @param entries the entries to add
         * @return this builder
         */
        public Builder metadata(Map<String, ?> entries) {
            Objects.requireNonNull(entries, "entries");
            metadata.putAll(entries);
            return this;
        }

        /**
         * Builds the context.
         *
         * @return new context
         */
        public OperationContext build() {
            return new OperationContext(this);
        }
    }
}
