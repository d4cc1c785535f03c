package express.mvp.resilience;

/**
 * A unit of work protected by the resilience core, typically one remote call.
 *
 * <p>The operation may be invoked several times by one {@code execute} call. Operations with side
 * effects must be idempotent or tolerate repetition.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * Performs the work.
     *
     * @return the result
     * @throws Exception if the attempt fails
     */
    T call() throws Exception;
}
