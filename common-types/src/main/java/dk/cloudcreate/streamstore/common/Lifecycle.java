package dk.cloudcreate.streamstore.common;

/**
 * Common life cycle interface for components that hold on to external resources (e.g. a stream store connection).<br>
 * A {@link Lifecycle} component can be used as a scoped resource in a try-with-resources block, in which case
 * {@link #close()} will {@link #stop()} it.
 */
public interface Lifecycle extends AutoCloseable {
    /**
     * Start the component (acquire its resources). This operation must be idempotent, such that duplicate calls
     * to {@link #start()} for an already started component (where {@link #isStarted()} returns true)
     * is ignored
     */
    void start();

    /**
     * Stop the component (release its resources). This operation must be idempotent, such that duplicate calls
     * to {@link #stop()} for an already stopped component (where {@link #isStarted()} returns false)
     * is ignored
     */
    void stop();

    /**
     * Returns true if the component is started
     *
     * @return true if the component is started otherwise false
     */
    boolean isStarted();

    /**
     * Same as {@link #stop()}
     */
    @Override
    default void close() {
        stop();
    }
}
