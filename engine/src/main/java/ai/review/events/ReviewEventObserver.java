package ai.review.events;

/**
 * Sees every event before it is delivered to the subscribers of its topic. Used for state
 * tracking and tracing; observers must not publish.
 */
@FunctionalInterface
public interface ReviewEventObserver {

    void observe(String topic, Object payload);
}
