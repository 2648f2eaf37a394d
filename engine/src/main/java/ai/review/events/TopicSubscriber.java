package ai.review.events;

import java.util.function.Consumer;

/**
 * A handler for one event topic. Phase components implement this and are registered on the
 * {@link ReviewEventBus} at startup by {@link SubscriptionRegistrar}.
 *
 * @param <T> payload type delivered on the topic
 */
public interface TopicSubscriber<T> {

    String topic();

    Class<T> payloadType();

    void onEvent(T payload);

    /**
     * Adapts a plain handler method, for components that listen on more than one topic.
     */
    static <T> TopicSubscriber<T> of(String topic, Class<T> payloadType, Consumer<T> handler) {
        return new TopicSubscriber<>() {
            @Override
            public String topic() {
                return topic;
            }

            @Override
            public Class<T> payloadType() {
                return payloadType;
            }

            @Override
            public void onEvent(T payload) {
                handler.accept(payload);
            }
        };
    }
}
