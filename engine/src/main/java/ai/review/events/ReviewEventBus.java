package ai.review.events;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process, strictly sequential event dispatcher.
 *
 * <h2>Delivery model</h2>
 * <ul>
 *   <li>Events are queued FIFO and delivered one at a time.
 *   <li>The first thread to publish into an idle bus drains the queue; anything published by a
 *       handler during delivery is only enqueued and delivered after the current handler
 *       returns. The call stack therefore stays flat no matter how many iterations a review runs,
 *       and iteration {@code k+1} can only start once iteration {@code k} has been emitted.
 *   <li>A handler that throws does not stop the bus. The failure is logged and, when the payload
 *       belongs to a review, converted into a {@code review.error} event.
 *   <li>An {@link Error} propagates to the publisher that started the drain. Events still queued
 *       at that point are dropped and the bus is left idle, ready for the next publish.
 * </ul>
 */
@Component
public class ReviewEventBus {

    private static final Logger log = LoggerFactory.getLogger(ReviewEventBus.class);

    private final Map<String, List<Subscription<?>>> subscriptions = new ConcurrentHashMap<>();
    private final List<ReviewEventObserver> observers = new CopyOnWriteArrayList<>();
    private final Deque<Envelope> queue = new ArrayDeque<>();
    private boolean draining;

    /**
     * Registers a typed handler for a topic. Handlers on the same topic run in registration
     * order.
     */
    public <T> void subscribe(String topic, Class<T> payloadType, Consumer<T> handler) {
        subscriptions.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>())
                .add(new Subscription<>(payloadType, handler));
        if (log.isDebugEnabled()) {
            log.debug("Subscribed {} handler to {}", payloadType.getSimpleName(), topic);
        }
    }

    public <T> void register(TopicSubscriber<T> subscriber) {
        subscribe(subscriber.topic(), subscriber.payloadType(), subscriber::onEvent);
    }

    public void addObserver(ReviewEventObserver observer) {
        observers.add(observer);
    }

    /**
     * Publishes an event. Returns once the queue is drained if this call started the drain,
     * otherwise returns immediately after enqueueing.
     */
    public void publish(String topic, Object payload) {
        synchronized (queue) {
            queue.addLast(new Envelope(topic, payload));
            if (draining) {
                return;
            }
            draining = true;
        }
        drain();
    }

    private void drain() {
        boolean drained = false;
        try {
            while (true) {
                Envelope next;
                synchronized (queue) {
                    next = queue.pollFirst();
                    if (next == null) {
                        draining = false;
                        drained = true;
                        return;
                    }
                }
                deliver(next);
            }
        } finally {
            if (!drained) {
                abandonQueue();
            }
        }
    }

    /**
     * Called when an {@link Error} escapes a handler. The queued events belong to reviews whose
     * state can no longer be trusted, so they are dropped; the bus accepts new events again.
     */
    private void abandonQueue() {
        int dropped;
        synchronized (queue) {
            dropped = queue.size();
            queue.clear();
            draining = false;
        }
        log.error("Event delivery aborted by an error; dropped {} queued event(s)", dropped);
    }

    private void deliver(Envelope envelope) {
        for (ReviewEventObserver observer : observers) {
            try {
                observer.observe(envelope.topic(), envelope.payload());
            } catch (RuntimeException e) {
                log.warn("Observer failed on {}: {}", envelope.topic(), e.toString());
            }
        }

        List<Subscription<?>> handlers = subscriptions.getOrDefault(envelope.topic(), List.of());
        if (handlers.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("No subscribers for {}", envelope.topic());
            }
            return;
        }
        for (Subscription<?> subscription : handlers) {
            try {
                subscription.deliver(envelope.payload());
            } catch (RuntimeException e) {
                handleFailure(envelope, e);
            }
        }
    }

    private void handleFailure(Envelope envelope, RuntimeException e) {
        if (envelope.payload() instanceof ReviewPayload && !Topics.REVIEW_ERROR.equals(envelope.topic())) {
            ReviewMetadata meta = ((ReviewPayload) envelope.payload()).meta();
            log.error("[{}] Unhandled failure in {} handler", meta.reviewId(), envelope.topic(), e);
            publish(Topics.REVIEW_ERROR, ReviewError.of(meta, envelope.topic(), e));
        } else {
            log.error("Unhandled failure in {} handler", envelope.topic(), e);
        }
    }

    private record Envelope(String topic, Object payload) {
    }

    private record Subscription<T>(Class<T> type, Consumer<T> handler) {

        void deliver(Object payload) {
            if (!type.isInstance(payload)) {
                throw new IllegalArgumentException(
                        "Expected " + type.getSimpleName() + " but got "
                                + (payload == null ? "null" : payload.getClass().getSimpleName()));
            }
            handler.accept(type.cast(payload));
        }
    }
}
