package ai.review.events;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Wires every {@link TopicSubscriber} and {@link ReviewEventObserver} bean onto the bus once the
 * context is built. Kept apart from the bus so that phases can depend on the bus for publishing
 * without a construction cycle.
 */
@Component
public class SubscriptionRegistrar implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistrar.class);

    private final ReviewEventBus bus;
    private final List<TopicSubscriber<?>> subscribers;
    private final List<ReviewEventObserver> observers;

    public SubscriptionRegistrar(
            ReviewEventBus bus,
            List<TopicSubscriber<?>> subscribers,
            List<ReviewEventObserver> observers) {
        this.bus = bus;
        this.subscribers = subscribers;
        this.observers = observers;
    }

    @Override
    public void afterPropertiesSet() {
        observers.forEach(bus::addObserver);
        for (TopicSubscriber<?> subscriber : subscribers) {
            bus.register(subscriber);
        }
        log.info("Registered {} topic subscribers and {} observers", subscribers.size(), observers.size());
    }
}
