package org.conflux.runtime.events;

import org.conflux.runtime.spi.IEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * An {@link IEventSink} that fans events out to typed subscribers.
 * <p>
 * Delivery is synchronous and in publish order. A subscriber that throws is logged and skipped;
 * the failure never reaches the publisher or the remaining subscribers.
 * <p>
 * Thread Safety: subscribing and publishing may happen from different threads.
 */
public class EventBus implements IEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final List<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();

    private record Subscription<E extends EngineEvent>(Class<E> type, Consumer<? super E> listener) {
        void deliver(EngineEvent event) {
            if (type.isInstance(event)) {
                listener.accept(type.cast(event));
            }
        }
    }

    /**
     * Registers a listener for all events of the given type (including subtypes).
     *
     * @param type     event class, e.g. {@code EngineEvent.ChainCompleted.class} or {@code EngineEvent.class}
     * @param listener the callback
     * @return a handle that removes the subscription when run
     */
    public <E extends EngineEvent> Runnable subscribe(Class<E> type, Consumer<? super E> listener) {
        Subscription<E> subscription = new Subscription<>(type, listener);
        subscriptions.add(subscription);
        return () -> subscriptions.remove(subscription);
    }

    @Override
    public void publish(EngineEvent event) {
        for (Subscription<?> subscription : subscriptions) {
            try {
                subscription.deliver(event);
            } catch (RuntimeException e) {
                LOG.warn("Subscriber for {} failed on {} event: {}", subscription.type().getSimpleName(),
                        event.type(), e.getMessage());
                LOG.debug("Subscriber failure details:", e);
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }
}
