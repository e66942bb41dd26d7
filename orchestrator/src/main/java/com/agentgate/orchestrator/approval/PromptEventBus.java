package com.agentgate.orchestrator.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub for prompt events. SSE connections subscribe here.
 * <p>
 * A subscriber that throws is logged and skipped; it never prevents
 * delivery to the others, nor fails the approval flow that published.
 */
public class PromptEventBus implements PromptPublisher {

    private static final Logger log = LoggerFactory.getLogger(PromptEventBus.class);

    private final CopyOnWriteArrayList<Consumer<PromptEvent>> subscribers = new CopyOnWriteArrayList<>();

    @Override
    public void publish(PromptEvent event) {
        log.debug("Publishing {} for {} to {} subscriber(s)", event.eventType(), event.promptId(), subscribers.size());
        for (Consumer<PromptEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(Consumer<PromptEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PromptEvent> subscriber, PromptEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {} for {}: {}",
                    event.eventType(), event.promptId(), e.getMessage(), e);
        }
    }
}
