package com.agentgate.orchestrator.approval;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptEventBusTest {

    private final PromptEventBus bus = new PromptEventBus();

    @Test
    void publish_throwingSubscriber_doesNotBlockOthers() {
        List<PromptEvent> received = new ArrayList<>();
        bus.subscribe(e -> { throw new IllegalStateException("connection closed"); });
        bus.subscribe(received::add);

        bus.publish(hide("prompt-1"));

        assertThat(received).extracting(PromptEvent::promptId).containsExactly("prompt-1");
    }

    @Test
    void unsubscribe_stopsDelivery() {
        List<PromptEvent> received = new ArrayList<>();
        PromptEventBus.Subscription subscription = bus.subscribe(received::add);

        bus.publish(hide("prompt-1"));
        subscription.unsubscribe();
        bus.publish(hide("prompt-2"));

        assertThat(received).hasSize(1);
        assertThat(bus.subscriberCount()).isZero();
    }

    @Test
    void publish_withoutSubscribers_isNoOp() {
        bus.publish(hide("prompt-1"));

        assertThat(bus.subscriberCount()).isZero();
    }

    private static PromptEvent hide(String id) {
        return new PromptEvent(PromptEvent.HIDE_SECURITY_PROMPT, id, Map.of("promptId", id), Instant.now());
    }
}
