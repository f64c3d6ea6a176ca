package com.p14n.eventsource.broker;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.p14n.eventsource.data.Event;
import com.p14n.eventsource.replay.Repository;

/**
 * Messages accepted by the coordinator loop. Each one is processed to
 * completion before the next is taken.
 */
sealed interface BrokerCommand {

    record RegisterRepository(String channel, Repository repository) implements BrokerCommand {
    }

    record RegisterDefaultRepository(Repository repository) implements BrokerCommand {
    }

    record Subscribe(Subscription subscription) implements BrokerCommand {
    }

    record Unsubscribe(Subscription subscription) implements BrokerCommand {
    }

    record Publish(List<String> channels, Event event) implements BrokerCommand {
    }

    record CountSubscribers(String channel, CompletableFuture<Integer> result) implements BrokerCommand {
    }

    record Shutdown() implements BrokerCommand {
    }
}
