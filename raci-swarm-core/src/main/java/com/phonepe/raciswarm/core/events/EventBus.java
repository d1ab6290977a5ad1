/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.raciswarm.core.events;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.eventbus.AsyncEventBus;
import com.google.common.eventbus.Subscribe;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * The common bus used to publish swarm events to external collectors
 */
@Slf4j
public class EventBus {
    private final com.google.common.eventbus.EventBus delegate;

    /**
     * Create event bus with a default cached thread pool
     */
    public EventBus() {
        this(Executors.newCachedThreadPool());
    }

    /**
     * Create event bus that dispatches to handlers on the given executor
     *
     * @param executor The executor to use for handling events
     */
    public EventBus(final Executor executor) {
        this(new AsyncEventBus(executor,
                               (exception, context) -> log.error("Error in event handler {}: {}",
                                                                 context.getSubscriberMethod(),
                                                                 exception.getMessage())));
    }

    @VisibleForTesting
    EventBus(com.google.common.eventbus.EventBus delegate) {
        this.delegate = delegate;
    }

    /**
     * Event bus that calls handlers on the publishing thread
     */
    public static EventBus synchronous() {
        return new EventBus(new com.google.common.eventbus.EventBus("raci-swarm-events"));
    }

    /**
     * Connect a handler to receive every event
     *
     * @return The registered listener, to be passed to {@link #disconnect(Object)}
     */
    public Object onEvent(final Consumer<SwarmEvent> handler) {
        final var listener = new Listener(handler);
        delegate.register(listener);
        return listener;
    }

    public void disconnect(final Object listener) {
        delegate.unregister(listener);
    }

    public void notify(final SwarmEvent event) {
        delegate.post(event);
    }

    private static final class Listener {
        private final Consumer<SwarmEvent> handler;

        private Listener(Consumer<SwarmEvent> handler) {
            this.handler = handler;
        }

        @Subscribe
        public void handle(SwarmEvent event) {
            handler.accept(event);
        }
    }
}
