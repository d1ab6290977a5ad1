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

package com.phonepe.raciswarm.core.conversation;

import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Envelopes waiting to be processed. Always hands out the lowest sequence number first, so the processing order does
 * not depend on the order in which replies were produced.
 */
public class ConversationInbox {
    private final PriorityQueue<Delivery> queue = new PriorityQueue<>(Comparator.comparingLong(Delivery::sequenceNo));

    public void offer(Delivery delivery) {
        queue.offer(delivery);
    }

    public Optional<Delivery> poll() {
        return Optional.ofNullable(queue.poll());
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }
}
