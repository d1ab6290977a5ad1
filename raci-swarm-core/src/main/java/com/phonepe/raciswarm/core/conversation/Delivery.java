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

import com.phonepe.raciswarm.core.envelope.MessageEnvelope;

/**
 * An envelope queued for its recipient.
 *
 * @param envelope The envelope the recipient reacts to
 * @param origin   The request the recipient will eventually answer. Same as the envelope for delegations; for the
 *                 last answer of a delegation round, the envelope that made the recipient delegate.
 */
public record Delivery(MessageEnvelope envelope, MessageEnvelope origin) {
    public static Delivery of(MessageEnvelope envelope) {
        return new Delivery(envelope, envelope);
    }

    public long sequenceNo() {
        return envelope.getSequenceNo();
    }

    public String recipientId() {
        return envelope.getRecipientId();
    }
}
