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

package com.phonepe.raciswarm.core.memory;

import com.phonepe.raciswarm.core.model.RaciRole;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The part of a conversation's memory that an agent in a given role gets to see
 */
@Value
public class ContextSlice {
    String conversationId;
    RaciRole role;
    List<MemoryFragment> fragments;
    int totalSize;
    long version;

    public static ContextSlice empty(String conversationId, RaciRole role) {
        return new ContextSlice(conversationId, role, List.of(), 0, 0);
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    /**
     * Plain text rendering, one line per fragment, oldest first
     */
    public String render() {
        return fragments.stream()
                .map(fragment -> switch (fragment.getKind()) {
                    case ENVELOPE -> "[%d] %s -> %s: %s".formatted(fragment.getSequenceFrom(),
                                                                   fragment.getSenderId(),
                                                                   fragment.getRecipientId(),
                                                                   fragment.getContent());
                    case SUMMARY -> "[%d-%d] summary: %s".formatted(fragment.getSequenceFrom(),
                                                                    fragment.getSequenceTo(),
                                                                    fragment.getContent());
                })
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
