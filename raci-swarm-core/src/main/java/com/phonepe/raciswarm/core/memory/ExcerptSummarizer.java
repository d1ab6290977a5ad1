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

import com.phonepe.raciswarm.core.utils.SwarmUtils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps an excerpt from every merged fragment. Each fragment gets an equal share of the available length so that
 * every participant still shows up in the summary.
 */
public class ExcerptSummarizer implements Summarizer {
    private static final int MIN_EXCERPT_LENGTH = 8;

    @Override
    public String summarize(List<MemoryFragment> fragments, int maxLength) {
        if (fragments.isEmpty() || maxLength <= 0) {
            return "";
        }
        final var separator = System.lineSeparator();
        final var share = Math.max(MIN_EXCERPT_LENGTH,
                                   (maxLength - separator.length() * (fragments.size() - 1)) / fragments.size());
        final var text = fragments.stream()
                .map(fragment -> SwarmUtils.abbreviate(excerpt(fragment), share))
                .collect(Collectors.joining(separator));
        return SwarmUtils.abbreviate(text, maxLength);
    }

    private static String excerpt(MemoryFragment fragment) {
        return switch (fragment.getKind()) {
            case ENVELOPE -> "%s -> %s: %s".formatted(fragment.getSenderId(),
                                                      fragment.getRecipientId(),
                                                      fragment.getContent());
            case SUMMARY -> fragment.getContent();
        };
    }
}
