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

package com.phonepe.raciswarm.core.model;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Capability tags are compared in a normalized form so that "File Generation", "file_generation" and
 * "file-generation" all mean the same thing.
 */
@UtilityClass
public class CapabilityTags {

    public static String normalize(String tag) {
        if (Strings.isNullOrEmpty(tag)) {
            return "";
        }
        return tag.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[\\s_]+", "-");
    }

    public static Set<String> normalize(Collection<String> tags) {
        return Objects.requireNonNullElse(tags, Set.<String>of())
                .stream()
                .map(CapabilityTags::normalize)
                .filter(tag -> !tag.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
