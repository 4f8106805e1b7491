package me.golemcore.arena.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finalized extraction result. Every {@link FeatureCounter} is present; the
 * label lists keep event order. Instances are immutable values.
 */
public record FeatureCounters(Map<FeatureCounter, Integer> counts, List<String> castNames,
        List<String> dispelledEffectNames) {

    public FeatureCounters {
        EnumMap<FeatureCounter, Integer> complete = new EnumMap<>(FeatureCounter.class);
        for (FeatureCounter counter : FeatureCounter.values()) {
            Integer value = counts != null ? counts.get(counter) : null;
            complete.put(counter, value != null ? value : 0);
        }
        counts = Collections.unmodifiableMap(complete);
        castNames = castNames != null ? List.copyOf(castNames) : List.of();
        dispelledEffectNames = dispelledEffectNames != null ? List.copyOf(dispelledEffectNames) : List.of();
    }

    public int count(FeatureCounter counter) {
        return counts.get(counter);
    }

    /**
     * Counters keyed by their external names, in declaration order.
     */
    public Map<String, Integer> asNamedCounts() {
        Map<String, Integer> named = new LinkedHashMap<>();
        counts.forEach((counter, value) -> named.put(counter.getKey(), value));
        return named;
    }
}
