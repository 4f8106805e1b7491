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

/**
 * Fixed set of per-actor counters produced by feature extraction.
 */
public enum FeatureCounter {

    CASTS("cast_success_own"),

    PURGES("purges_own"),

    INTERRUPTS_PERFORMED("interrupt_success_own"),

    TIMES_INTERRUPTED("times_interrupted"),

    BUFF_GAINED_SELF("precog_gained_own"),

    BUFF_GAINED_OPPONENT("precog_gained_enemy"),

    TIMES_DIED("times_died");

    private final String key;

    FeatureCounter(String key) {
        this.key = key;
    }

    /**
     * Stable external name used in reports.
     */
    public String getKey() {
        return key;
    }
}
