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

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of tokenizing one raw log line. A failure is never fatal: callers
 * skip the line and count it.
 */
@Data
@Builder
public class LineParseResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private CombatEvent event;
    private String error;

    public static LineParseResult success(CombatEvent event) {
        return LineParseResult.builder()
                .success(true)
                .event(event)
                .build();
    }

    public static LineParseResult failure(String error) {
        return LineParseResult.builder()
                .success(false)
                .error(error)
                .build();
    }
}
