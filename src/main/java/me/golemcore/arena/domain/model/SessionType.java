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
 * Session modes distinguished by how their boundaries appear in the log.
 */
public enum SessionType {

    /**
     * A single round closed by an explicit end marker.
     */
    STANDARD,

    /**
     * Several consecutive rounds with no reliable end marker between them. The
     * end has to be derived from the declared duration.
     */
    CONTINUOUS_MULTI_ROUND
}
