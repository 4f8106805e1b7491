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
 * Machine-readable reasons a metadata record could not be resolved. All of them
 * are recoverable per record.
 */
public enum ResolutionFailureKind {

    /**
     * No session marker at all inside the extended search window.
     */
    NO_BOUNDARY_MARKERS_FOUND,

    /**
     * Markers exist but no candidate clears the viability bar.
     */
    NO_CONFIDENT_MATCH,

    /**
     * The log file is missing or cannot be read.
     */
    LOG_UNREADABLE
}
