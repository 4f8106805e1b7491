package me.golemcore.arena.domain.service;

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

import me.golemcore.arena.domain.model.ResolutionFailureKind;

/**
 * Raised when a metadata record cannot be resolved. Always recoverable at the
 * caller: the record is reported as unresolved and processing continues.
 */
public class SessionResolutionException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ResolutionFailureKind kind;

    public SessionResolutionException(ResolutionFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SessionResolutionException(ResolutionFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ResolutionFailureKind getKind() {
        return kind;
    }
}
