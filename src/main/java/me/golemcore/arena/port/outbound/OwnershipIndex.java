package me.golemcore.arena.port.outbound;

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

import me.golemcore.arena.domain.service.ActorNameSupport;

import java.util.Optional;

/**
 * Precomputed, read-only mapping from sub-agent identity to the primary actor
 * that owns it. Implementations must be safe for concurrent reads.
 */
public interface OwnershipIndex {

    /**
     * Owner of the given sub-agent. Implementations try an exact lookup first
     * and then a lookup by
     * {@link ActorNameSupport#normalizeSubAgentId(String) normalized id}.
     */
    Optional<String> ownerOf(String subAgentId);

    default boolean isOwnedBy(String subAgentId, String ownerActorId) {
        if (subAgentId == null || ownerActorId == null) {
            return false;
        }
        return ownerOf(subAgentId)
                .map(owner -> ActorNameSupport.sameActor(owner, ownerActorId))
                .orElse(false);
    }

    static OwnershipIndex empty() {
        return subAgentId -> Optional.empty();
    }
}
