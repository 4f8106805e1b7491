package me.golemcore.arena.adapter.outbound.ownership;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.arena.domain.service.ActorNameSupport;
import me.golemcore.arena.port.outbound.OwnershipIndex;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory ownership index. Each sub-agent has at most one owner;
 * the first owner seen for a normalized sub-agent id wins.
 */
@Slf4j
public final class MapOwnershipIndex implements OwnershipIndex {

    private final Map<String, String> exact;
    private final Map<String, String> normalized;

    private MapOwnershipIndex(Map<String, String> exact, Map<String, String> normalized) {
        this.exact = Collections.unmodifiableMap(exact);
        this.normalized = Collections.unmodifiableMap(normalized);
    }

    /**
     * Builds the index from owner to owned sub-agent names.
     */
    public static MapOwnershipIndex fromOwners(Map<String, ? extends Collection<String>> subAgentsByOwner) {
        Map<String, String> exact = new HashMap<>();
        Map<String, String> normalized = new HashMap<>();
        subAgentsByOwner.forEach((owner, subAgents) -> {
            String cleanOwner = ActorNameSupport.clean(owner);
            if (cleanOwner == null || subAgents == null) {
                return;
            }
            for (String subAgent : subAgents) {
                String cleanSubAgent = ActorNameSupport.clean(subAgent);
                if (cleanSubAgent == null) {
                    continue;
                }
                String key = ActorNameSupport.normalizeSubAgentId(cleanSubAgent);
                String existing = normalized.putIfAbsent(key, cleanOwner);
                if (existing != null && !existing.equals(cleanOwner)) {
                    log.warn("[Ownership] {} already owned by {}, ignoring owner {}", cleanSubAgent, existing,
                            cleanOwner);
                    continue;
                }
                exact.putIfAbsent(cleanSubAgent, cleanOwner);
            }
        });
        return new MapOwnershipIndex(exact, normalized);
    }

    @Override
    public Optional<String> ownerOf(String subAgentId) {
        String cleaned = ActorNameSupport.clean(subAgentId);
        if (cleaned == null) {
            return Optional.empty();
        }
        String owner = exact.get(cleaned);
        if (owner == null) {
            owner = normalized.get(ActorNameSupport.normalizeSubAgentId(cleaned));
        }
        return Optional.ofNullable(owner);
    }

    public int size() {
        return normalized.size();
    }
}
