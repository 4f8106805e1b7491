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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.arena.domain.model.CombatEvent;
import me.golemcore.arena.domain.model.EventKind;
import me.golemcore.arena.domain.model.FeatureCounter;
import me.golemcore.arena.domain.model.FeatureCounters;
import me.golemcore.arena.domain.model.FeatureExtraction;
import me.golemcore.arena.domain.model.LineParseResult;
import me.golemcore.arena.domain.model.ScanStatistics;
import me.golemcore.arena.domain.model.TimeWindow;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.CombatLogSource;
import me.golemcore.arena.port.outbound.OwnershipIndex;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Counts the primary actor's behaviour inside a resolved interval with one
 * forward pass. The interval is closed at both ends.
 *
 * <p>
 * Attribution rules per event kind:
 * <ul>
 * <li>cast: the primary actor only; casts by owned sub-agents are dropped</li>
 * <li>dispel of a recognised purge spell: owned sub-agents only</li>
 * <li>interrupt: primary actor and owned sub-agents count as one unit, both as
 * source and as target</li>
 * <li>tracked buff applied: self when the target is the primary actor,
 * opponent otherwise</li>
 * <li>elimination: when the primary actor died</li>
 * </ul>
 */
@Component
@Slf4j
public class FeatureExtractor {

    private final CombatLogTokenizer tokenizer;
    private final ArenaProperties.ExtractionProperties settings;

    public FeatureExtractor(CombatLogTokenizer tokenizer, ArenaProperties properties) {
        this.tokenizer = tokenizer;
        this.settings = properties.getExtraction();
    }

    public FeatureExtraction extract(CombatLogSource source, TimeWindow interval, String primaryActorId,
            OwnershipIndex ownershipIndex) throws IOException {
        Accumulator accumulator = new Accumulator(primaryActorId, ownershipIndex);
        long linesRead = 0;
        long linesSkipped = 0;

        try (BufferedReader reader = source.openReader()) {
            String line;
            while ((line = reader.readLine()) != null) {
                linesRead++;
                Optional<CombatLogTokenizer.LinePrefix> prefix = tokenizer.readPrefix(line);
                if (prefix.isEmpty()) {
                    linesSkipped++;
                    continue;
                }
                if (!interval.contains(prefix.get().timestamp())) {
                    continue;
                }
                LineParseResult parsed = tokenizer.tokenize(line, prefix.get());
                if (!parsed.isSuccess()) {
                    linesSkipped++;
                    continue;
                }
                accumulator.accept(parsed.getEvent());
            }
        }

        log.debug("[Extract] {}: [{} .. {}] for {}, {} lines read, {} skipped",
                source.getName(), interval.start(), interval.end(), primaryActorId, linesRead, linesSkipped);
        return new FeatureExtraction(accumulator.finish(), new ScanStatistics(linesRead, linesSkipped));
    }

    private final class Accumulator {

        private final String primaryActorId;
        private final OwnershipIndex ownershipIndex;
        private final Map<FeatureCounter, Integer> counts = new EnumMap<>(FeatureCounter.class);
        private final List<String> castNames = new ArrayList<>();
        private final List<String> dispelledEffectNames = new ArrayList<>();

        private Accumulator(String primaryActorId, OwnershipIndex ownershipIndex) {
            this.primaryActorId = primaryActorId;
            this.ownershipIndex = ownershipIndex != null ? ownershipIndex : OwnershipIndex.empty();
        }

        void accept(CombatEvent event) {
            switch (event.kind()) {
            case CAST_SUCCESS -> onCast(event);
            case DISPEL -> onDispel(event);
            case INTERRUPT -> onInterrupt(event);
            case AURA_APPLIED -> onAuraApplied(event);
            case ACTOR_ELIMINATED -> onEliminated(event);
            case SESSION_START, SESSION_END, OTHER -> {
                // not counted
            }
            }
        }

        private void onCast(CombatEvent event) {
            if (isPrimary(event.actorId())) {
                increment(FeatureCounter.CASTS);
                addLabel(castNames, event.spellName());
            }
        }

        private void onDispel(CombatEvent event) {
            if (isPurgeSpell(event.spellName()) && isOwnedSubAgent(event.actorId())) {
                increment(FeatureCounter.PURGES);
                addLabel(dispelledEffectNames, event.extraSpellName());
            }
        }

        private void onInterrupt(CombatEvent event) {
            if (isPrimaryUnit(event.actorId())) {
                increment(FeatureCounter.INTERRUPTS_PERFORMED);
            }
            if (isPrimaryUnit(event.targetId())) {
                increment(FeatureCounter.TIMES_INTERRUPTED);
            }
        }

        private void onAuraApplied(CombatEvent event) {
            String spell = event.spellName();
            if (spell == null || !spell.equalsIgnoreCase(settings.getTrackedBuff())) {
                return;
            }
            increment(isPrimary(event.targetId()) ? FeatureCounter.BUFF_GAINED_SELF
                    : FeatureCounter.BUFF_GAINED_OPPONENT);
        }

        private void onEliminated(CombatEvent event) {
            if (isPrimary(event.targetId())) {
                increment(FeatureCounter.TIMES_DIED);
            }
        }

        private boolean isPrimary(String actorId) {
            return ActorNameSupport.sameActor(actorId, primaryActorId);
        }

        private boolean isOwnedSubAgent(String actorId) {
            return actorId != null && ownershipIndex.isOwnedBy(actorId, primaryActorId);
        }

        private boolean isPrimaryUnit(String actorId) {
            return isPrimary(actorId) || isOwnedSubAgent(actorId);
        }

        private boolean isPurgeSpell(String spell) {
            if (spell == null || settings.getPurgeSpells() == null) {
                return false;
            }
            return settings.getPurgeSpells().stream().anyMatch(spell::equalsIgnoreCase);
        }

        private void increment(FeatureCounter counter) {
            counts.merge(counter, 1, Integer::sum);
        }

        private void addLabel(List<String> labels, String label) {
            if (label != null && !label.isBlank()) {
                labels.add(label);
            }
        }

        FeatureCounters finish() {
            return new FeatureCounters(counts, castNames, dispelledEffectNames);
        }
    }
}
