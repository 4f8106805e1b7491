package me.golemcore.arena.domain.service;

import me.golemcore.arena.adapter.outbound.ownership.MapOwnershipIndex;
import me.golemcore.arena.domain.model.FeatureCounter;
import me.golemcore.arena.domain.model.FeatureCounters;
import me.golemcore.arena.domain.model.FeatureExtraction;
import me.golemcore.arena.domain.model.TimeWindow;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.OwnershipIndex;
import me.golemcore.arena.testsupport.CombatLogLines;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FeatureExtractorTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 1, 2, 18, 0);
    private static final TimeWindow INTERVAL = new TimeWindow(T0, T0.plusMinutes(5));
    private static final String PLAYER = "Shiizz-Kazzak-EU";
    private static final String PET = "Zhaarak";
    private static final String ENEMY = "Enemy-Realm-EU";

    private final FeatureExtractor extractor = new FeatureExtractor(new CombatLogTokenizer(), new ArenaProperties());
    private final OwnershipIndex ownership = MapOwnershipIndex.fromOwners(Map.of(PLAYER, List.of(PET)));

    @Test
    void shouldAttributeOnlyDispelsOfOwnedSubAgents() throws IOException {
        CombatLogLines log = CombatLogLines.log()
                .dispel(T0.plusSeconds(10), PET + "-4242", ENEMY, "Devour Magic", "Power Word: Shield")
                .cast(T0.plusSeconds(11), PET + "-4242", "Spell Lock");

        FeatureCounters counters = extract(log);

        assertEquals(1, counters.count(FeatureCounter.PURGES));
        assertEquals(List.of("Power Word: Shield"), counters.dispelledEffectNames());
        assertEquals(0, counters.count(FeatureCounter.CASTS));
        assertEquals(List.of(), counters.castNames());
    }

    @Test
    void shouldIgnoreDispelsByPrimaryActorOrWithOtherSpells() throws IOException {
        CombatLogLines log = CombatLogLines.log()
                .dispel(T0.plusSeconds(10), PLAYER, ENEMY, "Devour Magic", "Blessing of Freedom")
                .dispel(T0.plusSeconds(20), PET, ENEMY, "Dispel Magic", "Blessing of Freedom")
                .dispel(T0.plusSeconds(30), "Felhunter", ENEMY, "Devour Magic", "Blessing of Freedom");

        assertEquals(0, extract(log).count(FeatureCounter.PURGES));
    }

    @Test
    void shouldCountInterruptsOfSubAgentAsOwnerInterrupts() throws IOException {
        FeatureCounters bySubAgent = extract(CombatLogLines.log()
                .interrupt(T0.plusSeconds(10), PET, ENEMY, "Greater Heal"));
        FeatureCounters byOwner = extract(CombatLogLines.log()
                .interrupt(T0.plusSeconds(10), PLAYER, ENEMY, "Greater Heal"));

        assertEquals(1, bySubAgent.count(FeatureCounter.INTERRUPTS_PERFORMED));
        assertEquals(bySubAgent.counts(), byOwner.counts());
    }

    @Test
    void shouldCountInterruptsSufferedByPrimaryOrSubAgent() throws IOException {
        FeatureCounters counters = extract(CombatLogLines.log()
                .interrupt(T0.plusSeconds(10), ENEMY, PLAYER, "Chaos Bolt")
                .interrupt(T0.plusSeconds(20), ENEMY, PET + "-77", "Devour Magic")
                .interrupt(T0.plusSeconds(30), ENEMY, "Someone-Else-EU", "Flash Heal"));

        assertEquals(2, counters.count(FeatureCounter.TIMES_INTERRUPTED));
        assertEquals(0, counters.count(FeatureCounter.INTERRUPTS_PERFORMED));
    }

    @Test
    void shouldSplitTrackedBuffBetweenSelfAndOpponent() throws IOException {
        FeatureCounters counters = extract(CombatLogLines.log()
                .auraApplied(T0.plusSeconds(10), PLAYER, PLAYER, "Precognition")
                .auraApplied(T0.plusSeconds(20), ENEMY, ENEMY, "Precognition")
                .auraApplied(T0.plusSeconds(30), ENEMY, ENEMY, "Power Infusion"));

        assertEquals(1, counters.count(FeatureCounter.BUFF_GAINED_SELF));
        assertEquals(1, counters.count(FeatureCounter.BUFF_GAINED_OPPONENT));
    }

    @Test
    void shouldCountDeathsOfPrimaryActorOnly() throws IOException {
        FeatureCounters counters = extract(CombatLogLines.log()
                .died(T0.plusSeconds(10), ENEMY)
                .died(T0.plusSeconds(20), PLAYER));

        assertEquals(1, counters.count(FeatureCounter.TIMES_DIED));
    }

    @Test
    void shouldIncludeEventsOnIntervalBoundariesOnly() throws IOException {
        FeatureExtraction extraction = extractor.extract(CombatLogLines.log()
                .cast(T0.minusNanos(1_000_000), PLAYER, "Before")
                .cast(T0, PLAYER, "Fear")
                .cast(T0.plusMinutes(2), PLAYER, "Chaos Bolt")
                .cast(T0.plusMinutes(5), PLAYER, "Shadowfury")
                .cast(T0.plusMinutes(5).plusNanos(1_000_000), PLAYER, "After")
                .raw("broken line")
                .toSource("boundaries"), INTERVAL, PLAYER, ownership);

        assertEquals(3, extraction.counters().count(FeatureCounter.CASTS));
        assertEquals(List.of("Fear", "Chaos Bolt", "Shadowfury"), extraction.counters().castNames());
        assertEquals(6, extraction.statistics().linesRead());
        assertEquals(1, extraction.statistics().linesSkipped());
    }

    @Test
    void shouldMatchPrimaryActorByBaseName() throws IOException {
        FeatureExtraction extraction = extractor.extract(CombatLogLines.log()
                .cast(T0.plusSeconds(1), PLAYER, "Fear")
                .toSource("base-name"), INTERVAL, "Shiizz", ownership);

        assertEquals(1, extraction.counters().count(FeatureCounter.CASTS));
    }

    @Test
    void shouldReportEveryCounterEvenWhenNothingHappened() throws IOException {
        FeatureCounters counters = extract(CombatLogLines.log());

        assertEquals(FeatureCounter.values().length, counters.asNamedCounts().size());
        assertEquals(0, counters.asNamedCounts().get("cast_success_own"));
    }

    private FeatureCounters extract(CombatLogLines log) throws IOException {
        return extractor.extract(log.toSource("synthetic"), INTERVAL, PLAYER, ownership).counters();
    }
}
