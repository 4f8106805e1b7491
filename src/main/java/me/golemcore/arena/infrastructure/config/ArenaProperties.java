package me.golemcore.arena.infrastructure.config;

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

import lombok.Data;
import me.golemcore.arena.domain.model.MatchReliability;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the resolver, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code arena.*} prefix:
 * <ul>
 * <li>{@link SearchProperties} - boundary scan window sizing</li>
 * <li>{@link ScoringProperties} - candidate score weights and thresholds</li>
 * <li>{@link DisambiguationProperties} - cross-source re-ranking</li>
 * <li>{@link ExtractionProperties} - spells and buffs the counters track</li>
 * <li>{@link CategoryProperties} - category equivalence rules</li>
 * <li>{@link BatchProperties} - batch driver inputs and outputs</li>
 * </ul>
 *
 * <p>
 * The numeric weights were tuned empirically and are defaults, not invariants.
 */
@Component
@ConfigurationProperties(prefix = "arena")
@Data
public class ArenaProperties {

    private SearchProperties search = new SearchProperties();
    private ScoringProperties scoring = new ScoringProperties();
    private DisambiguationProperties disambiguation = new DisambiguationProperties();
    private ExtractionProperties extraction = new ExtractionProperties();
    private CategoryProperties categories = new CategoryProperties();
    private Map<Integer, String> zones = new LinkedHashMap<>();
    private BatchProperties batch = new BatchProperties();
    private ObservabilityProperties observability = new ObservabilityProperties();

    @Data
    public static class SearchProperties {
        private Map<MatchReliability, Duration> padding = defaultPadding();
        private Duration extension = Duration.ofMinutes(10);
        private Duration defaultDuration = Duration.ofMinutes(5);

        public Duration paddingFor(MatchReliability reliability) {
            MatchReliability safe = reliability != null ? reliability : MatchReliability.MEDIUM;
            Duration configured = padding.get(safe);
            return configured != null ? configured : Duration.ofMinutes(2);
        }

        private static Map<MatchReliability, Duration> defaultPadding() {
            Map<MatchReliability, Duration> defaults = new EnumMap<>(MatchReliability.class);
            defaults.put(MatchReliability.HIGH, Duration.ofSeconds(30));
            defaults.put(MatchReliability.MEDIUM, Duration.ofSeconds(120));
            defaults.put(MatchReliability.LOW, Duration.ofSeconds(300));
            return defaults;
        }
    }

    @Data
    public static class ScoringProperties {
        private double categoryWeight = 0.4;
        private double locationNameWeight = 0.3;
        private double zoneIdWeight = 0.5;
        private double proximityWeight = 0.3;
        private double durationBonus = 0.1;
        private Duration maxProximityOffset = Duration.ofMinutes(10);
        private Duration minPlausibleDuration = Duration.ofSeconds(30);
        private Duration maxPlausibleDuration = Duration.ofMinutes(15);
        private double highConfidenceThreshold = 0.8;
        private double competitiveMargin = 0.1;
        private double minimumViableScore = 0.5;
    }

    @Data
    public static class DisambiguationProperties {
        private Duration eliminationTolerance = Duration.ofSeconds(10);
        private double durationWeight = 0.7;
        private double crossSourceWeight = 0.3;
        private Duration durationNormalization = Duration.ofMinutes(5);
        private double neutralScore = 0.5;
    }

    @Data
    public static class ExtractionProperties {
        private String trackedBuff = "Precognition";
        private List<String> purgeSpells = new ArrayList<>(List.of("Devour Magic"));
    }

    @Data
    public static class CategoryProperties {
        private Map<String, List<String>> equivalents = defaultEquivalents();
        private List<String> continuous = new ArrayList<>(List.of("Solo Shuffle", "Rated Solo Shuffle"));

        private static Map<String, List<String>> defaultEquivalents() {
            Map<String, List<String>> defaults = new LinkedHashMap<>();
            defaults.put("Skirmish", new ArrayList<>(List.of("2v2", "3v3", "Skirmish")));
            defaults.put("Solo Shuffle", new ArrayList<>(List.of("Solo Shuffle", "Rated Solo Shuffle")));
            return defaults;
        }
    }

    @Data
    public static class BatchProperties {
        private boolean enabled = false;
        private String metadataFile = "metadata.json";
        private String logsDirectory = "logs";
        private String ownershipIndexFile = "player_pet_index.json";
        private String reportFile = "resolution_report.json";
        private String resolvedStoreFile = "resolved_records.json";
        private Duration maxLogDistance = Duration.ofDays(1);
        private Duration logStartTolerance = Duration.ofMinutes(10);
        private int workers = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    public enum Verbosity {
        QUIET, SUMMARY, DETAILED
    }

    @Data
    public static class ObservabilityProperties {
        private Verbosity verbosity = Verbosity.SUMMARY;
    }
}
