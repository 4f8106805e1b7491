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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shared helpers for comparing actor identities taken from combat log fields.
 *
 * <p>
 * Player identities look like {@code Name-Realm-Region}; sub-agents carry a
 * short bare name, optionally followed by a volatile {@code -<digits>} suffix
 * that changes on every summon.
 */
public final class ActorNameSupport {

    private static final Pattern VOLATILE_SUFFIX = Pattern.compile("-\\d+$");

    private ActorNameSupport() {
    }

    public static String clean(String actorId) {
        if (actorId == null) {
            return null;
        }
        String trimmed = actorId.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        if (trimmed.isEmpty() || "nil".equalsIgnoreCase(trimmed)) {
            return null;
        }
        return trimmed;
    }

    /**
     * Lookup key for a sub-agent: quotes trimmed, volatile suffix stripped,
     * lower-cased.
     */
    public static String normalizeSubAgentId(String subAgentId) {
        String cleaned = clean(subAgentId);
        if (cleaned == null) {
            return null;
        }
        return VOLATILE_SUFFIX.matcher(cleaned).replaceFirst("").toLowerCase(Locale.ROOT);
    }

    public static String baseName(String actorId) {
        String cleaned = clean(actorId);
        if (cleaned == null) {
            return null;
        }
        int dash = cleaned.indexOf('-');
        return dash > 0 ? cleaned.substring(0, dash) : cleaned;
    }

    /**
     * Two identities denote the same actor when they are equal ignoring case,
     * or when one of them is a bare name equal to the other's base name.
     */
    public static boolean sameActor(String left, String right) {
        String a = clean(left);
        String b = clean(right);
        if (a == null || b == null) {
            return false;
        }
        if (a.equalsIgnoreCase(b)) {
            return true;
        }
        boolean qualifiedA = a.indexOf('-') > 0;
        boolean qualifiedB = b.indexOf('-') > 0;
        if (qualifiedA && qualifiedB) {
            return false;
        }
        return baseName(a).equalsIgnoreCase(baseName(b));
    }
}
