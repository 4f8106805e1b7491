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

import me.golemcore.arena.domain.model.CombatEvent;
import me.golemcore.arena.domain.model.EventKind;
import me.golemcore.arena.domain.model.LineParseResult;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses raw combat log lines of the form
 * {@code M/D/YYYY HH:MM:SS[.fff][-tz]  EVENT,field,field,...}.
 *
 * <p>
 * Parsing is split so that hot loops can reject a line cheaply:
 * {@link #readPrefix(String)} only reads the timestamp,
 * {@link #peekKind(String, LinePrefix)} only reads the event token, and
 * {@link #tokenize(String, LinePrefix)} splits the whole payload.
 */
@Component
public class CombatLogTokenizer {

    private static final int MIN_FIELDS = 3;
    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final Pattern TIMEZONE_SUFFIX = Pattern.compile("[+-]\\d{1,4}$");

    private static final DateTimeFormatter WITH_FRACTION = new DateTimeFormatterBuilder()
            .appendPattern("M/d/uuuu H:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .toFormatter(Locale.ROOT);
    private static final DateTimeFormatter WITHOUT_FRACTION = DateTimeFormatter.ofPattern("M/d/uuuu H:mm:ss",
            Locale.ROOT);

    /**
     * Timestamp of a line and the offset where its comma-delimited payload
     * begins.
     */
    public record LinePrefix(LocalDateTime timestamp, int payloadStart) {
    }

    public Optional<LinePrefix> readPrefix(String line) {
        if (line == null) {
            return Optional.empty();
        }
        int length = line.length();
        int dateStart = 0;
        while (dateStart < length
                && (line.charAt(dateStart) == BYTE_ORDER_MARK || Character.isWhitespace(line.charAt(dateStart)))) {
            dateStart++;
        }
        int dateEnd = nextWhitespace(line, dateStart);
        if (dateEnd >= length) {
            return Optional.empty();
        }
        int timeStart = skipWhitespace(line, dateEnd);
        int timeEnd = nextWhitespace(line, timeStart);
        if (timeStart >= length || timeEnd >= length) {
            return Optional.empty();
        }
        int payloadStart = skipWhitespace(line, timeEnd);
        if (payloadStart >= length) {
            return Optional.empty();
        }

        String date = line.substring(dateStart, dateEnd);
        String time = TIMEZONE_SUFFIX.matcher(line.substring(timeStart, timeEnd)).replaceFirst("");
        DateTimeFormatter formatter = time.indexOf('.') >= 0 ? WITH_FRACTION : WITHOUT_FRACTION;
        try {
            return Optional.of(new LinePrefix(LocalDateTime.parse(date + " " + time, formatter), payloadStart));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public EventKind peekKind(String line, LinePrefix prefix) {
        int comma = line.indexOf(',', prefix.payloadStart());
        String token = comma < 0 ? line.substring(prefix.payloadStart()) : line.substring(prefix.payloadStart(), comma);
        return EventKind.fromToken(token);
    }

    public LineParseResult tokenize(String line) {
        Optional<LinePrefix> prefix = readPrefix(line);
        if (prefix.isEmpty()) {
            return LineParseResult.failure("Unparseable timestamp");
        }
        return tokenize(line, prefix.get());
    }

    public LineParseResult tokenize(String line, LinePrefix prefix) {
        List<String> fields = splitFields(line.substring(prefix.payloadStart()));
        if (fields.size() < MIN_FIELDS) {
            return LineParseResult.failure("Expected at least " + MIN_FIELDS + " fields, got " + fields.size());
        }
        EventKind kind = EventKind.fromToken(fields.get(0));
        String actor = null;
        String target = null;
        if (!kind.isSessionMarker()) {
            actor = ActorNameSupport.clean(fieldAt(fields, CombatEvent.ACTOR_NAME_INDEX));
            target = ActorNameSupport.clean(fieldAt(fields, CombatEvent.TARGET_NAME_INDEX));
        }
        return LineParseResult.success(new CombatEvent(prefix.timestamp(), kind, actor, target, fields));
    }

    /**
     * Splits on commas outside double quotes and drops the quotes.
     */
    static List<String> splitFields(String payload) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < payload.length(); i++) {
            char c = payload.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ',' && !quoted) {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString().trim());
        return fields;
    }

    private static String fieldAt(List<String> fields, int index) {
        return index < fields.size() ? fields.get(index) : null;
    }

    private static int nextWhitespace(String line, int from) {
        int i = from;
        while (i < line.length() && !Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipWhitespace(String line, int from) {
        int i = from;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }
}
