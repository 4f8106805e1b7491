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

import java.io.BufferedReader;
import java.io.IOException;

/**
 * A finite, already-captured combat log that can be read from the beginning
 * any number of times. Each call to {@link #openReader()} starts an
 * independent pass; the caller owns and closes the reader.
 */
public interface CombatLogSource {

    /**
     * Human-readable identifier (usually the file name) for logs and reports.
     */
    String getName();

    BufferedReader openReader() throws IOException;
}
