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
 * Line counters for one pass over a log. Parse failures are only ever reported
 * in aggregate.
 */
public record ScanStatistics(long linesRead, long linesSkipped) {

    public static final ScanStatistics EMPTY = new ScanStatistics(0, 0);

    public ScanStatistics plus(ScanStatistics other) {
        return new ScanStatistics(linesRead + other.linesRead, linesSkipped + other.linesSkipped);
    }
}
