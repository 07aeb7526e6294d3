package me.golemcore.stdhuman.domain.model;

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

/**
 * How a caller waits for a human decision.
 */
public enum AskMode {

    /**
     * Caller suspends until answered or timed out. Preempts a stale pending
     * decision.
     */
    SYNC,

    /**
     * Caller receives a request id immediately and polls. Rejected while another
     * decision is pending.
     */
    ASYNC;

    public static AskMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SYNC;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "sync" -> SYNC;
        case "async" -> ASYNC;
        default -> throw new IllegalArgumentException("mode must be 'sync' or 'async'");
        };
    }
}
