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

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the question currently occupying the answer slot.
 *
 * <p>
 * An empty {@code options} list means free text is expected. The snapshot is
 * immutable; the slot owns the mutable outcome.
 */
public record PendingDecision(String id, String question, List<String> options, Instant createdAt) {

    public PendingDecision {
        options = options != null ? List.copyOf(options) : List.of();
    }

    public boolean hasOptions() {
        return !options.isEmpty();
    }
}
