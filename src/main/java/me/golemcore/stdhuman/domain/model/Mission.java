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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A plan announced by the agent, with the status reports it sent afterwards.
 * Steps are addressed by 1-based index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Mission {

    private String id;
    private String project;

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    private Instant startedAt;
    private String lastStatus;

    @Builder.Default
    private List<String> logs = new ArrayList<>();

    @Builder.Default
    private List<Integer> completedSteps = new ArrayList<>();
}
