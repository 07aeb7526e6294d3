package me.golemcore.stdhuman.domain.service;

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

import me.golemcore.stdhuman.domain.model.Mission;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory store of missions. The most recently created mission is current;
 * logs and step completions always apply to it.
 */
@Component
public class MissionRegistry {

    private final Object lock = new Object();
    private final Clock clock;
    private final Map<String, Mission> missions = new LinkedHashMap<>();
    private String currentId;

    public MissionRegistry(Clock clock) {
        this.clock = clock;
    }

    public Mission create(String project, List<String> steps) {
        Mission mission = Mission.builder()
                .id(UUID.randomUUID().toString())
                .project(project)
                .steps(new ArrayList<>(steps))
                .startedAt(Instant.now(clock))
                .build();
        synchronized (lock) {
            missions.put(mission.getId(), mission);
            currentId = mission.getId();
        }
        return copyOf(mission);
    }

    public void appendLog(String text) {
        synchronized (lock) {
            Mission mission = currentLocked();
            if (mission != null) {
                mission.getLogs().add(text);
                mission.setLastStatus(text);
            }
        }
    }

    /**
     * Mark a 1-based step of the current mission complete.
     *
     * @return the completion line, or empty if there is no mission or the index
     *         is out of range
     */
    public Optional<String> completeStep(int stepIndex) {
        synchronized (lock) {
            Mission mission = currentLocked();
            if (mission == null || stepIndex < 1 || stepIndex > mission.getSteps().size()) {
                return Optional.empty();
            }
            if (!mission.getCompletedSteps().contains(stepIndex)) {
                mission.getCompletedSteps().add(stepIndex);
            }
            String stepText = mission.getSteps().get(stepIndex - 1);
            return Optional.of("Step " + stepIndex + "/" + mission.getSteps().size() + " complete: " + stepText);
        }
    }

    public Optional<Mission> current() {
        synchronized (lock) {
            Mission mission = currentLocked();
            return mission != null ? Optional.of(copyOf(mission)) : Optional.empty();
        }
    }

    public Optional<String> lastStatus() {
        return current().map(Mission::getLastStatus);
    }

    private Mission currentLocked() {
        return currentId != null ? missions.get(currentId) : null;
    }

    private static Mission copyOf(Mission mission) {
        return Mission.builder()
                .id(mission.getId())
                .project(mission.getProject())
                .steps(new ArrayList<>(mission.getSteps()))
                .startedAt(mission.getStartedAt())
                .lastStatus(mission.getLastStatus())
                .logs(new ArrayList<>(mission.getLogs()))
                .completedSteps(new ArrayList<>(mission.getCompletedSteps()))
                .build();
    }
}
