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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.domain.model.DecisionException;
import me.golemcore.stdhuman.domain.model.DecisionFailure;
import me.golemcore.stdhuman.domain.model.Mission;
import me.golemcore.stdhuman.domain.model.MissionLogLevel;
import me.golemcore.stdhuman.port.outbound.DeliveryPort;
import org.slf4j.event.Level;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mission plans and progress reports forwarded to the operator chat.
 *
 * <p>
 * Bookkeeping is recorded before delivery, so the mission log keeps an entry
 * even when the operator cannot be reached.
 */
@Service
@Slf4j
public class MissionService {

    private final MissionRegistry missionRegistry;
    private final OperatorDirectory operatorDirectory;
    private final DeliveryPort deliveryPort;

    public MissionService(MissionRegistry missionRegistry, OperatorDirectory operatorDirectory,
            DeliveryPort deliveryPort) {
        this.missionRegistry = missionRegistry;
        this.operatorDirectory = operatorDirectory;
        this.deliveryPort = deliveryPort;
    }

    /**
     * Register a new mission and announce its plan.
     *
     * @return the mission id
     */
    public String definePlan(String project, List<String> steps) {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project is required");
        }
        List<String> cleanSteps = new ArrayList<>();
        if (steps != null) {
            steps.stream().filter(step -> step != null && !step.isBlank()).forEach(cleanSteps::add);
        }
        if (cleanSteps.isEmpty()) {
            throw new IllegalArgumentException("steps must contain at least one step");
        }

        Mission mission = missionRegistry.create(project, cleanSteps);
        log.info("[Mission] Defined mission {} ({} steps)", mission.getId(), cleanSteps.size());

        StringBuilder summary = new StringBuilder()
                .append("Plan started: ").append(project)
                .append(" (").append(cleanSteps.size()).append(" steps)\nSteps:");
        for (int i = 0; i < cleanSteps.size(); i++) {
            summary.append('\n').append(i + 1).append(") ").append(cleanSteps.get(i));
        }
        deliver(summary.toString());
        return mission.getId();
    }

    /**
     * Record a status report on the current mission and forward it.
     *
     * @param stepIndex
     *            1-based step completed by this report, or null
     */
    public void report(MissionLogLevel level, String message, Integer stepIndex) {
        if (level == null) {
            throw new IllegalArgumentException("level is required");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        String text = message;
        if (stepIndex != null) {
            Optional<String> stepLine = missionRegistry.completeStep(stepIndex);
            if (stepLine.isPresent()) {
                text = text + "\n" + stepLine.get();
            }
        }
        log.atLevel(toLogLevel(level)).log("[Mission] {}", text);
        missionRegistry.appendLog(level.name() + ": " + text);
        deliver(text);
    }

    private void deliver(String text) {
        String destination = operatorDirectory.requireDestination();
        boolean delivered;
        try {
            delivered = deliveryPort.deliver(destination, text);
        } catch (RuntimeException e) {
            log.error("[Mission] Delivery failed: {}", e.getMessage(), e);
            delivered = false;
        }
        if (!delivered) {
            throw new DecisionException(DecisionFailure.DELIVERY_FAILED, "telegram send failed");
        }
    }

    static Level toLogLevel(MissionLogLevel level) {
        return switch (level) {
        case INFO, SUCCESS -> Level.INFO;
        case WARNING -> Level.WARN;
        case ERROR -> Level.ERROR;
        };
    }
}
