package me.golemcore.stdhuman.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.stdhuman.adapter.inbound.web.dto.LogRequest;
import me.golemcore.stdhuman.adapter.inbound.web.dto.PlanRequest;
import me.golemcore.stdhuman.adapter.inbound.web.dto.PlanResponse;
import me.golemcore.stdhuman.domain.model.MissionLogLevel;
import me.golemcore.stdhuman.domain.service.MissionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Mission plan and progress endpoints. Both answer 202 once the operator has
 * been notified.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class MissionController {

    private final MissionService missionService;

    @PostMapping("/plan")
    public Mono<ResponseEntity<PlanResponse>> plan(@RequestBody PlanRequest request) {
        return Mono.fromCallable(() -> {
            String missionId = missionService.definePlan(request.getProject(), request.getSteps());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(new PlanResponse(missionId));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/log")
    public Mono<ResponseEntity<Void>> log(@RequestBody LogRequest request) {
        return Mono.fromCallable(() -> {
            missionService.report(MissionLogLevel.fromValue(request.getLevel()), request.getMessage(),
                    request.getStepIndex());
            return ResponseEntity.status(HttpStatus.ACCEPTED).<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
