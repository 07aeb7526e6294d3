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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.adapter.inbound.web.dto.AskRequest;
import me.golemcore.stdhuman.adapter.inbound.web.dto.AskResponse;
import me.golemcore.stdhuman.domain.model.AskMode;
import me.golemcore.stdhuman.domain.model.AskResult;
import me.golemcore.stdhuman.domain.model.DecisionException;
import me.golemcore.stdhuman.domain.model.DecisionFailure;
import me.golemcore.stdhuman.domain.model.DecisionPoll;
import me.golemcore.stdhuman.domain.service.DecisionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Human decision endpoints.
 *
 * <ul>
 * <li>{@code POST /v1/ask} - sync mode blocks until answered (on a bounded
 * elastic worker); async mode returns {@code request_id} at once</li>
 * <li>{@code GET /v1/ask/result/{requestId}} - poll an async decision</li>
 * </ul>
 */
@RestController
@RequestMapping("/v1/ask")
@RequiredArgsConstructor
@Slf4j
public class AskController {

    private final DecisionService decisionService;

    @PostMapping
    public Mono<ResponseEntity<AskResponse>> ask(@RequestBody AskRequest request) {
        return Mono.fromCallable(() -> {
            AskMode mode = AskMode.fromValue(request.getMode());
            AskResult result = decisionService.ask(request.getQuestion(), request.getOptions(), mode,
                    DecisionService.timeoutFromSeconds(request.getTimeout()));
            return ResponseEntity.ok(AskResponse.from(result));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/result/{requestId}")
    public Mono<ResponseEntity<AskResponse>> result(@PathVariable String requestId) {
        return Mono.fromCallable(() -> {
            DecisionPoll poll = decisionService.poll(requestId);
            return switch (poll.status()) {
            case ANSWERED -> ResponseEntity.ok(AskResponse.answered(poll.answer()));
            case PENDING -> ResponseEntity.ok(AskResponse.stillPending());
            case NOT_FOUND -> throw new DecisionException(DecisionFailure.NOT_FOUND, "request not found");
            };
        });
    }
}
