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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.domain.model.AskMode;
import me.golemcore.stdhuman.domain.model.AskResult;
import me.golemcore.stdhuman.domain.model.AwaitResult;
import me.golemcore.stdhuman.domain.model.DecisionException;
import me.golemcore.stdhuman.domain.model.DecisionFailure;
import me.golemcore.stdhuman.domain.model.DecisionPoll;
import me.golemcore.stdhuman.domain.model.PendingDecision;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import me.golemcore.stdhuman.port.outbound.DeliveryPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Orchestrates human decisions on top of the {@link AnswerSlot}.
 *
 * <p>
 * Two modes share the slot:
 * <ul>
 * <li><b>sync</b> - preempts any pending decision, delivers the prompt and waits
 * for the answer up to a timeout</li>
 * <li><b>async</b> - refuses while a decision is pending, delivers the prompt and
 * returns a request id for {@link #poll}</li>
 * </ul>
 *
 * <p>
 * A prompt that cannot be delivered is rolled back so nobody waits on it.
 * Operator replies arrive through {@link #onIncomingMessage}.
 */
@Service
@Slf4j
public class DecisionService {

    private static final String DELIVERY_FAILED_MESSAGE = "telegram send failed";

    private final AnswerSlot answerSlot;
    private final DeliveryPort deliveryPort;
    private final OperatorDirectory operatorDirectory;
    private final PromptRenderer promptRenderer;
    private final ReplyParser replyParser;
    private final MissionRegistry missionRegistry;
    private final StdHumanProperties properties;

    public DecisionService(AnswerSlot answerSlot, DeliveryPort deliveryPort, OperatorDirectory operatorDirectory,
            PromptRenderer promptRenderer, ReplyParser replyParser, MissionRegistry missionRegistry,
            StdHumanProperties properties) {
        this.answerSlot = answerSlot;
        this.deliveryPort = deliveryPort;
        this.operatorDirectory = operatorDirectory;
        this.promptRenderer = promptRenderer;
        this.replyParser = replyParser;
        this.missionRegistry = missionRegistry;
        this.properties = properties;
    }

    public AskResult ask(String question, List<String> options, AskMode mode, Duration timeout) {
        List<String> cleanOptions = normalizeOptions(options);
        if (mode == AskMode.ASYNC) {
            return AskResult.pending(askAsync(question, cleanOptions));
        }
        return AskResult.answered(askSync(question, cleanOptions, timeout));
    }

    /**
     * Ask and wait for the answer.
     *
     * @param timeout
     *            wait bound, or null for the configured default
     * @throws DecisionException
     *             on missing destination, delivery failure, timeout,
     *             interruption of the waiting thread, or when a newer decision
     *             supersedes this one
     */
    public String askSync(String question, List<String> options, Duration timeout) {
        requireQuestion(question);
        Duration effectiveTimeout = resolveTimeout(timeout);
        String destination = operatorDirectory.requireDestination();

        String requestId = answerSlot.replace(question, options);
        log.info("[Decision] Awaiting human decision {}: {}", requestId, question);
        String prompt = promptRenderer.render(question, options, effectiveTimeout,
                missionRegistry.lastStatus().orElse(null));
        deliverOrRollback(requestId, destination, prompt);

        AwaitResult result = answerSlot.await(requestId, effectiveTimeout);
        return switch (result.status()) {
        case ANSWERED -> {
            answerSlot.clear(requestId);
            log.info("[Decision] Human decision {} received: {}", requestId, result.answer());
            yield result.answer();
        }
        case TIMED_OUT -> {
            Optional<String> lateAnswer = answerSlot.withdraw(requestId);
            if (lateAnswer.isPresent()) {
                log.info("[Decision] Human decision {} answered at the deadline: {}", requestId, lateAnswer.get());
                yield lateAnswer.get();
            }
            log.warn("[Decision] Human decision {} timed out after {}", requestId, effectiveTimeout);
            throw new DecisionException(DecisionFailure.TIMEOUT, "timeout waiting for human response");
        }
        case CANCELLED -> {
            answerSlot.withdraw(requestId);
            log.info("[Decision] Human decision {} cancelled before an answer arrived", requestId);
            throw new DecisionException(DecisionFailure.CONFLICT, "decision superseded by a newer request");
        }
        case INTERRUPTED -> {
            answerSlot.withdraw(requestId);
            log.warn("[Decision] Caller of human decision {} went away, decision withdrawn", requestId);
            throw new DecisionException(DecisionFailure.ABANDONED, "wait for human response interrupted");
        }
        };
    }

    /**
     * Ask without waiting.
     *
     * @return the request id to poll
     * @throws DecisionException
     *             with {@link DecisionFailure#CONFLICT} while another decision is
     *             pending
     */
    public String askAsync(String question, List<String> options) {
        requireQuestion(question);
        String destination = operatorDirectory.requireDestination();
        if (answerSlot.hasPending()) {
            throw new DecisionException(DecisionFailure.CONFLICT, "pending decision already exists");
        }

        String requestId = answerSlot.create(question, options);
        log.info("[Decision] Created async decision {}: {}", requestId, question);
        String prompt = promptRenderer.render(question, options, null, missionRegistry.lastStatus().orElse(null));
        deliverOrRollback(requestId, destination, prompt);
        return requestId;
    }

    public DecisionPoll poll(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            return DecisionPoll.notFound();
        }
        return answerSlot.peek(requestId);
    }

    /**
     * Feed an operator reply into the pending decision.
     *
     * @return true if the reply resolved a decision
     */
    public boolean onIncomingMessage(String sender, String text) {
        Optional<PendingDecision> pending = answerSlot.currentPending();
        if (pending.isEmpty()) {
            log.debug("[Decision] No pending decision, ignoring message from {}", sender);
            return false;
        }
        PendingDecision decision = pending.get();
        Optional<String> answer = replyParser.parse(text, decision.options());
        if (answer.isEmpty()) {
            return false;
        }
        boolean resolved = answerSlot.resolve(decision.id(), answer.get());
        if (resolved) {
            log.info("[Decision] Decision {} resolved by {}", decision.id(), sender);
        } else {
            log.debug("[Decision] Reply from {} arrived after decision {} closed", sender, decision.id());
        }
        return resolved;
    }

    public boolean hasPending() {
        return answerSlot.hasPending();
    }

    /**
     * Release any suspended caller. Called on shutdown.
     */
    @PreDestroy
    public void cancelPending() {
        if (answerSlot.hasPending()) {
            log.info("[Decision] Cancelling pending decision");
        }
        answerSlot.cancel();
    }

    /**
     * Convert a caller-supplied timeout in seconds.
     *
     * @return null when no timeout was given
     */
    public static Duration timeoutFromSeconds(Number seconds) {
        if (seconds == null) {
            return null;
        }
        double value = seconds.doubleValue();
        if (Double.isNaN(value) || value <= 0) {
            throw new IllegalArgumentException("timeout must be a positive number of seconds");
        }
        return Duration.ofMillis(Math.max(1L, Math.round(value * 1000)));
    }

    private void deliverOrRollback(String requestId, String destination, String prompt) {
        boolean delivered;
        try {
            delivered = deliveryPort.deliver(destination, prompt);
        } catch (RuntimeException e) {
            log.error("[Decision] Prompt delivery for {} failed: {}", requestId, e.getMessage(), e);
            delivered = false;
        }
        if (!delivered) {
            answerSlot.cancel(requestId);
            log.warn("[Decision] Prompt for {} not delivered, decision rolled back", requestId);
            throw new DecisionException(DecisionFailure.DELIVERY_FAILED, DELIVERY_FAILED_MESSAGE);
        }
    }

    private Duration resolveTimeout(Duration timeout) {
        if (timeout == null) {
            return Duration.ofSeconds(properties.getDecision().getDefaultTimeoutSeconds());
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be a positive number of seconds");
        }
        return timeout;
    }

    private static void requireQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
    }

    private static List<String> normalizeOptions(List<String> options) {
        if (options == null) {
            return List.of();
        }
        return options.stream()
                .filter(option -> option != null && !option.isBlank())
                .toList();
    }
}
