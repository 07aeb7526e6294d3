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
import me.golemcore.stdhuman.domain.model.AwaitResult;
import me.golemcore.stdhuman.domain.model.DecisionException;
import me.golemcore.stdhuman.domain.model.DecisionFailure;
import me.golemcore.stdhuman.domain.model.DecisionPoll;
import me.golemcore.stdhuman.domain.model.PendingDecision;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-occupancy rendezvous between an agent waiting for a human decision and
 * the operator reply that answers it.
 *
 * <p>
 * The slot holds at most one decision. Each decision gets a fresh id and a fresh
 * completion handle; its outcome is assigned once, either an answer or a
 * cancellation, and never overwritten.
 *
 * <p>
 * Lifecycle:
 * <ul>
 * <li>{@link #create} installs a decision, rejecting while one is live
 * <li>{@link #replace} cancels a live decision and installs a new one atomically
 * <li>{@link #resolve} answers the live decision, first reply wins
 * <li>{@link #await} blocks outside the lock until answered, cancelled, timed
 * out or interrupted
 * <li>{@link #cancel} and {@link #clear} release waiters and empty the slot
 * <li>{@link #withdraw} empties the slot and hands back an answer that won the
 * race against the caller giving up
 * </ul>
 *
 * <p>
 * An answered decision keeps occupying the slot until it is cleared or
 * superseded, so asynchronous callers can read it back by id. A stale or
 * foreign id never sees another decision's answer.
 */
@Component
@Slf4j
public class AnswerSlot {

    private final Object lock = new Object();
    private final Clock clock;

    // guarded by lock
    private Entry current;

    public AnswerSlot(Clock clock) {
        this.clock = clock;
    }

    /**
     * Install a new decision.
     *
     * @throws DecisionException
     *             with {@link DecisionFailure#CONFLICT} if a live decision
     *             already occupies the slot
     * @return the id of the new decision
     */
    public String create(String question, List<String> options) {
        synchronized (lock) {
            if (current != null && current.isLive()) {
                throw new DecisionException(DecisionFailure.CONFLICT, "pending decision already exists");
            }
            return installLocked(question, options);
        }
    }

    /**
     * Cancel the live decision, if any, and install a new one in the same step.
     */
    public String replace(String question, List<String> options) {
        synchronized (lock) {
            if (current != null && current.isLive()) {
                log.info("[Decision] Preempting pending decision {}", current.decision.id());
                current.cancel();
            }
            return installLocked(question, options);
        }
    }

    /**
     * Block until the decision with the given id is answered, cancelled or the
     * timeout elapses. The slot is not cleared here.
     */
    public AwaitResult await(String id, Duration timeout) {
        CompletableFuture<String> future;
        synchronized (lock) {
            if (current == null || !current.decision.id().equals(id)) {
                return AwaitResult.cancelled();
            }
            future = current.future;
        }

        try {
            return AwaitResult.answered(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return AwaitResult.timedOut();
        } catch (CancellationException e) {
            return AwaitResult.cancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Decision] Wait for {} interrupted", id);
            return AwaitResult.interrupted();
        } catch (ExecutionException e) {
            // futures are only completed normally or cancelled
            throw new IllegalStateException("decision " + id + " completed exceptionally", e.getCause());
        }
    }

    /**
     * Answer the live decision.
     *
     * @return false if the slot is empty or its decision is already terminal
     */
    public boolean resolve(String answer) {
        synchronized (lock) {
            if (current == null || !current.isLive()) {
                return false;
            }
            current.answer(answer);
            return true;
        }
    }

    /**
     * Answer the live decision only if it is still the one with the given id.
     */
    public boolean resolve(String id, String answer) {
        synchronized (lock) {
            if (current == null || !current.decision.id().equals(id) || !current.isLive()) {
                return false;
            }
            current.answer(answer);
            return true;
        }
    }

    public DecisionPoll peek(String id) {
        synchronized (lock) {
            if (id == null || current == null || !current.decision.id().equals(id)) {
                return DecisionPoll.notFound();
            }
            if (current.outcome == Outcome.ANSWERED) {
                return DecisionPoll.answered(current.answer);
            }
            return DecisionPoll.pending();
        }
    }

    /**
     * Cancel whatever occupies the slot and empty it. Idempotent.
     */
    public void cancel() {
        synchronized (lock) {
            discardLocked();
        }
    }

    /**
     * Cancel and empty the slot only if it still holds the given decision.
     *
     * @return true if the decision was found and discarded
     */
    public boolean cancel(String id) {
        synchronized (lock) {
            if (current == null || !current.decision.id().equals(id)) {
                return false;
            }
            discardLocked();
            return true;
        }
    }

    /**
     * Empty the slot after the decision with the given id has been consumed.
     * Leaves a newer decision untouched.
     */
    public boolean clear(String id) {
        return cancel(id);
    }

    /**
     * Remove the decision with the given id, cancelling it if still live.
     *
     * @return the answer if one was recorded before removal
     */
    public Optional<String> withdraw(String id) {
        synchronized (lock) {
            if (current == null || !current.decision.id().equals(id)) {
                return Optional.empty();
            }
            Optional<String> answer = current.outcome == Outcome.ANSWERED
                    ? Optional.of(current.answer)
                    : Optional.empty();
            discardLocked();
            return answer;
        }
    }

    public boolean hasPending() {
        synchronized (lock) {
            return current != null && current.isLive();
        }
    }

    /**
     * The live decision, if one is waiting for an answer.
     */
    public Optional<PendingDecision> currentPending() {
        synchronized (lock) {
            if (current == null || !current.isLive()) {
                return Optional.empty();
            }
            return Optional.of(current.decision);
        }
    }

    private String installLocked(String question, List<String> options) {
        PendingDecision decision = new PendingDecision(
                UUID.randomUUID().toString(), question, options, Instant.now(clock));
        current = new Entry(decision);
        log.debug("[Decision] Created decision {}", decision.id());
        return decision.id();
    }

    @SuppressWarnings("PMD.NullAssignment") // empty slot
    private void discardLocked() {
        if (current == null) {
            return;
        }
        if (current.isLive()) {
            current.cancel();
            log.info("[Decision] Cancelled decision {}", current.decision.id());
        }
        current = null;
    }

    private enum Outcome {
        UNSET, ANSWERED, CANCELLED
    }

    private static final class Entry {

        private final PendingDecision decision;
        private final CompletableFuture<String> future = new CompletableFuture<>();
        private Outcome outcome = Outcome.UNSET;
        private String answer;

        private Entry(PendingDecision decision) {
            this.decision = decision;
        }

        private boolean isLive() {
            return outcome == Outcome.UNSET;
        }

        private void answer(String text) {
            outcome = Outcome.ANSWERED;
            answer = text;
            future.complete(text);
        }

        private void cancel() {
            outcome = Outcome.CANCELLED;
            future.cancel(false);
        }
    }
}
