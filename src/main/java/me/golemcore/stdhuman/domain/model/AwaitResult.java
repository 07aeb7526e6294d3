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

/**
 * Tagged outcome of waiting on a pending decision.
 *
 * <p>
 * Waiting never throws for control flow: the caller branches on
 * {@link #status()} and only {@link Status#ANSWERED} carries an answer.
 */
public record AwaitResult(Status status, String answer) {

    public enum Status {
        ANSWERED, TIMED_OUT, CANCELLED, INTERRUPTED
    }

    public static AwaitResult answered(String answer) {
        return new AwaitResult(Status.ANSWERED, answer);
    }

    public static AwaitResult timedOut() {
        return new AwaitResult(Status.TIMED_OUT, null);
    }

    public static AwaitResult cancelled() {
        return new AwaitResult(Status.CANCELLED, null);
    }

    /**
     * The waiting thread was interrupted; the decision itself is still in the
     * slot.
     */
    public static AwaitResult interrupted() {
        return new AwaitResult(Status.INTERRUPTED, null);
    }

    public boolean isAnswered() {
        return status == Status.ANSWERED;
    }
}
