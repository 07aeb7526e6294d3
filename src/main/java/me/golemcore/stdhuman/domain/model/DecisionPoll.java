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
 * Non-blocking view of an asynchronous decision, looked up by request id.
 *
 * <p>
 * {@link Status#NOT_FOUND} is distinct from {@link Status#PENDING}: it means the
 * id was never issued or belongs to a superseded decision.
 */
public record DecisionPoll(Status status, String answer) {

    public enum Status {
        PENDING, ANSWERED, NOT_FOUND
    }

    public static DecisionPoll pending() {
        return new DecisionPoll(Status.PENDING, null);
    }

    public static DecisionPoll answered(String answer) {
        return new DecisionPoll(Status.ANSWERED, answer);
    }

    public static DecisionPoll notFound() {
        return new DecisionPoll(Status.NOT_FOUND, null);
    }
}
