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
 * Machine-readable classification of human decision failures.
 */
public enum DecisionFailure {

    /**
     * A non-preempting request found a live decision in the slot.
     */
    CONFLICT,

    /**
     * No answer arrived before the deadline. The slot has been cleared.
     */
    TIMEOUT,

    /**
     * The prompt could not be delivered to the operator. The just-created
     * decision has been rolled back.
     */
    DELIVERY_FAILED,

    /**
     * No operator chat has been paired yet.
     */
    DESTINATION_MISSING,

    /**
     * The waiting caller went away before an answer arrived. The slot has been
     * cleared.
     */
    ABANDONED,

    /**
     * A result lookup used an id that is neither live nor remembered.
     */
    NOT_FOUND
}
