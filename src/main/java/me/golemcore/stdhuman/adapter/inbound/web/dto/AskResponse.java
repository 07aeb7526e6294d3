package me.golemcore.stdhuman.adapter.inbound.web.dto;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.golemcore.stdhuman.domain.model.AskResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AskResponse(
        String answer,
        @JsonProperty("request_id") String requestId,
        String status) {

    public static final String STATUS_PENDING = "pending";

    public static AskResponse answered(String answer) {
        return new AskResponse(answer, null, null);
    }

    public static AskResponse pending(String requestId) {
        return new AskResponse(null, requestId, STATUS_PENDING);
    }

    public static AskResponse stillPending() {
        return new AskResponse(null, null, STATUS_PENDING);
    }

    public static AskResponse from(AskResult result) {
        return result.isPending() ? pending(result.requestId()) : answered(result.answer());
    }
}
