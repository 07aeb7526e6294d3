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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /v1/ask} and arguments of the {@code ask} tool.
 * {@code timeout} is in seconds and only applies to sync mode.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

    private String question;

    @Builder.Default
    private List<String> options = new ArrayList<>();

    private String mode;
    private Double timeout;
}
