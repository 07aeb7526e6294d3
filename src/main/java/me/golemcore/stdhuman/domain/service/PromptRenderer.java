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

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the text shown to the operator for a decision.
 */
@Component
public class PromptRenderer {

    public String render(String question, List<String> options, Duration timeout, String lastStatus) {
        List<String> lines = new ArrayList<>();
        lines.add("Summary: " + question);
        if (lastStatus != null && !lastStatus.isBlank()) {
            lines.add("Last status: " + lastStatus);
        }
        if (timeout != null) {
            lines.add("Timeout: " + formatSeconds(timeout) + "s");
        }
        if (options != null && !options.isEmpty()) {
            lines.add("Options:");
            for (int i = 0; i < options.size(); i++) {
                lines.add((i + 1) + ") " + options.get(i));
            }
        }
        lines.add("Reply with plain text.");
        return String.join("\n", lines);
    }

    static String formatSeconds(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 1000 == 0) {
            return Long.toString(millis / 1000);
        }
        return BigDecimal.valueOf(millis, 3).stripTrailingZeros().toPlainString();
    }
}
