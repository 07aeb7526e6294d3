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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps an operator chat reply onto an answer for the pending decision.
 *
 * <p>
 * A leading {@code /answer} or {@code /a} command is stripped. A purely numeric
 * reply within the option range selects that option (1-based); any other reply
 * is taken verbatim.
 */
@Component
public class ReplyParser {

    private static final String ANSWER_COMMAND = "/answer";
    private static final String SHORT_ANSWER_COMMAND = "/a";

    public Optional<String> parse(String text, List<String> options) {
        if (text == null) {
            return Optional.empty();
        }
        String cleaned = stripCommand(text.strip());
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        if (isDigits(cleaned) && options != null) {
            Optional<String> selected = selectOption(cleaned, options);
            if (selected.isPresent()) {
                return selected;
            }
        }
        return Optional.of(cleaned);
    }

    private String stripCommand(String text) {
        String lowered = text.toLowerCase(Locale.ROOT);
        if (lowered.startsWith(ANSWER_COMMAND)) {
            return text.substring(ANSWER_COMMAND.length()).strip();
        }
        if (lowered.equals(SHORT_ANSWER_COMMAND) || lowered.startsWith(SHORT_ANSWER_COMMAND + " ")) {
            return text.substring(SHORT_ANSWER_COMMAND.length()).strip();
        }
        return text;
    }

    private Optional<String> selectOption(String digits, List<String> options) {
        // longer than any sane option count
        if (digits.length() > 9) {
            return Optional.empty();
        }
        int index = Integer.parseInt(digits) - 1;
        if (index >= 0 && index < options.size()) {
            return Optional.of(options.get(index));
        }
        return Optional.empty();
    }

    private static boolean isDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
