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
import me.golemcore.stdhuman.domain.model.PairingResult;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import me.golemcore.stdhuman.infrastructure.i18n.MessageService;
import me.golemcore.stdhuman.port.outbound.CredentialStorePort;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Pairs the single operator with the bot and checks every later message against
 * that pairing.
 *
 * <p>
 * A chat is authorized only when its id equals the stored operator chat and its
 * username matches the configured operator username (case-insensitive, leading
 * {@code @} ignored). Pairing requires the machine-derived {@code /start} code.
 */
@Service
@Slf4j
public class OperatorAuthorizationService {

    private final CredentialStorePort credentialStore;
    private final StartCodeService startCodeService;
    private final MessageService messageService;
    private final StdHumanProperties properties;

    public OperatorAuthorizationService(CredentialStorePort credentialStore, StartCodeService startCodeService,
            MessageService messageService, StdHumanProperties properties) {
        this.credentialStore = credentialStore;
        this.startCodeService = startCodeService;
        this.messageService = messageService;
        this.properties = properties;
    }

    public PairingResult handleStart(long chatId, String username, String text) {
        Optional<String> code = extractStartCode(text);
        if (code.isEmpty()) {
            log.warn("[Auth] Start denied: missing code");
            return denied("telegram.auth.code-required");
        }
        if (!startCodeService.matches(code.get())) {
            log.warn("[Auth] Start denied: invalid code");
            return denied("telegram.auth.failed");
        }
        if (!isOperatorUsername(username)) {
            log.warn("[Auth] Start denied: username mismatch");
            return denied("telegram.auth.username-required");
        }
        Optional<Long> stored = credentialStore.getOperatorChatId();
        if (stored.isPresent() && stored.get() != chatId) {
            log.warn("[Auth] Start denied: stored chat id belongs to another chat");
            return denied("telegram.auth.mismatch");
        }

        credentialStore.rememberOperatorChatId(chatId);
        log.info("[Auth] Operator paired with chat {}", chatId);
        return new PairingResult(true, messageService.getMessage("telegram.info",
                properties.getProjectName(), properties.getBaseUrl()));
    }

    public boolean isAuthorized(long chatId, String username) {
        Optional<Long> stored = credentialStore.getOperatorChatId();
        if (stored.isEmpty()) {
            log.warn("[Auth] Authorization denied: no paired operator");
            return false;
        }
        if (!isOperatorUsername(username)) {
            log.warn("[Auth] Authorization denied: {}", username == null || username.isBlank()
                    ? "missing username"
                    : "username mismatch");
            return false;
        }
        if (stored.get() != chatId) {
            log.warn("[Auth] Authorization denied: chat id mismatch");
            return false;
        }
        return true;
    }

    public String mismatchMessage() {
        return messageService.getMessage("telegram.auth.mismatch");
    }

    boolean isOperatorUsername(String username) {
        String normalized = normalizeUsername(username);
        String configured = normalizeUsername(properties.getTelegram().getOperatorUsername());
        return normalized != null && normalized.equals(configured);
    }

    static String normalizeUsername(String username) {
        if (username == null) {
            return null;
        }
        String trimmed = username.strip();
        while (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    static Optional<String> extractStartCode(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String[] parts = text.strip().split("\\s+", 2);
        if (parts.length < 2 || parts[1].isBlank()) {
            return Optional.empty();
        }
        return Optional.of(parts[1].strip());
    }

    private PairingResult denied(String messageKey) {
        return new PairingResult(false, messageService.getMessage(messageKey));
    }
}
