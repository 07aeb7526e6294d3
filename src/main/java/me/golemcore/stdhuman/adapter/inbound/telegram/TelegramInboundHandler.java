package me.golemcore.stdhuman.adapter.inbound.telegram;

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
import me.golemcore.stdhuman.domain.service.DecisionService;
import me.golemcore.stdhuman.domain.service.OperatorAuthorizationService;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import me.golemcore.stdhuman.port.outbound.DeliveryPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Routes operator chat messages, shared by long polling and the webhook.
 *
 * <p>
 * {@code /start} goes to pairing and is answered after a fixed delay. Other
 * messages from the paired operator are fed to the pending decision; anyone
 * else gets an authorization mismatch notice.
 */
@Component
@Slf4j
public class TelegramInboundHandler {

    private static final String START_COMMAND = "/start";

    private final OperatorAuthorizationService authorizationService;
    private final DecisionService decisionService;
    private final DeliveryPort deliveryPort;
    private final StdHumanProperties properties;

    public TelegramInboundHandler(OperatorAuthorizationService authorizationService,
            DecisionService decisionService, DeliveryPort deliveryPort, StdHumanProperties properties) {
        this.authorizationService = authorizationService;
        this.decisionService = decisionService;
        this.deliveryPort = deliveryPort;
        this.properties = properties;
    }

    public InboundResult handle(long chatId, String username, String text) {
        String cleaned = text != null ? text.strip() : "";
        log.debug("[Telegram] Message from chat {}: {}", chatId, cleaned);

        if (cleaned.startsWith(START_COMMAND)) {
            PairingResult result = authorizationService.handleStart(chatId, username, cleaned);
            replyLater(chatId, result.reply());
            return InboundResult.OK;
        }

        if (!authorizationService.isAuthorized(chatId, username)) {
            deliveryPort.deliver(String.valueOf(chatId), authorizationService.mismatchMessage());
            return InboundResult.UNAUTHORIZED;
        }

        boolean resolved = decisionService.onIncomingMessage(String.valueOf(chatId), cleaned);
        return resolved ? InboundResult.OK : InboundResult.IGNORED;
    }

    private void replyLater(long chatId, String reply) {
        Executor delayed = CompletableFuture.delayedExecutor(
                properties.getTelegram().getStartReplyDelayMillis(), TimeUnit.MILLISECONDS);
        CompletableFuture.runAsync(() -> deliveryPort.deliver(String.valueOf(chatId), reply), delayed)
                .exceptionally(e -> {
                    log.error("[Telegram] Failed to send /start reply to chat {}", chatId, e);
                    return null;
                });
    }
}
