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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Telegram webhook endpoint, an alternative to long polling.
 *
 * <p>
 * Accepts a raw Telegram update and runs it through the same
 * {@link TelegramInboundHandler}. Updates without a message are acknowledged and
 * dropped.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TelegramWebhookController {

    private final TelegramInboundHandler inboundHandler;

    @PostMapping("/telegram/webhook")
    public Mono<ResponseEntity<WebhookAck>> onUpdate(@RequestBody JsonNode update) {
        return Mono.fromCallable(() -> {
            JsonNode message = firstPresent(update.path("message"), update.path("edited_message"));
            if (message == null) {
                return ResponseEntity.ok(WebhookAck.accepted());
            }

            JsonNode chat = message.path("chat");
            Long chatId = parseChatId(chat.path("id"));
            if (chatId == null) {
                log.warn("[Telegram] Webhook update without chat id");
                return ResponseEntity.ok(WebhookAck.rejected("missing chat id"));
            }

            String text = message.path("text").asText("");
            String username = textOrNull(message.path("from").path("username"));
            if (username == null) {
                username = textOrNull(chat.path("username"));
            }

            InboundResult result = inboundHandler.handle(chatId, username, text);
            if (result == InboundResult.UNAUTHORIZED) {
                return ResponseEntity.ok(WebhookAck.rejected("unauthorized"));
            }
            return ResponseEntity.ok(WebhookAck.accepted());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static JsonNode firstPresent(JsonNode first, JsonNode second) {
        if (first.isObject()) {
            return first;
        }
        return second.isObject() ? second : null;
    }

    private static Long parseChatId(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
