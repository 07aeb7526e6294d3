package me.golemcore.stdhuman.adapter.outbound.telegram;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import me.golemcore.stdhuman.port.outbound.DeliveryPort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Telegram-based implementation of {@link DeliveryPort}.
 *
 * <p>
 * Sends plain-text messages to the operator chat. Each send runs on a dedicated
 * worker and is bounded by
 * {@code stdhuman.telegram.delivery-timeout-seconds}; a hung request is
 * interrupted and reported as a failed delivery. Texts longer than Telegram's
 * message limit are truncated.
 *
 * <p>
 * The TelegramClient is created lazily from the configured token on first use.
 */
@Component
@Slf4j
public class TelegramDeliveryAdapter implements DeliveryPort {

    static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;

    private final StdHumanProperties properties;
    private final ExecutorService sendExecutor;

    private volatile TelegramClient telegramClient;

    public TelegramDeliveryAdapter(StdHumanProperties properties) {
        this.properties = properties;
        this.sendExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "telegram-delivery");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void destroy() {
        sendExecutor.shutdownNow();
        try {
            sendExecutor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Set the TelegramClient instance. Package-private for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    @Override
    public boolean isAvailable() {
        return getOrCreateClient() != null;
    }

    @Override
    public boolean deliver(String destination, String text) {
        TelegramClient client = getOrCreateClient();
        if (client == null) {
            log.warn("[Telegram] Client not configured, cannot deliver message");
            return false;
        }
        if (destination == null || !isNumeric(destination)) {
            log.warn("[Telegram] Invalid chat id: {}", destination);
            return false;
        }

        SendMessage message = SendMessage.builder()
                .chatId(destination)
                .text(truncate(text))
                .build();

        Future<?> send = sendExecutor.submit(() -> {
            client.execute(message);
            return null;
        });
        int timeoutSeconds = properties.getTelegram().getDeliveryTimeoutSeconds();
        try {
            send.get(timeoutSeconds, TimeUnit.SECONDS);
            log.info("[Telegram] Message sent to chat {}", destination);
            return true;
        } catch (TimeoutException e) {
            send.cancel(true);
            log.error("[Telegram] Sending to chat {} timed out after {}s", destination, timeoutSeconds);
            return false;
        } catch (ExecutionException e) {
            log.error("[Telegram] Failed to send message to chat {}: {}", destination,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (InterruptedException e) {
            send.cancel(true);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private TelegramClient getOrCreateClient() {
        TelegramClient client = this.telegramClient;
        if (client != null) {
            return client;
        }
        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            return null;
        }
        synchronized (this) {
            if (this.telegramClient == null) {
                this.telegramClient = new OkHttpTelegramClient(token);
                log.debug("[Telegram] Client lazily initialized for delivery");
            }
            return this.telegramClient;
        }
    }

    static String truncate(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= TELEGRAM_MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH);
    }

    private static boolean isNumeric(String value) {
        String digits = value.startsWith("-") ? value.substring(1) : value;
        return !digits.isEmpty() && digits.chars().allMatch(Character::isDigit);
    }
}
