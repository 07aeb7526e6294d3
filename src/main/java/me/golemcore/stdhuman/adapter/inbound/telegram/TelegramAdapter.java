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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import me.golemcore.stdhuman.port.inbound.ChannelPort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Telegram long polling channel.
 *
 * <p>
 * Receives {@code message} and {@code edited_message} updates and passes them to
 * {@link TelegramInboundHandler}. Started at boot by the application
 * configuration when {@code stdhuman.telegram.enabled} is set and a token is
 * configured.
 */
@Component
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";

    private final StdHumanProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final TelegramInboundHandler inboundHandler;

    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    public TelegramAdapter(StdHumanProperties properties, TelegramBotsLongPollingApplication botsApplication,
            TelegramInboundHandler inboundHandler) {
        this.properties = properties;
        this.botsApplication = botsApplication;
        this.inboundHandler = inboundHandler;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    public boolean isEnabled() {
        String token = properties.getTelegram().getToken();
        return properties.getTelegram().isEnabled() && token != null && !token.isBlank();
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Channel disabled or token missing, long polling not started");
                return;
            }
            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("[Telegram] Long polling started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start long polling", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Long polling stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping long polling", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        Message message = update.hasMessage() ? update.getMessage()
                : update.hasEditedMessage() ? update.getEditedMessage() : null;
        if (message == null || message.getChatId() == null) {
            return;
        }
        String text = message.hasText() ? message.getText() : "";
        try {
            inboundHandler.handle(message.getChatId(), resolveUsername(message), text);
        } catch (RuntimeException e) {
            log.error("[Telegram] Failed to handle update {}", update.getUpdateId(), e);
        }
    }

    private static String resolveUsername(Message message) {
        if (message.getFrom() != null && message.getFrom().getUserName() != null) {
            return message.getFrom().getUserName();
        }
        return message.getChat() != null ? message.getChat().getUserName() : null;
    }
}
