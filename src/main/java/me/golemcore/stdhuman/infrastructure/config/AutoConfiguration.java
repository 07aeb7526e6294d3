package me.golemcore.stdhuman.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.domain.service.StartCodeService;
import me.golemcore.stdhuman.infrastructure.i18n.MessageService;
import me.golemcore.stdhuman.port.inbound.ChannelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Application wiring and startup.
 *
 * <p>
 * Provides the shared {@link Clock} and {@link ObjectMapper}, validates the
 * operator configuration, logs the pairing code and starts the chat channels.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final StdHumanProperties properties;
    private final List<ChannelPort> channelPorts;
    private final StartCodeService startCodeService;
    private final MessageService messageService;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("{} starting...", properties.getProjectName());
        validateOperatorUsername(properties.getTelegram().getOperatorUsername());
        log.info("Base URL: {}", properties.getBaseUrl());
        log.info("Credential path: {}", properties.getAuth().getBasePath());
        messageService.setLanguage(properties.getTelegram().getLanguage());

        log.info("[Auth] Pairing code: /start {}", startCodeService.getStartCode());

        for (ChannelPort channel : channelPorts) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }
        log.info("{} started successfully", properties.getProjectName());
    }

    static void validateOperatorUsername(String username) {
        if (username == null || username.isBlank()) {
            log.warn("[Auth] stdhuman.telegram.operator-username is not set, no operator can pair");
            return;
        }
        if (!username.strip().startsWith("@")) {
            throw new IllegalStateException("stdhuman.telegram.operator-username must start with '@'");
        }
    }
}
