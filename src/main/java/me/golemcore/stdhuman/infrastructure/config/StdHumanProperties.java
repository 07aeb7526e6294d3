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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the bridge, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code stdhuman.*} prefix:
 * <ul>
 * <li>{@link DecisionProperties} - human decision defaults</li>
 * <li>{@link TelegramProperties} - the operator chat channel</li>
 * <li>{@link AuthProperties} - pairing code and operator files</li>
 * <li>{@link McpProperties} - JSON-RPC endpoint streaming</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "stdhuman")
@Data
public class StdHumanProperties {

    private String projectName = "StdHuman Agent";
    private String baseUrl = "http://localhost:18081";
    private DecisionProperties decision = new DecisionProperties();
    private TelegramProperties telegram = new TelegramProperties();
    private AuthProperties auth = new AuthProperties();
    private McpProperties mcp = new McpProperties();

    @Data
    public static class DecisionProperties {
        private int defaultTimeoutSeconds = 3600;
    }

    @Data
    public static class TelegramProperties {
        private boolean enabled = true;
        private String token;
        private String operatorUsername;
        private int deliveryTimeoutSeconds = 5;
        private long startReplyDelayMillis = 2500;
        private String language = "en";
    }

    @Data
    public static class AuthProperties {
        private String basePath = ".";
        private String startCodeSalt;
    }

    @Data
    public static class McpProperties {
        private int keepAliveSeconds = 15;
    }
}
