package me.golemcore.stdhuman;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the StdHuman bridge.
 *
 * <p>
 * StdHuman lets an automated agent hand a decision to a human operator over
 * Telegram and resume once the operator answers.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Human decisions</b> - one outstanding question at a time, answered
 * synchronously (wait with timeout) or asynchronously (create and poll)</li>
 * <li><b>Mission log</b> - plan and status reports forwarded to the
 * operator</li>
 * <li><b>MCP endpoint</b> - the same operations exposed as JSON-RPC tools</li>
 * <li><b>Pairing</b> - the operator claims the bot with a machine-derived
 * {@code /start} code</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → AskController, McpController, TelegramAdapter
 * Domain Layer       → AnswerSlot, DecisionService, MissionService
 * Infrastructure     → Telegram delivery, local credential files
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code stdhuman.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class StdHumanApplication {

    public static void main(String[] args) {
        SpringApplication.run(StdHumanApplication.class, args);
    }

}
