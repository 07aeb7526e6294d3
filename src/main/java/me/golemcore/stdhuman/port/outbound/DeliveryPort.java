package me.golemcore.stdhuman.port.outbound;

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

/**
 * Port for delivering text to the human operator (prompts, plan summaries,
 * status reports).
 *
 * <p>
 * Delivery is best-effort: implementations bound each send by their own short
 * timeout and report failure as {@code false} instead of throwing.
 */
public interface DeliveryPort {

    /**
     * Deliver text to the operator chat.
     *
     * @param destination
     *            the chat to deliver to
     * @param text
     *            plain text to send
     * @return true if the transport accepted the message
     */
    boolean deliver(String destination, String text);

    /**
     * Check if the transport is configured (e.g. a bot token is present).
     */
    boolean isAvailable();
}
