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

import lombok.RequiredArgsConstructor;
import me.golemcore.stdhuman.domain.model.DecisionException;
import me.golemcore.stdhuman.domain.model.DecisionFailure;
import me.golemcore.stdhuman.port.outbound.CredentialStorePort;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves where operator-facing messages go: the paired operator chat.
 */
@Component
@RequiredArgsConstructor
public class OperatorDirectory {

    static final String MISSING_DESTINATION_MESSAGE = "authorized user id missing; send /start <code>";

    private final CredentialStorePort credentialStore;

    public Optional<String> resolveDestination() {
        return credentialStore.getOperatorChatId().map(String::valueOf);
    }

    public String requireDestination() {
        return resolveDestination()
                .orElseThrow(() -> new DecisionException(DecisionFailure.DESTINATION_MISSING,
                        MISSING_DESTINATION_MESSAGE));
    }
}
