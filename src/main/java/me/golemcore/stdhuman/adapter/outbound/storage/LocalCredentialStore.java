package me.golemcore.stdhuman.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import me.golemcore.stdhuman.port.outbound.CredentialStorePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Local filesystem implementation of {@link CredentialStorePort}.
 *
 * <p>
 * Each value is a plain-text file under {@code stdhuman.auth.base-path}:
 * <ul>
 * <li>{@code .telegram_user_id} - paired operator chat id</li>
 * <li>{@code .telegram_machine_id} - machine identifier for the pairing
 * code</li>
 * <li>{@code .telegram_start_salt} - pairing code salt</li>
 * </ul>
 *
 * <p>
 * If a container mount turned one of these paths into a directory, the value is
 * kept in an {@code id} file inside it.
 */
@Component
@Slf4j
public class LocalCredentialStore implements CredentialStorePort {

    static final String USER_ID_FILE = ".telegram_user_id";
    static final String MACHINE_ID_FILE = ".telegram_machine_id";
    static final String SALT_FILE = ".telegram_start_salt";
    private static final String DIRECTORY_ENTRY = "id";

    private final StdHumanProperties properties;
    private Path basePath;

    public LocalCredentialStore(StdHumanProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        basePath = Paths.get(properties.getAuth().getBasePath()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(basePath);
            Path userIdFile = resolve(USER_ID_FILE);
            if (!Files.exists(userIdFile)) {
                Files.writeString(userIdFile, "", StandardCharsets.UTF_8);
            }
            log.info("[Auth] Credential files stored in: {}", basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize credential store at " + basePath, e);
        }
    }

    @Override
    public Optional<Long> getOperatorChatId() {
        return read(USER_ID_FILE).flatMap(text -> {
            try {
                return Optional.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                log.warn("[Auth] Ignoring malformed operator chat id");
                return Optional.empty();
            }
        });
    }

    @Override
    public void rememberOperatorChatId(long chatId) {
        write(USER_ID_FILE, Long.toString(chatId));
    }

    @Override
    public Optional<String> getMachineId() {
        return read(MACHINE_ID_FILE);
    }

    @Override
    public void saveMachineId(String machineId) {
        write(MACHINE_ID_FILE, machineId);
    }

    @Override
    public Optional<String> getSalt() {
        return read(SALT_FILE);
    }

    @Override
    public void saveSalt(String salt) {
        write(SALT_FILE, salt);
    }

    private Optional<String> read(String name) {
        Path file = resolve(name);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8).strip();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        } catch (IOException e) {
            log.warn("[Auth] Failed to read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String name, String value) {
        Path file = resolve(name);
        try {
            Files.writeString(file, value, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    private Path resolve(String name) {
        Path file = basePath.resolve(name);
        if (Files.isDirectory(file)) {
            return file.resolve(DIRECTORY_ENTRY);
        }
        return file;
    }
}
