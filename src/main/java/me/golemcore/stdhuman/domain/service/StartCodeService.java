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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import me.golemcore.stdhuman.port.outbound.CredentialStorePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigInteger;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Derives the {@code /start} pairing code from a stable machine identifier and a
 * salt.
 *
 * <p>
 * The code is 12 characters over {@code a-zA-Z0-9-_}, taken by repeated division
 * of the SHA-256 digest of {@code machineId:salt}. The machine identifier and
 * salt are persisted on first use so the code survives restarts.
 *
 * <p>
 * Machine identifier sources, in order:
 * <ol>
 * <li>previously stored value</li>
 * <li>{@code /etc/machine-id}, then {@code /var/lib/dbus/machine-id}</li>
 * <li>hardware address of the first non-loopback interface</li>
 * <li>host name</li>
 * <li>{@code unknown}</li>
 * </ol>
 */
@Service
@Slf4j
public class StartCodeService {

    static final int CODE_LENGTH = 12;
    static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789-_";
    private static final int SALT_BYTES = 16;
    private static final String UNKNOWN_MACHINE = "unknown";

    private final CredentialStorePort credentialStore;
    private final StdHumanProperties properties;
    private final SecureRandom random = new SecureRandom();
    private List<Path> machineIdFiles = List.of(Path.of("/etc/machine-id"), Path.of("/var/lib/dbus/machine-id"));

    public StartCodeService(CredentialStorePort credentialStore, StdHumanProperties properties) {
        this.credentialStore = credentialStore;
        this.properties = properties;
    }

    public String getStartCode() {
        return deriveStartCode(getMachineId(), getSalt());
    }

    public boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        byte[] expected = getStartCode().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, candidate.getBytes(StandardCharsets.UTF_8));
    }

    public String getMachineId() {
        Optional<String> stored = credentialStore.getMachineId();
        if (stored.isPresent()) {
            return stored.get();
        }
        String machineId = detectMachineId();
        credentialStore.saveMachineId(machineId);
        log.info("[Auth] Machine id resolved from {}", machineId.contains(":")
                ? machineId.substring(0, machineId.indexOf(':'))
                : machineId);
        return machineId;
    }

    public String getSalt() {
        String configured = properties.getAuth().getStartCodeSalt();
        if (configured != null && !configured.isBlank()) {
            credentialStore.saveSalt(configured);
            return configured;
        }
        Optional<String> stored = credentialStore.getSalt();
        if (stored.isPresent()) {
            return stored.get();
        }
        byte[] bytes = new byte[SALT_BYTES];
        random.nextBytes(bytes);
        String salt = HexFormat.of().formatHex(bytes);
        credentialStore.saveSalt(salt);
        log.info("[Auth] Generated new pairing salt");
        return salt;
    }

    static String deriveStartCode(String machineId, String salt) {
        byte[] digest = sha256((machineId + ":" + salt).getBytes(StandardCharsets.UTF_8));
        BigInteger number = new BigInteger(1, digest);
        BigInteger base = BigInteger.valueOf(ALPHABET.length());
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            BigInteger[] quotientAndRemainder = number.divideAndRemainder(base);
            code.append(ALPHABET.charAt(quotientAndRemainder[1].intValue()));
            number = quotientAndRemainder[0];
        }
        return code.toString();
    }

    void setMachineIdFiles(List<Path> machineIdFiles) {
        this.machineIdFiles = machineIdFiles;
    }

    private String detectMachineId() {
        for (Path file : machineIdFiles) {
            Optional<String> value = readTrimmed(file);
            if (value.isPresent()) {
                return "machine-id:" + value.get();
            }
        }
        Optional<String> mac = hardwareAddress();
        if (mac.isPresent()) {
            return "mac:" + mac.get();
        }
        Optional<String> host = hostName();
        if (host.isPresent()) {
            return "host:" + host.get();
        }
        return UNKNOWN_MACHINE;
    }

    private Optional<String> readTrimmed(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8).strip();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        } catch (IOException e) {
            log.debug("[Auth] Cannot read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> hardwareAddress() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            if (interfaces == null) {
                return Optional.empty();
            }
            for (NetworkInterface networkInterface : Collections.list(interfaces)) {
                if (networkInterface.isLoopback()) {
                    continue;
                }
                byte[] address = networkInterface.getHardwareAddress();
                if (address != null && address.length > 0) {
                    return Optional.of(HexFormat.of().formatHex(address));
                }
            }
        } catch (SocketException e) {
            log.debug("[Auth] Cannot list network interfaces: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private Optional<String> hostName() {
        try {
            String name = InetAddress.getLocalHost().getHostName();
            return name == null || name.isBlank() ? Optional.empty() : Optional.of(name);
        } catch (UnknownHostException e) {
            log.debug("[Auth] Cannot resolve host name: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
