package me.golemcore.stdhuman.domain.service;

import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import me.golemcore.stdhuman.port.outbound.CredentialStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class StartCodeServiceTest {

    @TempDir
    Path tempDir;

    private CredentialStorePort credentialStore;
    private StdHumanProperties properties;
    private StartCodeService service;

    @BeforeEach
    void setUp() {
        credentialStore = mock(CredentialStorePort.class);
        when(credentialStore.getMachineId()).thenReturn(Optional.empty());
        when(credentialStore.getSalt()).thenReturn(Optional.empty());
        properties = new StdHumanProperties();
        service = new StartCodeService(credentialStore, properties);
    }

    // ===== derivation =====

    @Test
    void shouldDeriveKnownCodes() {
        assertEquals("SmFzcsL2iOj-", StartCodeService.deriveStartCode("machine-id:abc123", "pepper"));
        assertEquals("0ayRicNO2YtH", StartCodeService.deriveStartCode("host:box", "s"));
    }

    @Test
    void shouldProduceTwelveCharsFromAlphabet() {
        String code = StartCodeService.deriveStartCode("unknown", "salt");

        assertEquals(StartCodeService.CODE_LENGTH, code.length());
        assertTrue(code.chars().allMatch(c -> StartCodeService.ALPHABET.indexOf(c) >= 0));
    }

    // ===== machine id =====

    @Test
    void shouldPreferStoredMachineId() {
        when(credentialStore.getMachineId()).thenReturn(Optional.of("machine-id:stored"));

        assertEquals("machine-id:stored", service.getMachineId());
        verify(credentialStore, never()).saveMachineId(anyString());
    }

    @Test
    void shouldReadMachineIdFileAndStoreIt() throws Exception {
        Path empty = tempDir.resolve("empty-id");
        Files.writeString(empty, "  \n");
        Path machineId = tempDir.resolve("machine-id");
        Files.writeString(machineId, "abc123\n");
        service.setMachineIdFiles(List.of(tempDir.resolve("missing"), empty, machineId));

        assertEquals("machine-id:abc123", service.getMachineId());
        verify(credentialStore).saveMachineId("machine-id:abc123");
    }

    @Test
    void shouldFallBackToHostLevelIdentifier() {
        service.setMachineIdFiles(List.of(tempDir.resolve("missing")));

        String machineId = service.getMachineId();

        assertTrue(machineId.startsWith("mac:") || machineId.startsWith("host:") || machineId.equals("unknown"),
                machineId);
        verify(credentialStore).saveMachineId(machineId);
    }

    // ===== salt =====

    @Test
    void shouldPersistConfiguredSalt() {
        properties.getAuth().setStartCodeSalt("configured");

        assertEquals("configured", service.getSalt());
        verify(credentialStore).saveSalt("configured");
    }

    @Test
    void shouldReuseStoredSalt() {
        when(credentialStore.getSalt()).thenReturn(Optional.of("stored"));

        assertEquals("stored", service.getSalt());
        verify(credentialStore, never()).saveSalt(anyString());
    }

    @Test
    void shouldGenerateRandomHexSalt() {
        String salt = service.getSalt();

        assertTrue(salt.matches("[0-9a-f]{32}"), salt);
        verify(credentialStore).saveSalt(salt);
    }

    // ===== code =====

    @Test
    void shouldMatchOnlyTheDerivedCode() {
        when(credentialStore.getMachineId()).thenReturn(Optional.of("machine-id:abc123"));
        properties.getAuth().setStartCodeSalt("pepper");

        assertEquals("SmFzcsL2iOj-", service.getStartCode());
        assertTrue(service.matches("SmFzcsL2iOj-"));
        assertFalse(service.matches("SmFzcsL2iOj_"));
        assertFalse(service.matches(null));
    }
}
