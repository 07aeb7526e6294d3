package me.golemcore.stdhuman.adapter.outbound.storage;

import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LocalCredentialStoreTest {

    @TempDir
    Path tempDir;

    private LocalCredentialStore store;

    @BeforeEach
    void setUp() {
        store = newStore(tempDir);
    }

    private static LocalCredentialStore newStore(Path basePath) {
        StdHumanProperties properties = new StdHumanProperties();
        properties.getAuth().setBasePath(basePath.toString());
        LocalCredentialStore store = new LocalCredentialStore(properties);
        store.init();
        return store;
    }

    @Test
    void shouldCreateEmptyUserIdFileOnInit() throws Exception {
        Path userIdFile = tempDir.resolve(LocalCredentialStore.USER_ID_FILE);

        assertTrue(Files.isRegularFile(userIdFile));
        assertEquals("", Files.readString(userIdFile));
        assertTrue(store.getOperatorChatId().isEmpty());
    }

    @Test
    void shouldRememberOperatorChatIdAcrossInstances() {
        store.rememberOperatorChatId(123456789L);

        assertEquals(Optional.of(123456789L), newStore(tempDir).getOperatorChatId());
    }

    @Test
    void shouldIgnoreMalformedChatId() throws Exception {
        Files.writeString(tempDir.resolve(LocalCredentialStore.USER_ID_FILE), "not-a-number");

        assertTrue(store.getOperatorChatId().isEmpty());
    }

    @Test
    void shouldStoreMachineIdAndSaltTrimmed() throws Exception {
        store.saveMachineId("machine-id:abc");
        Files.writeString(tempDir.resolve(LocalCredentialStore.SALT_FILE), "  pepper \n");

        assertEquals(Optional.of("machine-id:abc"), store.getMachineId());
        assertEquals(Optional.of("pepper"), store.getSalt());
    }

    @Test
    void shouldUseIdFileInsideDirectoryMount() throws Exception {
        Path mounted = tempDir.resolve(LocalCredentialStore.MACHINE_ID_FILE);
        Files.createDirectories(mounted);
        Files.writeString(mounted.resolve("id"), "host:box");

        assertEquals(Optional.of("host:box"), store.getMachineId());

        store.saveMachineId("host:other");
        assertEquals("host:other", Files.readString(mounted.resolve("id")));
    }

    @Test
    void shouldCreateMissingBaseDirectory() {
        Path nested = tempDir.resolve("a/b");

        LocalCredentialStore nestedStore = newStore(nested);
        nestedStore.saveSalt("s");

        assertTrue(Files.isRegularFile(nested.resolve(LocalCredentialStore.SALT_FILE)));
        assertEquals(Optional.of("s"), nestedStore.getSalt());
    }
}
