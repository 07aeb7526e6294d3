package me.golemcore.stdhuman.domain.service;

import me.golemcore.stdhuman.domain.model.PairingResult;
import me.golemcore.stdhuman.infrastructure.config.StdHumanProperties;
import me.golemcore.stdhuman.infrastructure.i18n.MessageService;
import me.golemcore.stdhuman.port.outbound.CredentialStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class OperatorAuthorizationServiceTest {

    private static final long CHAT_ID = 1001L;
    private static final String CODE = "AbCdEf123456";

    private CredentialStorePort credentialStore;
    private StartCodeService startCodeService;
    private StdHumanProperties properties;
    private OperatorAuthorizationService service;

    @BeforeEach
    void setUp() {
        credentialStore = mock(CredentialStorePort.class);
        when(credentialStore.getOperatorChatId()).thenReturn(Optional.empty());
        startCodeService = mock(StartCodeService.class);
        when(startCodeService.matches(CODE)).thenReturn(true);
        properties = new StdHumanProperties();
        properties.getTelegram().setOperatorUsername("@Operator");
        properties.setBaseUrl("http://localhost:18081");

        service = new OperatorAuthorizationService(credentialStore, startCodeService, new MessageService(),
                properties);
    }

    // ===== /start =====

    @Test
    void shouldPairOperatorWithValidCode() {
        PairingResult result = service.handleStart(CHAT_ID, "operator", "/start " + CODE);

        assertTrue(result.paired());
        assertTrue(result.reply().startsWith("StdHuman Agent is a local helper"));
        assertTrue(result.reply().contains("Base URL: http://localhost:18081"));
        verify(credentialStore).rememberOperatorChatId(CHAT_ID);
    }

    @Test
    void shouldRequireCode() {
        PairingResult result = service.handleStart(CHAT_ID, "operator", "/start");

        assertFalse(result.paired());
        assertEquals("Authorization code required. Send /start <code>.", result.reply());
        verify(credentialStore, never()).rememberOperatorChatId(anyLong());
    }

    @Test
    void shouldRejectWrongCode() {
        PairingResult result = service.handleStart(CHAT_ID, "operator", "/start wrong");

        assertFalse(result.paired());
        assertEquals("Authorization failed. Contact the operator.", result.reply());
    }

    @Test
    void shouldRejectOtherUsername() {
        PairingResult result = service.handleStart(CHAT_ID, "intruder", "/start " + CODE);

        assertFalse(result.paired());
        assertEquals("Authorization requires a Telegram username.", result.reply());
    }

    @Test
    void shouldRejectPairingFromAnotherChat() {
        when(credentialStore.getOperatorChatId()).thenReturn(Optional.of(999L));

        PairingResult result = service.handleStart(CHAT_ID, "operator", "/start " + CODE);

        assertFalse(result.paired());
        assertEquals("Authorization mismatch. Contact the operator.", result.reply());
        verify(credentialStore, never()).rememberOperatorChatId(anyLong());
    }

    @Test
    void shouldAllowRepairingSameChat() {
        when(credentialStore.getOperatorChatId()).thenReturn(Optional.of(CHAT_ID));

        assertTrue(service.handleStart(CHAT_ID, "@OPERATOR", "/start   " + CODE + "  ").paired());
    }

    // ===== isAuthorized =====

    @Test
    void shouldAuthorizePairedOperator() {
        when(credentialStore.getOperatorChatId()).thenReturn(Optional.of(CHAT_ID));

        assertTrue(service.isAuthorized(CHAT_ID, "operator"));
        assertTrue(service.isAuthorized(CHAT_ID, "@OpErAtOr"));
    }

    @Test
    void shouldDenyWhenNothingIsPaired() {
        assertFalse(service.isAuthorized(CHAT_ID, "operator"));
    }

    @Test
    void shouldDenyWrongChatOrUsername() {
        when(credentialStore.getOperatorChatId()).thenReturn(Optional.of(CHAT_ID));

        assertFalse(service.isAuthorized(2002L, "operator"));
        assertFalse(service.isAuthorized(CHAT_ID, "someone"));
        assertFalse(service.isAuthorized(CHAT_ID, null));
    }

    @Test
    void shouldDenyEveryoneWhenOperatorNotConfigured() {
        properties.getTelegram().setOperatorUsername("");
        when(credentialStore.getOperatorChatId()).thenReturn(Optional.of(CHAT_ID));

        assertFalse(service.isAuthorized(CHAT_ID, "operator"));
        assertFalse(service.isAuthorized(CHAT_ID, ""));
    }

    @Test
    void shouldExtractStartCode() {
        assertEquals(Optional.of("abc"), OperatorAuthorizationService.extractStartCode("/start abc"));
        assertEquals(Optional.of("abc def"), OperatorAuthorizationService.extractStartCode("/start abc def"));
        assertTrue(OperatorAuthorizationService.extractStartCode("/start").isEmpty());
    }
}
