package me.golemcore.stdhuman.domain.service;

import me.golemcore.stdhuman.domain.model.DecisionException;
import me.golemcore.stdhuman.domain.model.DecisionFailure;
import me.golemcore.stdhuman.domain.model.MissionLogLevel;
import me.golemcore.stdhuman.port.outbound.CredentialStorePort;
import me.golemcore.stdhuman.port.outbound.DeliveryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MissionServiceTest {

    private DeliveryPort deliveryPort;
    private CredentialStorePort credentialStore;
    private MissionRegistry registry;
    private MissionService service;

    @BeforeEach
    void setUp() {
        deliveryPort = mock(DeliveryPort.class);
        when(deliveryPort.deliver(anyString(), anyString())).thenReturn(true);
        credentialStore = mock(CredentialStorePort.class);
        when(credentialStore.getOperatorChatId()).thenReturn(Optional.of(77L));
        registry = new MissionRegistry(Clock.systemUTC());
        service = new MissionService(registry, new OperatorDirectory(credentialStore), deliveryPort);
    }

    // ===== definePlan =====

    @Test
    void shouldAnnouncePlan() {
        String missionId = service.definePlan("Demo", List.of("Build", "Test"));

        assertEquals(missionId, registry.current().orElseThrow().getId());
        verify(deliveryPort).deliver("77", "Plan started: Demo (2 steps)\nSteps:\n1) Build\n2) Test");
    }

    @Test
    void shouldRejectPlanWithoutSteps() {
        assertThrows(IllegalArgumentException.class, () -> service.definePlan("Demo", List.of()));
        assertThrows(IllegalArgumentException.class, () -> service.definePlan(" ", List.of("a")));
        verifyNoInteractions(deliveryPort);
    }

    @Test
    void shouldFailPlanWithoutPairedOperator() {
        when(credentialStore.getOperatorChatId()).thenReturn(Optional.empty());

        DecisionException ex = assertThrows(DecisionException.class,
                () -> service.definePlan("Demo", List.of("Build")));

        assertEquals(DecisionFailure.DESTINATION_MISSING, ex.getFailure());
        assertTrue(registry.current().isPresent());
    }

    @Test
    void shouldFailPlanWhenDeliveryFails() {
        when(deliveryPort.deliver(anyString(), anyString())).thenReturn(false);

        DecisionException ex = assertThrows(DecisionException.class,
                () -> service.definePlan("Demo", List.of("Build")));

        assertEquals(DecisionFailure.DELIVERY_FAILED, ex.getFailure());
    }

    // ===== report =====

    @Test
    void shouldReportWithStepCompletion() {
        service.definePlan("Demo", List.of("Build", "Test"));

        service.report(MissionLogLevel.SUCCESS, "Build passed", 1);

        verify(deliveryPort).deliver("77", "Build passed\nStep 1/2 complete: Build");
        assertEquals(Optional.of("SUCCESS: Build passed\nStep 1/2 complete: Build"), registry.lastStatus());
    }

    @Test
    void shouldReportWithoutMission() {
        service.report(MissionLogLevel.INFO, "Hello", 3);

        verify(deliveryPort).deliver("77", "Hello");
    }

    @Test
    void shouldRecordLogEvenWhenOperatorMissing() {
        service.definePlan("Demo", List.of("Build"));
        when(credentialStore.getOperatorChatId()).thenReturn(Optional.empty());

        assertThrows(DecisionException.class, () -> service.report(MissionLogLevel.ERROR, "Broken", null));

        assertEquals(Optional.of("ERROR: Broken"), registry.lastStatus());
    }

    @Test
    void shouldRejectMissingLevelOrMessage() {
        assertThrows(IllegalArgumentException.class, () -> service.report(null, "x", null));
        assertThrows(IllegalArgumentException.class, () -> service.report(MissionLogLevel.INFO, "", null));
    }

    @Test
    void shouldMapLevelsToLogLevels() {
        assertEquals(Level.INFO, MissionService.toLogLevel(MissionLogLevel.INFO));
        assertEquals(Level.INFO, MissionService.toLogLevel(MissionLogLevel.SUCCESS));
        assertEquals(Level.WARN, MissionService.toLogLevel(MissionLogLevel.WARNING));
        assertEquals(Level.ERROR, MissionService.toLogLevel(MissionLogLevel.ERROR));
    }
}
