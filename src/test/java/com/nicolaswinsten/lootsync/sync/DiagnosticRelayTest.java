package com.nicolaswinsten.lootsync.sync;

import com.nicolaswinsten.lootsync.MutableClock;
import com.nicolaswinsten.lootsync.TestSupport;
import com.nicolaswinsten.lootsync.error.ErrorKind;
import com.nicolaswinsten.lootsync.presence.PresenceRegistry;
import com.nicolaswinsten.lootsync.presence.SessionTerminator;
import com.nicolaswinsten.lootsync.sync.SyncMessages.AdminDiagnosticPing;
import com.nicolaswinsten.lootsync.sync.SyncMessages.AdminPingError;
import com.nicolaswinsten.lootsync.sync.SyncMessages.AdminPingResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DiagnosticRelayTest {

    private static final Instant T0 = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    EventFanout eventFanout;

    @Mock
    SessionTerminator sessionTerminator;

    @Captor
    ArgumentCaptor<Object> dataCaptor;

    MutableClock clock;
    PresenceRegistry presenceRegistry;
    DiagnosticRelay relay;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        presenceRegistry = new PresenceRegistry(sessionTerminator);
        relay = new DiagnosticRelay(presenceRegistry, eventFanout, clock, TestSupport.properties());
    }

    @Test
    void pingGoesToEverySessionOfTheDevice() {
        presenceRegistry.registerDevice("phone-1", "dev-1");
        presenceRegistry.registerDevice("phone-2", "dev-1");

        String pingId = relay.pingDevice("admin", "dev-1", "ping-1");

        assertThat(pingId).isEqualTo("ping-1");
        verify(eventFanout).sendToSession("phone-1", EventType.ADMIN_DIAGNOSTIC_PING, new AdminDiagnosticPing("ping-1", T0));
        verify(eventFanout).sendToSession("phone-2", EventType.ADMIN_DIAGNOSTIC_PING, new AdminDiagnosticPing("ping-1", T0));
        verifyNoMoreInteractions(eventFanout);
        assertThat(relay.pendingCount()).isEqualTo(1);
    }

    @Test
    void missingPingIdIsGenerated() {
        presenceRegistry.registerDevice("phone-1", "dev-1");

        String pingId = relay.pingDevice("admin", "dev-1", null);

        assertThat(pingId).isNotBlank();
    }

    @Test
    void offlineDeviceIsReportedToTheAdmin() {
        relay.pingDevice("admin", "dev-1", "ping-1");

        verify(eventFanout).sendToSession(eq("admin"), eq(EventType.ADMIN_PING_ERROR), dataCaptor.capture());
        AdminPingError error = (AdminPingError) dataCaptor.getValue();
        assertThat(error.pingId()).isEqualTo("ping-1");
        assertThat(error.deviceUuid()).isEqualTo("dev-1");
        assertThat(error.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(relay.pendingCount()).isZero();
    }

    @Test
    void missingDeviceIsAValidationError() {
        relay.pingDevice("admin", " ", "ping-1");

        verify(eventFanout).sendToSession(eq("admin"), eq(EventType.ADMIN_PING_ERROR), dataCaptor.capture());
        assertThat(((AdminPingError) dataCaptor.getValue()).errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    void deviceAnswerIsRelayedOnceToTheAskingAdmin() {
        presenceRegistry.registerDevice("phone-1", "dev-1");
        relay.pingDevice("admin", "dev-1", "ping-1");
        clock.advance(Duration.ofMillis(250));

        assertThat(relay.onClientPong("phone-1", "ping-1", "client-ts")).isTrue();
        assertThat(relay.onClientPong("phone-1", "ping-1", "client-ts")).isFalse();

        verify(eventFanout).sendToSession("admin", EventType.ADMIN_PING_RESPONSE,
            new AdminPingResponse("ping-1", "dev-1", "client-ts", T0.plusMillis(250)));
    }

    @Test
    void unknownPongIsIgnored() {
        assertThat(relay.onClientPong("phone-1", "nope", null)).isFalse();
        assertThat(relay.onClientPong("phone-1", null, null)).isFalse();
        verifyNoInteractions(eventFanout);
    }

    @Test
    void expiredPingsAreForgotten() {
        presenceRegistry.registerDevice("phone-1", "dev-1");
        relay.pingDevice("admin", "dev-1", "old");
        clock.advance(Duration.ofSeconds(61));

        relay.pingDevice("admin", "dev-1", "new");

        assertThat(relay.pendingCount()).isEqualTo(1);
        assertThat(relay.onClientPong("phone-1", "old", "ts")).isFalse();
    }

    @Test
    void adminDisconnectDropsItsPendingPings() {
        presenceRegistry.registerDevice("phone-1", "dev-1");
        relay.pingDevice("admin", "dev-1", "ping-1");

        relay.forgetAdmin("admin");

        assertThat(relay.pendingCount()).isZero();
    }
}
