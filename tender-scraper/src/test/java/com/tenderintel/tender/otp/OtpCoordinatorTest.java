package com.tenderintel.tender.otp;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.RunMode;
import com.tenderintel.tender.testutil.MutableClock;
import com.tenderintel.tender.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OtpCoordinatorTest {

    @Mock
    private RemoteOtpClient remoteClient;

    @Mock
    private ManualOtpPrompt manualPrompt;

    private MutableClock clock;
    private TenderScraperProperties properties;
    private OtpCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T06:00:00Z"));
        properties = TestDataFactory.fastProperties();
        coordinator = new OtpCoordinator(clock, properties, remoteClient, manualPrompt);
    }

    @Test
    void awaitTicket_ticketDeliveredBeforeRegistration_isNotAccepted() {
        coordinator.deliver("111111");
        clock.advance(Duration.ofSeconds(1));
        coordinator.registerPendingRequest();

        Optional<String> otp = coordinator.awaitTicket(Duration.ofMillis(20), RunMode.UNATTENDED);

        assertThat(otp).isEmpty();
    }

    @Test
    void awaitTicket_ticketArrivedBetweenRequestAndWait_returnedImmediately() {
        coordinator.registerPendingRequest();
        clock.advance(Duration.ofSeconds(2));
        coordinator.deliver("482913");

        assertThat(coordinator.awaitTicket(Duration.ofMillis(20), RunMode.UNATTENDED)).contains("482913");
    }

    @Test
    void awaitTicket_sameCodeValueDeliveredAgain_acceptedByArrivalTime() {
        coordinator.deliver("482913");
        clock.advance(Duration.ofSeconds(1));
        coordinator.registerPendingRequest();
        clock.advance(Duration.ofSeconds(1));
        coordinator.deliver("482913");

        assertThat(coordinator.awaitTicket(Duration.ofMillis(20), RunMode.UNATTENDED)).contains("482913");
    }

    @Test
    void awaitTicket_deliveredFromAnotherThread_wakesWaiter() throws Exception {
        coordinator.registerPendingRequest();
        clock.advance(Duration.ofSeconds(1));

        CompletableFuture<Optional<String>> waiting = CompletableFuture.supplyAsync(
                () -> coordinator.awaitTicket(Duration.ofSeconds(5), RunMode.UNATTENDED));
        Thread.sleep(50);
        coordinator.deliver("735102");

        assertThat(waiting.get(5, TimeUnit.SECONDS)).contains("735102");
    }

    @Test
    void awaitTicket_timeoutUnattended_neverPrompts() {
        coordinator.registerPendingRequest();

        assertThat(coordinator.awaitTicket(Duration.ofMillis(20), RunMode.UNATTENDED)).isEmpty();
        verify(manualPrompt, never()).prompt();
    }

    @Test
    void awaitTicket_timeoutInteractive_usesManualEntry() {
        when(manualPrompt.prompt()).thenReturn(Optional.of("909090"));
        coordinator.registerPendingRequest();
        clock.advance(Duration.ofSeconds(1));

        assertThat(coordinator.awaitTicket(Duration.ofMillis(20), RunMode.INTERACTIVE)).contains("909090");
        assertThat(coordinator.latestFresh()).map(OtpTicket::code).contains("909090");
    }

    @Test
    void awaitTicket_existingListener_pollsRemoteForNewerTicket() {
        properties.getOtp().setUseExistingListener(true);
        coordinator.registerPendingRequest();
        OtpTicket stale = new OtpTicket("111111", clock.instant().minusSeconds(30));
        OtpTicket fresh = new OtpTicket("222222", clock.instant().plusSeconds(3));
        when(remoteClient.fetchLatest()).thenReturn(Optional.of(stale), Optional.of(fresh));

        Optional<String> otp = coordinator.awaitTicket(Duration.ofSeconds(2), RunMode.UNATTENDED);

        assertThat(otp).contains("222222");
    }

    @Test
    void awaitTicket_localListener_neverPollsRemote() {
        coordinator.registerPendingRequest();

        coordinator.awaitTicket(Duration.ofMillis(10), RunMode.UNATTENDED);

        verify(remoteClient, never()).fetchLatest();
    }

    @Test
    void latestFresh_outsideFreshnessWindow_empty() {
        coordinator.deliver("482913");
        assertThat(coordinator.latestFresh()).isPresent();

        clock.advance(properties.getOtp().getFreshnessWindow().plusSeconds(1));

        assertThat(coordinator.latestFresh()).isEmpty();
    }

    @Test
    void deliver_stampsArrivalWithClock() {
        OtpTicket ticket = coordinator.deliver("482913");

        assertThat(ticket.receivedAt()).isEqualTo(Instant.parse("2026-03-01T06:00:00Z"));
        verify(manualPrompt, never()).prompt();
        verify(remoteClient, never()).fetchLatest();
        assertThat(ticket.arrivedAfter(ticket.receivedAt())).isFalse();
    }
}
