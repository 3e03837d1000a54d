package com.tenderintel.tender.otp;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.RunMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands an OTP arriving asynchronously on the webhook to the login flow waiting for it.
 *
 * A single cell (latest ticket + pending-request instant) guarded by one lock, with one
 * condition signalled per accepted ticket. The login flow calls
 * {@link #registerPendingRequest()} right before asking the portal for a code, then
 * {@link #awaitTicket(Duration, RunMode)}; only tickets that arrived after registration
 * qualify, however long ago the same code value was last seen.
 */
@Component
@Slf4j
public class OtpCoordinator {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition ticketArrived = lock.newCondition();

    private final Clock clock;
    private final TenderScraperProperties properties;
    private final RemoteOtpClient remoteClient;
    private final ManualOtpPrompt manualPrompt;

    private OtpTicket latest;
    private Instant pendingSince = Instant.EPOCH;

    public OtpCoordinator(Clock clock, TenderScraperProperties properties,
                          RemoteOtpClient remoteClient, ManualOtpPrompt manualPrompt) {
        this.clock = clock;
        this.properties = properties;
        this.remoteClient = remoteClient;
        this.manualPrompt = manualPrompt;
    }

    /**
     * Call BEFORE triggering "Get OTP" on the portal. From now on only tickets arriving
     * strictly after the returned instant satisfy {@link #awaitTicket}.
     */
    public Instant registerPendingRequest() {
        lock.lock();
        try {
            pendingSince = clock.instant();
            log.info("Cleared OTP state, accepting codes arriving after {}", pendingSince);
            return pendingSince;
        } finally {
            lock.unlock();
        }
    }

    /** Webhook entry point: stamp the code with the arrival time and publish it. */
    public OtpTicket deliver(String code) {
        OtpTicket ticket = new OtpTicket(code, clock.instant());
        accept(ticket);
        return ticket;
    }

    public void accept(OtpTicket ticket) {
        lock.lock();
        try {
            latest = ticket;
            ticketArrived.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Latest ticket if it is still inside the freshness window, for the /get-otp endpoint. */
    public Optional<OtpTicket> latestFresh() {
        lock.lock();
        try {
            if (latest == null) return Optional.empty();
            Duration age = Duration.between(latest.receivedAt(), clock.instant());
            return age.compareTo(properties.getOtp().getFreshnessWindow()) < 0
                    ? Optional.of(latest)
                    : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until a ticket newer than the last registration arrives or {@code timeout} elapses.
     * Falls back to console entry only in {@link RunMode#INTERACTIVE}.
     */
    public Optional<String> awaitTicket(Duration timeout, RunMode mode) {
        log.info("Waiting for OTP (timeout={}s)...", timeout.toSeconds());

        Optional<String> otp = properties.getOtp().isUseExistingListener()
                ? pollExistingListener(timeout)
                : awaitLocal(timeout);
        if (otp.isPresent()) {
            return otp;
        }

        if (mode != RunMode.INTERACTIVE) {
            log.warn("OTP not received after {}s, skipping manual input (unattended run). "
                    + "Ensure the tunnel and SMS forwarder are running.", timeout.toSeconds());
            return Optional.empty();
        }

        log.warn("OTP not received after {}s, falling back to manual input", timeout.toSeconds());
        Optional<String> manual = manualPrompt.prompt();
        manual.ifPresent(this::deliver);
        return manual;
    }

    private Optional<String> awaitLocal(Duration timeout) {
        lock.lock();
        try {
            long remaining = timeout.toNanos();
            // The code may land between "Get OTP" and this call, so check before sleeping
            while (!qualifies(latest)) {
                if (remaining <= 0L) {
                    return Optional.empty();
                }
                remaining = ticketArrived.awaitNanos(remaining);
            }
            log.info("OTP received via webhook ({}s after request)",
                    Duration.between(pendingSince, latest.receivedAt()).toSeconds());
            return Optional.of(latest.code());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for OTP");
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    private Optional<String> pollExistingListener(Duration timeout) {
        Optional<String> already = currentQualifying();
        if (already.isPresent()) {
            return already;
        }

        log.info("Polling existing listener on port {} for OTP...", properties.getOtp().getExistingListenerPort());
        long deadline = System.nanoTime() + timeout.toNanos();
        long interval = properties.getOtp().getPollInterval().toMillis();

        while (System.nanoTime() < deadline) {
            Optional<OtpTicket> remote = remoteClient.fetchLatest();
            if (remote.isPresent() && isNewerThanPending(remote.get())) {
                accept(remote.get());
                log.info("OTP received from existing listener");
                return Optional.of(remote.get().code());
            }
            long left = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (!sleepMs(Math.min(interval, Math.max(left, 0L)))) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private Optional<String> currentQualifying() {
        lock.lock();
        try {
            return qualifies(latest) ? Optional.of(latest.code()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    private boolean isNewerThanPending(OtpTicket ticket) {
        lock.lock();
        try {
            return qualifies(ticket);
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private boolean qualifies(OtpTicket ticket) {
        return ticket != null && ticket.arrivedAfter(pendingSince);
    }

    private boolean sleepMs(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
