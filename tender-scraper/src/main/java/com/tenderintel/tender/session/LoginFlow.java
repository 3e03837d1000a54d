package com.tenderintel.tender.session;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.RunMode;
import com.tenderintel.tender.otp.OtpCoordinator;
import com.tenderintel.tender.util.BoundedRetry;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Full portal login as an explicit state machine.
 *
 * <pre>
 * NAV_LOGIN → FILL_CREDENTIAL → SOLVE_CHALLENGE → REQUEST_OTP → AWAIT_OTP → SUBMIT_OTP → VERIFY
 *                                                                                 ↓
 *                                                                  SUCCESS | RETRY | FAILED
 * </pre>
 *
 * Every attempt may make the portal generate a new OTP, and the portal only allows two
 * generations per hour, so attempts are hard-capped per run and never retried past the cap.
 * A cached code rejected at VERIFY gets one recovery path inside the same attempt: the
 * code generated by this attempt's "Get OTP" click is awaited and submitted on the same form.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LoginFlow {

    private final OtpCoordinator coordinator;
    private final OtpCache otpCache;
    private final SessionStore sessionStore;
    private final ChallengeSolver challengeSolver;
    private final TenderScraperProperties properties;

    public LoginOutcome login(LoginPortal portal, RunMode mode) {
        int maxAttempts = properties.getLogin().getMaxAttempts();
        log.info("=== Starting portal login flow (max {} attempts) ===", maxAttempts);

        LoginRun run = new LoginRun(otpCache.load().orElse(null));
        LoginState state = LoginState.NAV_LOGIN;

        while (!state.isTerminal()) {
            LoginState next;
            try {
                next = step(state, run, portal, mode);
            } catch (RuntimeException e) {
                log.warn("Login attempt {} failed in {}: {}", run.attempt, state, e.getMessage());
                run.failure = e.getMessage();
                next = LoginState.RETRY;
            }

            if (next == LoginState.RETRY) {
                if (run.attempt >= maxAttempts) {
                    log.error("LOGIN FAILED after {} attempts: {}", run.attempt, run.failure);
                    log.error("Will NOT retry, stopping to avoid burning OTP generations");
                    next = LoginState.FAILED;
                } else {
                    log.warn("Login attempt {} failed: {}, will retry", run.attempt, run.failure);
                    next = LoginState.NAV_LOGIN;
                }
            }
            state = next;
        }

        if (state == LoginState.FAILED) {
            return LoginOutcome.failed(run.attempt, run.failure);
        }

        complete(portal, run);
        return LoginOutcome.succeeded(run.attempt);
    }

    private LoginState step(LoginState state, LoginRun run, LoginPortal portal, RunMode mode) {
        return switch (state) {
            case NAV_LOGIN -> openLogin(run, portal);
            case FILL_CREDENTIAL -> fillCredential(portal);
            case SOLVE_CHALLENGE -> solveChallenge(run, portal);
            case REQUEST_OTP -> requestOtp(run, portal);
            case AWAIT_OTP -> awaitOtp(run, mode);
            case SUBMIT_OTP -> {
                log.info("Step 6: Filling OTP and clicking Proceed...");
                portal.submitOtp(run.otp);
                yield LoginState.VERIFY;
            }
            case VERIFY -> verify(run, portal, mode);
            default -> throw new IllegalStateException("No step for state " + state);
        };
    }

    private LoginState openLogin(LoginRun run, LoginPortal portal) {
        run.startAttempt();
        log.info("-- Login attempt {}/{} --", run.attempt, properties.getLogin().getMaxAttempts());
        log.info("Step 1: Navigating to login page...");
        portal.openLoginPage();
        return LoginState.FILL_CREDENTIAL;
    }

    private LoginState fillCredential(LoginPortal portal) {
        String mobile = properties.getPortal().getMobile();
        log.info("Step 2: Filling mobile number {}", mask(mobile));
        portal.fillCredential(mobile);
        return LoginState.SOLVE_CHALLENGE;
    }

    private LoginState solveChallenge(LoginRun run, LoginPortal portal) {
        TenderScraperProperties.Captcha captcha = properties.getCaptcha();
        log.info("Step 3: Solving verification code...");

        Retry retry = BoundedRetry.of("challenge", captcha.getMaxAttempts(), captcha.getRetryDelay());
        AtomicInteger tries = new AtomicInteger();
        String answer;
        try {
            answer = retry.executeSupplier(() -> {
                // a fresh image on every retry, and on every attempt after the first
                boolean refresh = run.attempt > 1 || tries.getAndIncrement() > 0;
                return challengeSolver.solve(portal.captureChallenge(refresh));
            });
        } catch (RuntimeException e) {
            throw new ChallengeSolvingException(
                    "Verification code solving failed after " + captcha.getMaxAttempts() + " attempts: "
                            + e.getMessage(), e);
        }

        portal.fillChallengeAnswer(answer);
        return LoginState.REQUEST_OTP;
    }

    private LoginState requestOtp(LoginRun run, LoginPortal portal) {
        // Register before clicking so a code that lands during the page wait still counts
        coordinator.registerPendingRequest();

        log.info("Step 4: Clicking 'Get OTP'...");
        boolean accepted = portal.requestOtp();
        run.generations++;
        log.info("OTP generation #{} triggered (portal allows 2 per hour)", run.generations);

        if (!accepted) {
            run.failure = "verification code rejected on attempt " + run.attempt;
            return LoginState.RETRY;
        }
        return LoginState.AWAIT_OTP;
    }

    private LoginState awaitOtp(LoginRun run, RunMode mode) {
        if (run.cachedOtp != null) {
            log.info("Step 5: Using cached OTP");
            run.otp = run.cachedOtp;
            run.usedCache = true;
            return LoginState.SUBMIT_OTP;
        }

        Duration timeout = properties.getOtp().getWaitTimeout();
        log.info("Step 5: Waiting for OTP via SMS forwarder webhook...");
        Optional<String> otp = coordinator.awaitTicket(timeout, mode);
        if (otp.isEmpty()) {
            run.failure = "OTP not received within " + timeout.toSeconds()
                    + "s; check the tunnel, the SMS forwarder URL and phone connectivity";
            log.error("LOGIN FAILED: {}", run.failure);
            return LoginState.FAILED;
        }

        // cache straight away so the next run can use it even if this login fails later
        run.otp = otp.get();
        otpCache.save(run.otp);
        return LoginState.SUBMIT_OTP;
    }

    private LoginState verify(LoginRun run, LoginPortal portal, RunMode mode) {
        if (portal.isAuthenticated()) {
            return LoginState.SUCCESS;
        }

        if (!run.usedCache) {
            run.failure = "OTP " + run.otp + " rejected by portal";
            return LoginState.RETRY;
        }

        log.warn("Cached OTP rejected, clearing cache");
        otpCache.invalidate();
        run.cachedOtp = null;
        run.usedCache = false;

        // "Get OTP" in this attempt already sent a new code to the phone
        log.info("Trying fresh OTP generated by this attempt...");
        Optional<String> fresh = coordinator.awaitTicket(properties.getOtp().getFreshCodeTimeout(), mode);
        if (fresh.isEmpty()) {
            run.failure = "cached OTP rejected and no fresh OTP received";
            return LoginState.RETRY;
        }

        otpCache.save(fresh.get());
        if (fresh.get().equals(run.otp)) {
            run.failure = "OTP " + fresh.get() + " rejected by portal; it may be older than 24h";
            return LoginState.RETRY;
        }

        log.info("Got fresh OTP, retrying on the same page");
        run.otp = fresh.get();
        return LoginState.SUBMIT_OTP;
    }

    private void complete(LoginPortal portal, LoginRun run) {
        log.info("Login successful, saving session state...");
        try {
            portal.saveSession(sessionStore.prepare());
            log.info("Session saved to {}", sessionStore.path());
        } catch (RuntimeException e) {
            log.warn("Logged in but could not persist session: {}", e.getMessage());
        }
        otpCache.save(run.otp);
        log.info("=== Portal login completed successfully ===");
    }

    private String mask(String mobile) {
        if (mobile == null || mobile.length() < 5) return "****";
        return mobile.substring(0, 3) + "****" + mobile.substring(mobile.length() - 2);
    }

    /** Mutable bookkeeping for one call to {@link #login}. */
    private static final class LoginRun {

        private String cachedOtp;
        private int attempt;
        private int generations;
        private String otp;
        private boolean usedCache;
        private String failure;

        private LoginRun(String cachedOtp) {
            this.cachedOtp = cachedOtp;
        }

        private void startAttempt() {
            attempt++;
            otp = null;
            usedCache = false;
        }
    }
}
