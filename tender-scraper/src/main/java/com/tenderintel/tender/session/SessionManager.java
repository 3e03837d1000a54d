package com.tenderintel.tender.session;

import com.tenderintel.tender.model.RunMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides between re-using the persisted session and a full login.
 *
 * A session older than the max age is treated as expired without touching the portal;
 * a fresh one is verified with one page load before being trusted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionManager {

    private final SessionStore sessionStore;
    private final LoginFlow loginFlow;

    public SessionOutcome ensureValidSession(LoginPortal portal, RunMode mode) {
        if (sessionStore.isFresh()) {
            if (verify(portal)) {
                log.info("Session verification passed, user is logged in");
                return SessionOutcome.reused();
            }
            log.info("Saved session is stale, proceeding with fresh login");
        }

        LoginOutcome login = loginFlow.login(portal, mode);
        if (!login.isSuccess()) {
            return SessionOutcome.failed("login failed after " + login.getAttempts()
                    + " attempt(s): " + login.getReason());
        }
        return SessionOutcome.renewed();
    }

    private boolean verify(LoginPortal portal) {
        try {
            return portal.verifySession();
        } catch (RuntimeException e) {
            log.warn("Session verification error: {}", e.getMessage());
            return false;
        }
    }
}
