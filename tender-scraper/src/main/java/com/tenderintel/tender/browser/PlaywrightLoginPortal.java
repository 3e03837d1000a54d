package com.tenderintel.tender.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Frame;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.AriaRole;
import com.microsoft.playwright.options.BoundingBox;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.session.LoginPortal;
import com.tenderintel.tender.session.PortalException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * The portal's "Authenticate Yourself" form. It sometimes lives inside an iframe, so every
 * lookup goes through {@link #root}, resolved when the login page is opened.
 */
@Slf4j
class PlaywrightLoginPortal implements LoginPortal {

    private static final String MOBILE_PLACEHOLDER = "Enter Mobile No.";
    private static final String CHALLENGE_PLACEHOLDER = "Enter Verification Code";
    private static final String OTP_PLACEHOLDER = "Enter OTP";
    private static final String CHALLENGE_LABEL = "Verification Code";
    private static final String GET_OTP = "Get OTP";
    private static final String PROCEED = "Proceed";

    private final Page page;
    private final BrowserContext context;
    private final TenderScraperProperties properties;
    private Frame root;

    PlaywrightLoginPortal(Page page, BrowserContext context, TenderScraperProperties properties) {
        this.page = page;
        this.context = context;
        this.properties = properties;
        this.root = page.mainFrame();
    }

    @Override
    public boolean verifySession() {
        return step("verify session", () -> {
            PageSupport.navigate(page, properties.getPortal().getSearchUrl(), navigationTimeout());
            PageSupport.settle(page, properties.getBrowser().getSettleDelay());
            if (PageSupport.showsLoginForm(page)) {
                log.info("Session verification failed, redirected to login page");
                return false;
            }
            return true;
        });
    }

    @Override
    public void openLoginPage() {
        step("open login page", () -> {
            PageSupport.navigate(page, properties.getPortal().getLoginUrl(), navigationTimeout());
            PageSupport.settle(page, properties.getBrowser().getSettleDelay());
            root = locateFormRoot();
            return null;
        });
    }

    @Override
    public void fillCredential(String mobile) {
        step("fill mobile number", () -> {
            Locator input = root.getByPlaceholder(MOBILE_PLACEHOLDER);
            input.waitFor(new Locator.WaitForOptions().setTimeout(navigationTimeout().toMillis()));
            input.fill(mobile);
            return null;
        });
    }

    @Override
    public byte[] captureChallenge(boolean refresh) {
        return step("capture verification code", () -> {
            if (refresh) {
                refreshChallenge();
            }
            Locator image = root.getByText(CHALLENGE_LABEL).locator("..").locator("img").first();
            try {
                image.waitFor(new Locator.WaitForOptions().setTimeout(5000));
            } catch (PlaywrightException e) {
                log.debug("Verification image not next to its label, scanning images by size");
                image = imageBySize();
            }
            return image.screenshot();
        });
    }

    @Override
    public void fillChallengeAnswer(String answer) {
        step("fill verification code", () -> {
            root.getByPlaceholder(CHALLENGE_PLACEHOLDER).fill(answer);
            log.info("Verification code filled: '{}'", answer);
            return null;
        });
    }

    @Override
    public boolean requestOtp() {
        return step("request OTP", () -> {
            root.getByRole(AriaRole.BUTTON, new Frame.GetByRoleOptions().setName(GET_OTP)).click();
            PageSupport.settle(page, properties.getBrowser().getSettleDelay());
            Locator error = root.getByText("incorrect")
                    .or(root.getByText("invalid"))
                    .or(root.getByText("wrong"));
            if (error.count() > 0) {
                log.warn("Verification code rejected by portal");
                return false;
            }
            return true;
        });
    }

    @Override
    public void submitOtp(String otp) {
        step("submit OTP", () -> {
            root.getByPlaceholder(OTP_PLACEHOLDER).fill(otp);
            root.getByRole(AriaRole.BUTTON, new Frame.GetByRoleOptions().setName(PROCEED)).click();
            page.waitForTimeout(5000);
            return null;
        });
    }

    @Override
    public boolean isAuthenticated() {
        return step("verify login", () -> {
            boolean authenticated = root.getByText(PageSupport.AUTH_MARKER).count() == 0;
            if (authenticated) {
                log.info("Login successful, current URL: {}", page.url());
            }
            return authenticated;
        });
    }

    @Override
    public void saveSession(Path file) {
        step("save session", () -> {
            context.storageState(new BrowserContext.StorageStateOptions().setPath(file));
            return null;
        });
    }

    private Frame locateFormRoot() {
        for (Frame frame : page.frames()) {
            if (frame == page.mainFrame()) continue;
            try {
                if (frame.getByPlaceholder(MOBILE_PLACEHOLDER).count() > 0) {
                    log.info("Login form found inside iframe: {}", frame.url());
                    return frame;
                }
            } catch (PlaywrightException e) {
                log.debug("Skipping frame {}: {}", frame.url(), e.getMessage());
            }
        }
        log.info("Login form found on main page (no iframe)");
        return page.mainFrame();
    }

    private void refreshChallenge() {
        try {
            Locator refresh = root.getByText(CHALLENGE_LABEL).locator("..")
                    .locator("img[alt*='refresh'], img[alt*='reload'], a:has(img)").last();
            if (refresh.count() > 0) {
                refresh.click();
                page.waitForTimeout(2000);
                log.info("Verification image refreshed");
            }
        } catch (PlaywrightException e) {
            log.debug("Could not find refresh control: {}", e.getMessage());
        }
    }

    private Locator imageBySize() {
        Locator images = page.locator("img");
        int count = images.count();
        for (int i = 0; i < count; i++) {
            Locator image = images.nth(i);
            BoundingBox box = image.boundingBox();
            if (box != null && box.width > 50 && box.width < 300 && box.height > 20 && box.height < 100) {
                return image;
            }
        }
        throw new PortalException("Could not locate verification image on page");
    }

    private Duration navigationTimeout() {
        return properties.getBrowser().getNavigationTimeout();
    }

    private <T> T step(String name, Supplier<T> action) {
        try {
            return action.get();
        } catch (PlaywrightException e) {
            throw new PortalException(name + " failed: " + e.getMessage(), e);
        }
    }
}
