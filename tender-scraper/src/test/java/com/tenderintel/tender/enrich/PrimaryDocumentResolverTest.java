package com.tenderintel.tender.enrich;

import com.tenderintel.tender.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrimaryDocumentResolverTest {

    private final PrimaryDocumentResolver resolver = new PrimaryDocumentResolver(TestDataFactory.fastProperties());

    @Test
    void resolve_scriptLiteral_preferredAndMadeAbsolute() {
        FakeDetailView view = new FakeDetailView();
        view.scriptUrl = "/ireps/upload/pdfdocs/042026/NIT_17.pdf";
        view.navigationUrl = "https://www.ireps.gov.in/other.pdf";

        assertThat(resolver.resolve(view)).contains("https://www.ireps.gov.in/ireps/upload/pdfdocs/042026/NIT_17.pdf");
    }

    @Test
    void resolve_placeholderScriptValue_fallsBackToNavigation() {
        FakeDetailView view = new FakeDetailView();
        view.scriptUrl = "#";
        view.navigationUrl = "https://www.ireps.gov.in/ireps/upload/pdfdocs/NIT_17.pdf";

        assertThat(resolver.resolve(view)).contains("https://www.ireps.gov.in/ireps/upload/pdfdocs/NIT_17.pdf");
    }

    @Test
    void resolve_navigationFails_emptyNotFatal() {
        FakeDetailView view = new FakeDetailView();
        view.navigationFailure = new IllegalStateException("Timeout 5000ms exceeded");

        assertThat(resolver.resolve(view)).isEmpty();
    }

    @Test
    void resolve_aboutBlank_empty() {
        FakeDetailView view = new FakeDetailView();
        view.navigationUrl = "about:blank";

        assertThat(resolver.resolve(view)).isEmpty();
    }

    @Test
    void resolve_browserLost_propagates() {
        FakeDetailView view = new FakeDetailView();
        view.navigationFailure = new BrowserLostException("Target closed", null);

        assertThatThrownBy(() -> resolver.resolve(view)).isInstanceOf(BrowserLostException.class);
    }
}
