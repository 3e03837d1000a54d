package com.tenderintel.tender.enrich;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.util.LinkResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the primary tender document URL by trying each strategy in order:
 * the literal in the page's download script first, the intercepted navigation second.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PrimaryDocumentResolver {

    private static final List<Function<DetailView, Optional<String>>> STRATEGIES = List.of(
            DetailView::primaryDocumentFromScript,
            DetailView::primaryDocumentFromNavigation);

    private final TenderScraperProperties properties;

    public Optional<String> resolve(DetailView view) {
        for (Function<DetailView, Optional<String>> strategy : STRATEGIES) {
            try {
                Optional<String> url = strategy.apply(view).filter(PrimaryDocumentResolver::isUsable);
                if (url.isPresent()) {
                    return Optional.of(LinkResolver.absolute(url.get(), properties.getPortal().getBaseUrl()));
                }
            } catch (BrowserLostException e) {
                throw e;
            } catch (RuntimeException e) {
                log.debug("    Primary document strategy failed: {}", e.getMessage());
            }
        }
        log.debug("    Could not resolve tender doc download URL");
        return Optional.empty();
    }

    private static boolean isUsable(String url) {
        return !url.isBlank() && !url.equals("#") && !url.equals("about:blank");
    }
}
