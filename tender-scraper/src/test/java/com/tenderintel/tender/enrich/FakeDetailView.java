package com.tenderintel.tender.enrich;

import com.tenderintel.tender.model.AttachedDocument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Scripted detail page. */
class FakeDetailView implements DetailView {

    final Map<String, List<String>> values = new HashMap<>();
    List<AttachedDocument> documents = new ArrayList<>();
    String scriptUrl;
    String navigationUrl;
    boolean redirect;
    boolean loaded = true;
    boolean closed;
    RuntimeException navigationFailure;

    FakeDetailView label(String label, String... candidates) {
        values.put(label, List.of(candidates));
        return this;
    }

    @Override
    public boolean isAuthenticationRedirect() {
        return redirect;
    }

    @Override
    public boolean looksLoaded() {
        return loaded;
    }

    @Override
    public LabelResolver labels() {
        return label -> values.getOrDefault(label, List.of());
    }

    @Override
    public List<AttachedDocument> attachedDocuments() {
        return documents;
    }

    @Override
    public Optional<String> primaryDocumentFromScript() {
        return Optional.ofNullable(scriptUrl);
    }

    @Override
    public Optional<String> primaryDocumentFromNavigation() {
        if (navigationFailure != null) {
            throw navigationFailure;
        }
        return Optional.ofNullable(navigationUrl);
    }

    @Override
    public void close() {
        closed = true;
    }
}
