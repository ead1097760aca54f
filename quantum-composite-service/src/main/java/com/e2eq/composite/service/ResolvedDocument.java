package com.e2eq.composite.service;

import com.e2eq.composite.core.Document;
import com.e2eq.composite.core.Expansion;

public record ResolvedDocument(Document document, Expansion expansion) {

    public String text() {
        return expansion.text();
    }
}
