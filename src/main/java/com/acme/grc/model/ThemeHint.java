package com.acme.grc.model;

import java.util.List;

public record ThemeHint(String theme, List<String> keywords) {
    public ThemeHint {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
