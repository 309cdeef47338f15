package com.paperharvest.backend.model.enums;

import java.net.URI;
import java.util.List;
import lombok.Getter;

@Getter
public enum SiteKind {
    SEARCH_LISTING(List.of("nature.com")),
    PROCEEDINGS_LISTING(List.of("papers.nips.cc", "proceedings.neurips.cc", "proceedings.mlr.press", "aclanthology.org"));

    private final List<String> knownHosts;

    SiteKind(List<String> knownHosts) {
        this.knownHosts = knownHosts;
    }

    /**
     * Infer the listing layout from a start URL's host
     */
    public static SiteKind fromUrl(String url) {
        if (url == null) return null;
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (host == null) return null;
        for (SiteKind kind : values()) {
            if (kind.matchesHost(host)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Find SiteKind by name (case-insensitive, ignores separators)
     */
    public static SiteKind fromName(String name) {
        if (name == null) return null;
        String normalized = name.replaceAll("[^A-Za-z]", "").toUpperCase();
        for (SiteKind kind : values()) {
            if (kind.name().replace("_", "").equals(normalized)) {
                return kind;
            }
        }
        return null;
    }

    public boolean matchesHost(String host) {
        String h = host.toLowerCase();
        return knownHosts.stream().anyMatch(k -> h.equals(k) || h.endsWith("." + k));
    }
}
