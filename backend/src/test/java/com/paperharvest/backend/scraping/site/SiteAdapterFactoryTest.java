package com.paperharvest.backend.scraping.site;

import com.paperharvest.backend.model.enums.SiteKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SiteAdapterFactoryTest {

    private final SiteAdapterFactory factory = new SiteAdapterFactory();

    @Test
    @DisplayName("Should infer the adapter from a known host")
    void shouldInferFromHost() {
        assertThat(factory.createAdapter(null, "https://www.nature.com/search?q=llm"))
                .isInstanceOf(SearchListingAdapter.class);
        assertThat(factory.createAdapter(null, "https://proceedings.mlr.press/v202/"))
                .isInstanceOf(ProceedingsListingAdapter.class);
    }

    @Test
    @DisplayName("Should prefer the declared kind")
    void shouldUseDeclaredKind() {
        assertThat(factory.createAdapter(SiteKind.PROCEEDINGS_LISTING, "https://example.org/volume/1"))
                .isInstanceOf(ProceedingsListingAdapter.class);
    }

    @Test
    @DisplayName("Should reject unknown hosts without a declared kind")
    void shouldRejectUnknownHost() {
        assertThatThrownBy(() -> factory.createAdapter(null, "https://example.org/list"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No site adapter");
    }

    @Test
    @DisplayName("Should reject malformed start URLs")
    void shouldRejectMalformedUrl() {
        assertThatThrownBy(() -> factory.createAdapter(SiteKind.SEARCH_LISTING, "ftp://example.org"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> factory.createAdapter(SiteKind.SEARCH_LISTING, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
