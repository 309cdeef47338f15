package com.paperharvest.backend.scraping.site;

import com.paperharvest.backend.model.enums.SiteKind;
import org.springframework.stereotype.Component;

@Component
public class SiteAdapterFactory {

    public SiteAdapter createAdapter(SiteKind kind) {
        switch (kind) {
            case SEARCH_LISTING:
                return new SearchListingAdapter();
            case PROCEEDINGS_LISTING:
                return new ProceedingsListingAdapter();
            default:
                throw new IllegalArgumentException("No adapter for site kind " + kind);
        }
    }

    /**
     * Adapter for a start URL, using the declared kind or inferring it from the host
     *
     * @throws IllegalArgumentException when the URL is not http(s) or no adapter matches it
     */
    public SiteAdapter createAdapter(SiteKind declared, String startUrl) {
        if (startUrl == null || !startUrl.trim().matches("(?i)^https?://\\S+$")) {
            throw new IllegalArgumentException("Start URL must be an absolute http(s) URL: " + startUrl);
        }
        SiteKind kind = declared != null ? declared : SiteKind.fromUrl(startUrl);
        if (kind == null) {
            throw new IllegalArgumentException("No site adapter matches start URL " + startUrl
                    + "; declare a site kind explicitly");
        }
        return createAdapter(kind);
    }
}
