package com.paperharvest.backend.scraping;

import com.paperharvest.backend.config.CrawlConfig;
import java.io.IOException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsoupPageClient implements PageClient {

    private final CrawlConfig crawlConfig;

    @Override
    public PageResponse get(String url, Duration timeout) throws IOException {
        log.debug("GET {}", url);
        Connection.Response response = Jsoup.connect(url)
                .headers(crawlConfig.getDefaultHeaders())
                .timeout((int) timeout.toMillis())
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .maxBodySize(0)
                .execute();
        return new PageResponse(response.statusCode(), response.body());
    }
}
