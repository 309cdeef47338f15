package com.paperharvest.backend.scraping;

import java.io.IOException;
import java.time.Duration;

/**
 * One HTTP GET. Non-2xx statuses are returned, not thrown; timeouts surface as
 * {@link java.net.SocketTimeoutException}.
 */
public interface PageClient {

    PageResponse get(String url, Duration timeout) throws IOException;
}
