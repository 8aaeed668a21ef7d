package com.tenderwatch.monitor.collect;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;

/**
 * Reads the HTML exactly as served. Only usable for listing pages that ship the tender table in
 * the response; the scope is applied afterwards as a row filter.
 */
public class JsoupTenderPageClient implements TenderPageClient {
    @Override
    public Document fetchListingPage(String url, String scope, String userAgent, int timeoutMs) throws IOException {
        return Jsoup.connect(url)
            .userAgent(userAgent)
            .timeout(timeoutMs)
            .maxBodySize(0)
            .get();
    }
}
