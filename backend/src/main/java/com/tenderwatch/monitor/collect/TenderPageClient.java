package com.tenderwatch.monitor.collect;

import java.io.IOException;
import org.jsoup.nodes.Document;

public interface TenderPageClient {
  /**
   * Returns the listing page once its tender table is present.
   *
   * @param scope city to narrow the listing to, or {@code null} for all tenders
   */
  Document fetchListingPage(String url, String scope, String userAgent, int timeoutMs) throws IOException;
}
