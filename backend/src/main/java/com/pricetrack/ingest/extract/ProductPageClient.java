package com.pricetrack.ingest.extract;

import java.io.IOException;
import org.jsoup.nodes.Document;

public interface ProductPageClient {
  Document fetchProductPage(String url, String userAgent, int timeoutMs) throws IOException;
}
