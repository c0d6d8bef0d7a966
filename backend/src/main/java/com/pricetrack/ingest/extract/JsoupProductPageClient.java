package com.pricetrack.ingest.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
public class JsoupProductPageClient implements ProductPageClient {
    @Override
    public Document fetchProductPage(String url, String userAgent, int timeoutMs) throws IOException {
        return Jsoup.connect(url)
            .userAgent(userAgent)
            .timeout(timeoutMs)
            .header("Accept-Language", "en-US,en;q=0.8")
            .get();
    }
}
