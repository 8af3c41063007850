package io.fuelprices.exporter;

import io.fuelprices.core.FeedSource;
import io.fuelprices.error.FetchException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Fetches a feed with a plain GET and streams the body. No request timeout is applied beyond the
 * client's defaults.
 */
final class HttpFeedSource implements FeedSource {
    private final String name;
    private final URI uri;
    private final HttpClient http;

    HttpFeedSource(String name, URI uri, HttpClient http) {
        this.name = name;
        this.uri = uri;
        this.http = http;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public InputStream open() throws FetchException {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .header("User-Agent", "Mozilla/5.0")
                .GET()
                .build();
        HttpResponse<InputStream> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new FetchException("failed to fetch " + name + " feed from " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("interrupted while fetching " + name + " feed", e);
        }
        if (resp.statusCode() / 100 != 2) {
            try (InputStream ignored = resp.body()) {
                throw new FetchException(name + " feed fetch failed: HTTP " + resp.statusCode() + " from " + uri);
            } catch (IOException e) {
                throw new FetchException(name + " feed fetch failed: HTTP " + resp.statusCode() + " from " + uri, e);
            }
        }
        return resp.body();
    }

    @Override
    public String toString() {
        return "HttpFeedSource{" + name + " " + uri + '}';
    }
}
