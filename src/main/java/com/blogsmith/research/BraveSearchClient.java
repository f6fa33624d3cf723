package com.blogsmith.research;

import com.blogsmith.config.BlogsmithProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the Brave web search API.
 */
@Component
public class BraveSearchClient {

    private static final Logger log = LoggerFactory.getLogger(BraveSearchClient.class);

    private final BlogsmithProperties.Search settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public BraveSearchClient(BlogsmithProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    BraveSearchClient(BlogsmithProperties properties, HttpClient httpClient) {
        this.settings = properties.getSearch();
        this.httpClient = httpClient;
    }

    /**
     * Runs one web search.
     *
     * @return up to {@code blogsmith.search.max-results} hits, in ranking order
     * @throws SearchException if the request fails or the API answers with an error
     */
    public List<SearchResult> search(String query) {
        String url = settings.getBraveUrl()
                + "?q=" + encode(query)
                + "&count=" + settings.getMaxResults()
                + "&search_lang=en&safesearch=moderate";
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Accept", "application/json")
                    .header("X-Subscription-Token", settings.getBraveApiKey())
                    .timeout(Duration.ofSeconds(30))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new SearchException("Brave search failed for '%s' (HTTP %d): %s"
                        .formatted(query, response.statusCode(), response.body()));
            }
            List<SearchResult> results = parse(objectMapper.readTree(response.body()));
            log.debug("Search '{}' returned {} result(s)", query, results.size());
            return results;
        } catch (IOException e) {
            throw new SearchException("Brave search request failed for '" + query + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchException("Brave search interrupted for '" + query + "'", e);
        }
    }

    List<SearchResult> parse(JsonNode body) {
        var results = new ArrayList<SearchResult>();
        for (JsonNode hit : body.path("web").path("results")) {
            if (results.size() >= settings.getMaxResults()) {
                break;
            }
            String url = hit.path("url").asText("");
            if (url.isBlank()) {
                continue;
            }
            results.add(new SearchResult(
                    hit.path("title").asText(""),
                    url,
                    hit.path("description").asText(""),
                    hit.path("page_age").asText("")));
        }
        return results;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
