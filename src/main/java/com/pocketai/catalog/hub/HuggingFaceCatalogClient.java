package com.pocketai.catalog.hub;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pocketai.catalog.config.SyncSettings;
import com.pocketai.catalog.hub.CatalogUnavailableException.Reason;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonException;

/**
 * {@link HubCatalogClient} backed by the public Hugging Face model listing
 * ({@code GET /api/models}). Follows {@code Link: rel="next"} pages until the
 * requested number of public models is collected.
 */
@ApplicationScoped
public class HuggingFaceCatalogClient implements HubCatalogClient {

    private static final Logger log = LoggerFactory.getLogger(HuggingFaceCatalogClient.class);
    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?next\"?");

    private SyncSettings settings;
    private HttpClient httpClient;
    private HubModelParser parser;

    protected HuggingFaceCatalogClient() {
    }

    @Inject
    public HuggingFaceCatalogClient(SyncSettings settings) {
        this(settings, HttpClient.newBuilder()
                .connectTimeout(settings.getRequestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    HuggingFaceCatalogClient(SyncSettings settings, HttpClient httpClient) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.parser = new HubModelParser(settings.getHubBaseUrl());
    }

    @Override
    public List<HubModelDescriptor> listItems(String filterLabel, int limit) throws CatalogUnavailableException {
        List<HubModelDescriptor> models = new ArrayList<>();
        int privateCount = 0;
        int pages = 0;
        URI next = firstPageUri(filterLabel, Math.min(settings.getPageSize(), limit));

        log.info("Fetching up to {} models with filter '{}' from {}", limit, filterLabel, settings.getHubBaseUrl());
        while (next != null && models.size() < limit) {
            HttpResponse<String> response = send(next);
            pages++;
            List<HubModelDescriptor> page;
            try {
                page = parser.parseListing(response.body());
            } catch (JsonException e) {
                throw new CatalogUnavailableException(Reason.REJECTED,
                        "Invalid JSON received from model hub: " + truncate(response.body()), e);
            }
            if (page.isEmpty()) {
                break;
            }
            for (HubModelDescriptor descriptor : page) {
                if (descriptor.isPrivateModel()) {
                    privateCount++;
                    continue;
                }
                if (models.size() >= limit) {
                    break;
                }
                models.add(descriptor);
            }
            next = nextPageUri(response, next);
        }

        log.info("Found {} public models across {} page(s) ({} private skipped)", models.size(), pages, privateCount);
        return models;
    }

    private HttpResponse<String> send(URI uri) throws CatalogUnavailableException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Accept", "application/json")
                .timeout(settings.getRequestTimeout())
                .GET();
        String token = settings.getApiToken();
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new CatalogUnavailableException(Reason.UNREACHABLE,
                    "Model hub did not answer within " + settings.getRequestTimeout().toSeconds() + "s", e);
        } catch (IOException e) {
            throw new CatalogUnavailableException(Reason.UNREACHABLE, "Model hub unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogUnavailableException(Reason.UNREACHABLE, "Interrupted while fetching from model hub", e);
        }

        int status = response.statusCode();
        if (status == 429) {
            String retryAfter = response.headers().firstValue("Retry-After").orElse("unspecified");
            throw new CatalogUnavailableException(Reason.RATE_LIMITED,
                    "Model hub rate limit reached (retry after " + retryAfter + ")");
        }
        if (status >= 300) {
            throw new CatalogUnavailableException(Reason.REJECTED,
                    String.format("Model hub returned %d: %s", status, truncate(response.body())));
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (!contentType.toLowerCase(Locale.ROOT).contains("application/json")) {
            throw new CatalogUnavailableException(Reason.REJECTED,
                    "Unexpected content type '" + contentType + "' from model hub");
        }
        return response;
    }

    URI firstPageUri(String filterLabel, int pageSize) {
        String query = "filter=" + URLEncoder.encode(filterLabel, StandardCharsets.UTF_8)
                + "&limit=" + pageSize
                + "&full=true&cardData=true";
        return URI.create(settings.getHubBaseUrl() + "/api/models?" + query);
    }

    /**
     * The {@code rel="next"} target of the response, resolved against the
     * page that was just fetched, or {@code null} on the last page.
     *
     * @throws CatalogUnavailableException (REJECTED) when the target is not a
     *         usable http(s) URI
     */
    static URI nextPageUri(HttpResponse<?> response, URI current) throws CatalogUnavailableException {
        for (String link : response.headers().allValues("Link")) {
            Matcher m = NEXT_LINK.matcher(link);
            if (!m.find()) {
                continue;
            }
            String target = m.group(1).trim();
            URI next;
            try {
                next = current.resolve(target);
            } catch (IllegalArgumentException e) {
                throw new CatalogUnavailableException(Reason.REJECTED,
                        "Malformed next-page link from model hub: " + target, e);
            }
            String scheme = next.getScheme() == null ? "" : next.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || next.getHost() == null) {
                throw new CatalogUnavailableException(Reason.REJECTED,
                        "Unusable next-page link from model hub: " + target);
            }
            return next;
        }
        return null;
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 512 ? body.substring(0, 512) + "..." : body;
    }
}
