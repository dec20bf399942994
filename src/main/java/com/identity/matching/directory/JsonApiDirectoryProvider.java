package com.identity.matching.directory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.matching.api.MatchingOptions;
import com.identity.matching.core.model.CandidateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Fetches the people of a directory list from a JSON:API people service.
 *
 * <p>The first page is {@code {baseUrl}/people/v2/lists/{scopeId}/people?include=emails,phone_numbers&per_page=N};
 * further pages follow {@code links.next} until there is none or the page cap is reached.
 * Email addresses and phone numbers are resolved from the {@code included} section of
 * every page, so a person may reference an entry delivered on a different page.</p>
 *
 * <p>With {@code forceRefresh} the list is first asked to rebuild itself
 * ({@code POST .../lists/{scopeId}/refresh}); a failed refresh is logged and the
 * fetch continues with the current list contents.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * JsonApiDirectoryProvider provider = JsonApiDirectoryProvider.builder()
 *     .baseUrl("https://api.planningcenteronline.com")
 *     .tokenSupplier(tokens::currentAccessToken)
 *     .build();
 * </pre>
 */
public class JsonApiDirectoryProvider implements DirectoryProvider {
    private static final Logger log = LoggerFactory.getLogger(JsonApiDirectoryProvider.class);

    private static final String DEFAULT_BASE_URL = "https://api.planningcenteronline.com";
    private static final String EMAIL_TYPE = "Email";
    private static final String PHONE_TYPE = "PhoneNumber";

    private final String baseUrl;
    private final Supplier<String> tokenSupplier;
    private final int pageSize;
    private final int maxPages;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private JsonApiDirectoryProvider(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.tokenSupplier = Objects.requireNonNull(builder.tokenSupplier, "tokenSupplier is required");
        this.pageSize = builder.pageSize;
        this.maxPages = builder.maxPages;
        this.timeout = builder.timeout;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    @Override
    public List<CandidateRecord> fetchAllCandidates(String scopeId, boolean forceRefresh) {
        if (scopeId == null || scopeId.isBlank()) {
            throw new IllegalArgumentException("scopeId is required");
        }
        if (forceRefresh) {
            refreshList(scopeId);
        }

        List<JsonNode> people = new ArrayList<>();
        Map<String, String> emails = new HashMap<>();
        Map<String, String> phones = new HashMap<>();

        URI base = URI.create(baseUrl + "/");
        URI next = URI.create(baseUrl + "/people/v2/lists/" + scopeId
                + "/people?include=emails,phone_numbers&per_page=" + pageSize);
        int pages = 0;
        while (next != null) {
            if (pages >= maxPages) {
                log.warn("directory.fetch.page-limit scopeId={} maxPages={} fetched={} - remaining pages ignored",
                        scopeId, maxPages, people.size());
                break;
            }
            JsonNode page = getPage(next, scopeId);
            pages++;

            for (JsonNode person : page.path("data")) {
                people.add(person);
            }
            for (JsonNode included : page.path("included")) {
                String type = included.path("type").asText();
                String id = included.path("id").asText();
                if (EMAIL_TYPE.equals(type)) {
                    emails.put(id, included.path("attributes").path("address").asText(""));
                } else if (PHONE_TYPE.equals(type)) {
                    phones.put(id, included.path("attributes").path("number").asText(""));
                }
            }

            String nextLink = page.path("links").path("next").asText(null);
            next = nextLink != null && !nextLink.isBlank() ? followNext(base, nextLink, scopeId) : null;
        }

        List<CandidateRecord> candidates = new ArrayList<>(people.size());
        for (JsonNode person : people) {
            candidates.add(toCandidate(person, emails, phones));
        }
        log.info("directory.fetch.completed scopeId={} pages={} people={}", scopeId, pages, candidates.size());
        return candidates;
    }

    /**
     * Resolves a {@code links.next} value against the base URL. The bearer token goes with
     * every page request, so a link to another scheme, host or port aborts the fetch.
     */
    static URI followNext(URI base, String nextLink, String scopeId) {
        URI next;
        try {
            next = base.resolve(nextLink.trim());
        } catch (IllegalArgumentException e) {
            throw new DirectoryFetchException("Directory returned an invalid next link for scope " + scopeId
                    + ": '" + nextLink + "'", e);
        }
        if (!sameOrigin(base, next)) {
            throw new DirectoryFetchException("Directory next link for scope " + scopeId
                    + " leaves " + base.getScheme() + "://" + base.getAuthority() + ": '" + nextLink + "'");
        }
        return next;
    }

    private static boolean sameOrigin(URI a, URI b) {
        return a.getScheme() != null && a.getScheme().equalsIgnoreCase(b.getScheme())
                && a.getHost() != null && a.getHost().equalsIgnoreCase(b.getHost())
                && effectivePort(a) == effectivePort(b);
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private JsonNode getPage(URI uri, String scopeId) {
        HttpRequest request = authorized(uri).GET().build();
        log.debug("directory.fetch.page scopeId={} uri={}", scopeId, uri);
        HttpResponse<String> response = send(request, scopeId);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new DirectoryFetchException("Directory returned status " + response.statusCode()
                    + " for scope " + scopeId + ": " + response.body());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new DirectoryFetchException("Directory returned an unreadable page for scope " + scopeId, e);
        }
    }

    private void refreshList(String scopeId) {
        URI uri = URI.create(baseUrl + "/people/v2/lists/" + scopeId + "/refresh");
        HttpRequest request = authorized(uri).POST(HttpRequest.BodyPublishers.noBody()).build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("directory.refresh.failed scopeId={} status={} - fetching current list contents",
                        scopeId, response.statusCode());
            } else {
                log.info("directory.refresh.requested scopeId={}", scopeId);
            }
        } catch (IOException e) {
            log.warn("directory.refresh.failed scopeId={} error='{}' - fetching current list contents",
                    scopeId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DirectoryFetchException("Directory refresh interrupted for scope " + scopeId, e);
        }
    }

    private HttpResponse<String> send(HttpRequest request, String scopeId) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new DirectoryFetchException("Directory fetch timed out after " + timeout + " for scope " + scopeId, e);
        } catch (IOException e) {
            throw new DirectoryFetchException("Directory fetch failed for scope " + scopeId + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DirectoryFetchException("Directory fetch interrupted for scope " + scopeId, e);
        }
    }

    private HttpRequest.Builder authorized(URI uri) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + tokenSupplier.get());
    }

    private CandidateRecord toCandidate(JsonNode person, Map<String, String> emails, Map<String, String> phones) {
        JsonNode attributes = person.path("attributes");
        String name = attributes.path("name").asText("");
        if (name.isBlank()) {
            name = (attributes.path("first_name").asText("") + " " + attributes.path("last_name").asText("")).trim();
        }

        CandidateRecord.Builder builder = CandidateRecord.builder()
                .externalId(person.path("id").asText(null))
                .name(name)
                .status(attributes.path("status").asText(null));
        for (JsonNode ref : person.path("relationships").path("emails").path("data")) {
            builder.email(emails.get(ref.path("id").asText()));
        }
        for (JsonNode ref : person.path("relationships").path("phone_numbers").path("data")) {
            builder.phone(phones.get(ref.path("id").asText()));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Supplier<String> tokenSupplier;
        private int pageSize = MatchingOptions.defaults().getDirectoryPageSize();
        private int maxPages = MatchingOptions.defaults().getDirectoryMaxPages();
        private Duration timeout = Duration.ofSeconds(30);
        private HttpClient httpClient;
        private ObjectMapper objectMapper;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Supplies the bearer token for every request. Token refresh is the supplier's concern.
         */
        public Builder tokenSupplier(Supplier<String> tokenSupplier) {
            this.tokenSupplier = tokenSupplier;
            return this;
        }

        public Builder pageSize(int pageSize) {
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive");
            }
            this.pageSize = pageSize;
            return this;
        }

        public Builder maxPages(int maxPages) {
            if (maxPages <= 0) {
                throw new IllegalArgumentException("maxPages must be positive");
            }
            this.maxPages = maxPages;
            return this;
        }

        /**
         * Timeout of each HTTP request.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        /**
         * Takes page size and page cap from the matching options.
         */
        public Builder options(MatchingOptions options) {
            this.pageSize = options.getDirectoryPageSize();
            this.maxPages = options.getDirectoryMaxPages();
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public JsonApiDirectoryProvider build() {
            return new JsonApiDirectoryProvider(this);
        }
    }
}
