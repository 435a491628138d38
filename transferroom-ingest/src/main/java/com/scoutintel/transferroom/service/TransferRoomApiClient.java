package com.scoutintel.transferroom.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutintel.transferroom.config.TransferRoomProperties;
import com.scoutintel.transferroom.exception.AuthenticationException;
import com.scoutintel.transferroom.exception.FetchException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Thin client over the TransferRoom external API.
 *
 * Every call goes through a bounded Resilience4j retry: up to maxRetries extra attempts
 * with exponential backoff, only for transient statuses (429, 500, 502, 503, 504) or
 * transport I/O errors, and only for the allow-listed methods GET and POST.
 *
 * Pagination is the caller's job: {@link #fetchPlayers} returns one page and an empty
 * list means there is nothing after it.
 */
@Service
@Slf4j
public class TransferRoomApiClient {

    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);
    static final Set<HttpMethod> RETRYABLE_METHODS = Set.of(HttpMethod.GET, HttpMethod.POST);

    private final RestTemplate loginRestTemplate;
    private final RestTemplate fetchRestTemplate;
    private final ObjectMapper objectMapper;
    private final TransferRoomProperties properties;
    private final Retry retry;

    public TransferRoomApiClient(@Qualifier("loginRestTemplate") RestTemplate loginRestTemplate,
                                 @Qualifier("fetchRestTemplate") RestTemplate fetchRestTemplate,
                                 ObjectMapper objectMapper,
                                 TransferRoomProperties properties) {
        this.loginRestTemplate = loginRestTemplate;
        this.fetchRestTemplate = fetchRestTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.retry = buildRetry(properties.getApi().getRetry());
    }

    public TransferRoomSession openSession(String email, String password) {
        return new TransferRoomSession(email, password, this::login);
    }

    /**
     * POST /login?email=&password= and return the bearer token from the body.
     *
     * @throws AuthenticationException on a non-2xx response or a body without a token
     * @throws FetchException          if the API could not be reached at all
     */
    public String login(String email, String password) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/login")
                .queryParam("email", "{email}")
                .queryParam("password", "{password}")
                .encode()
                .buildAndExpand(email, password)
                .toUri();

        String body;
        try {
            body = call(HttpMethod.POST, () ->
                    loginRestTemplate.exchange(uri, HttpMethod.POST, HttpEntity.EMPTY, String.class));
        } catch (HttpStatusCodeException e) {
            log.error("Authentication failed: HTTP {}", e.getStatusCode().value());
            throw new AuthenticationException("Login rejected with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.error("Authentication failed: {}", e.getMessage());
            throw new FetchException("/login", "Login call failed: " + e.getMessage(), e);
        }

        JsonNode token;
        try {
            token = body == null ? null : objectMapper.readTree(body).get("token");
        } catch (JsonProcessingException e) {
            throw new AuthenticationException("Login response is not valid JSON", e);
        }
        if (token == null || !token.isTextual() || token.asText().isBlank()) {
            throw new AuthenticationException("Login response did not contain a token");
        }
        return token.asText();
    }

    /**
     * GET /competitions. The whole reference list in one response.
     */
    public List<JsonNode> fetchCompetitions(TransferRoomSession session) {
        log.info("Fetching competitions from API...");
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/competitions")
                .build()
                .toUri();

        List<JsonNode> competitions = fetchList("/competitions", uri, session);
        log.info("Fetched {} competitions", competitions.size());
        return competitions;
    }

    /**
     * GET /players?position={offset}&amount={limit}.
     * "position" is the API's name for its paging cursor, unrelated to playing positions.
     *
     * @return the page, possibly empty, never null
     */
    public List<JsonNode> fetchPlayers(TransferRoomSession session, int offset, int limit) {
        log.info("Fetching players from API (offset={}, limit={})", offset, limit);
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/players")
                .queryParam("position", offset)
                .queryParam("amount", limit)
                .build()
                .toUri();

        List<JsonNode> players = fetchList("/players", uri, session);
        log.info("Fetched {} players", players.size());
        return players;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<JsonNode> fetchList(String endpoint, URI uri, TransferRoomSession session) {
        HttpEntity<Void> request = new HttpEntity<>(session.headers());

        String body;
        try {
            body = call(HttpMethod.GET, () ->
                    fetchRestTemplate.exchange(uri, HttpMethod.GET, request, String.class));
        } catch (RestClientException e) {
            log.error("API call failed for {}: {}", uri, e.getMessage());
            throw new FetchException(endpoint, "Request failed: " + e.getMessage(), e);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new FetchException(endpoint, "Response is not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            String kind = root == null || root.isMissingNode() ? "empty body" : root.getNodeType().toString();
            throw new FetchException(endpoint, "Expected a JSON array but got " + kind);
        }

        List<JsonNode> items = new ArrayList<>(root.size());
        root.forEach(items::add);
        return items;
    }

    private String call(HttpMethod method, Supplier<ResponseEntity<String>> request) {
        if (!RETRYABLE_METHODS.contains(method)) {
            return request.get().getBody();
        }
        return retry.executeSupplier(request).getBody();
    }

    private Retry buildRetry(TransferRoomProperties.Api.Retry settings) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxRetries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoff().toMillis(), settings.getBackoffMultiplier()))
                .retryOnException(TransferRoomApiClient::isTransient)
                .build();

        Retry built = Retry.of("transferRoomApi", config);
        built.getEventPublisher().onRetry(event ->
                log.warn("Retrying TransferRoom call (attempt {}) after {}: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return built;
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof HttpStatusCodeException httpError) {
            return RETRYABLE_STATUSES.contains(httpError.getStatusCode().value());
        }
        return error instanceof ResourceAccessException;
    }
}
