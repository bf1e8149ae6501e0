package com.portfolio.mirror.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfolio.mirror.common.constants.BrokerageConstants;
import com.portfolio.mirror.common.exception.AuthenticationFailedException;
import com.portfolio.mirror.common.exception.UpstreamUnavailableException;
import com.portfolio.mirror.model.brokerage.BrokerQuote;
import com.portfolio.mirror.model.dto.AccessTokenInfo;
import com.portfolio.mirror.service.token.TokenLifecycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Every brokerage resource call goes through here: rate limiter slot, valid token, bounded HTTP call.
 * <p>
 * A 401 triggers exactly one token refresh and one retry; a second 401 is fatal for the request.
 * 5xx and network failures surface as {@link UpstreamUnavailableException} without retry.
 * Other 4xx responses propagate unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BrokerageGatewayClient {

    private final RestTemplate template;
    private final TokenLifecycleManager tokenManager;
    private final UpstreamRateLimiter rateLimiter;

    /**
     * @param endpoint path below {@code /v1/}, optionally with an encoded query string
     * @param body     JSON body, or null
     */
    public JsonNode request(String personName, String endpoint, HttpMethod method, Object body) {
        return rateLimiter.execute(() -> {
            AccessTokenInfo token = tokenManager.getValidAccessToken(personName);
            try {
                return send(token, endpoint, method, body);
            } catch (HttpClientErrorException.Unauthorized first) {
                log.info("401 from brokerage on {} for {}: refreshing token and retrying once", endpoint, personName);
                AccessTokenInfo refreshed = tokenManager.refreshAfterRejection(personName, token.accessToken());
                rateLimiter.awaitPermit();
                try {
                    return send(refreshed, endpoint, method, body);
                } catch (HttpClientErrorException.Unauthorized second) {
                    log.warn("401 again on {} for {} after refresh; giving up", endpoint, personName);
                    tokenManager.recordTokenError(personName, "Unauthorized on " + endpoint + " after token refresh");
                    throw new AuthenticationFailedException(personName, endpoint, second);
                }
            }
        });
    }

    public JsonNode get(String personName, String endpoint) {
        return request(personName, endpoint, HttpMethod.GET, null);
    }

    // =====================================================================================
    // Typed endpoints
    // =====================================================================================

    public String getServerTime(String personName) {
        JsonNode body = get(personName, BrokerageConstants.TIME_ENDPOINT);
        return body == null ? null : body.path("time").asText(null);
    }

    public List<JsonNode> getAccounts(String personName) {
        return arrayField(get(personName, BrokerageConstants.ACCOUNTS_ENDPOINT), "accounts");
    }

    public JsonNode getAccountBalances(String personName, String accountNumber) {
        return get(personName, accountPath(accountNumber, "balances"));
    }

    public List<JsonNode> getAccountPositions(String personName, String accountNumber) {
        return arrayField(get(personName, accountPath(accountNumber, "positions")), "positions");
    }

    public List<JsonNode> getAccountActivities(String personName, String accountNumber,
                                               OffsetDateTime start, OffsetDateTime end) {
        String endpoint = UriComponentsBuilder.fromPath(accountPath(accountNumber, "activities"))
                .queryParam("startTime", start.toString())
                .queryParam("endTime", end.toString())
                .encode()
                .build()
                .toUriString();
        return arrayField(get(personName, endpoint), "activities");
    }

    public List<JsonNode> getAccountOrders(String personName, String accountNumber, String stateFilter,
                                           OffsetDateTime start, OffsetDateTime end) {
        UriComponentsBuilder b = UriComponentsBuilder.fromPath(accountPath(accountNumber, "orders"));
        if (stateFilter != null && !stateFilter.isBlank()) b.queryParam("stateFilter", stateFilter);
        if (start != null) b.queryParam("startTime", start.toString());
        if (end != null) b.queryParam("endTime", end.toString());
        return arrayField(get(personName, b.encode().build().toUriString()), "orders");
    }

    public Optional<JsonNode> getSymbol(String personName, long symbolId) {
        List<JsonNode> symbols = arrayField(get(personName, BrokerageConstants.SYMBOLS_ENDPOINT + "/" + symbolId),
                "symbols");
        return symbols.stream().findFirst();
    }

    public List<JsonNode> searchSymbols(String personName, String prefix) {
        String endpoint = UriComponentsBuilder.fromPath(BrokerageConstants.SYMBOL_SEARCH_ENDPOINT)
                .queryParam("prefix", prefix)
                .encode()
                .build()
                .toUriString();
        return arrayField(get(personName, endpoint), "symbols");
    }

    /**
     * One upstream call for all ids.
     */
    public List<BrokerQuote> getQuotes(String personName, Collection<Long> symbolIds) {
        if (symbolIds == null || symbolIds.isEmpty()) return Collections.emptyList();
        String ids = symbolIds.stream().map(String::valueOf).collect(Collectors.joining(","));
        JsonNode body = get(personName, BrokerageConstants.QUOTES_ENDPOINT + "?ids=" + ids);
        return arrayField(body, "quotes").stream().map(BrokerQuote::fromJson).toList();
    }

    // =====================================================================================
    // Internals
    // =====================================================================================

    private JsonNode send(AccessTokenInfo token, String endpoint, HttpMethod method, Object body) {
        URI uri = URI.create(token.apiServer() + BrokerageConstants.API_VERSION_PATH + endpoint);

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(token.accessToken());
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }

        try {
            return template.exchange(uri, method, new HttpEntity<>(body, headers), JsonNode.class).getBody();
        } catch (HttpServerErrorException e) {
            log.warn("Brokerage {} {} failed with HTTP {}", method, endpoint, e.getStatusCode().value());
            throw new UpstreamUnavailableException("Brokerage returned HTTP " + e.getStatusCode().value()
                    + " for " + endpoint, e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Brokerage {} {} unreachable: {}", method, endpoint, e.getMessage());
            throw new UpstreamUnavailableException("Brokerage unreachable for " + endpoint, 0, e);
        }
    }

    private static String accountPath(String accountNumber, String resource) {
        return BrokerageConstants.ACCOUNTS_ENDPOINT + "/" + accountNumber + "/" + resource;
    }

    private static List<JsonNode> arrayField(JsonNode body, String field) {
        if (body == null) return Collections.emptyList();
        JsonNode node = body.get(field);
        if (node == null || !node.isArray()) return Collections.emptyList();
        List<JsonNode> out = new ArrayList<>(node.size());
        node.forEach(out::add);
        return out;
    }
}
