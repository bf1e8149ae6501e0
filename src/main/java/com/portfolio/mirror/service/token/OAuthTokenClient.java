package com.portfolio.mirror.service.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfolio.mirror.common.constants.BrokerageConstants;
import com.portfolio.mirror.common.exception.UpstreamAuthException;
import com.portfolio.mirror.common.exception.UpstreamUnavailableException;
import com.portfolio.mirror.config.BrokerageConfig;
import com.portfolio.mirror.model.brokerage.OAuthTokenResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;

/**
 * Client for the brokerage OAuth token endpoint. Exchanges a refresh token for a new access/refresh pair.
 * <p>
 * Failure mapping:
 * - any 4xx: {@link UpstreamAuthException} carrying the status (400/401 = refresh token is dead)
 * - 5xx, timeouts, connection errors: {@link UpstreamUnavailableException}
 * - a 2xx body that cannot be read as JSON (maintenance pages): {@link UpstreamUnavailableException}
 * - 2xx with a body missing any of the four fields: {@link UpstreamAuthException} with the 2xx status
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OAuthTokenClient {

    private final RestTemplate template;
    private final BrokerageConfig config;

    public OAuthTokenResponse exchangeRefreshToken(String personName, String refreshToken) {
        String url = stripTrailingSlash(config.getAuthUrl()) + BrokerageConstants.OAUTH_TOKEN_PATH;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", BrokerageConstants.GRANT_TYPE_REFRESH);
        form.add("refresh_token", refreshToken);

        JsonNode body;
        try {
            body = template.postForObject(url, new HttpEntity<>(form, headers), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (e.getStatusCode().is5xxServerError()) {
                log.warn("OAuth endpoint unavailable for {}: HTTP {}", personName, status);
                throw new UpstreamUnavailableException(
                        "Brokerage OAuth endpoint returned HTTP " + status + " for " + personName, status, e);
            }
            log.warn("OAuth endpoint rejected refresh for {}: HTTP {}", personName, status);
            throw new UpstreamAuthException(personName, status, e);
        } catch (ResourceAccessException e) {
            log.warn("OAuth endpoint unreachable for {}: {}", personName, e.getMessage());
            throw new UpstreamUnavailableException(
                    "Brokerage OAuth endpoint unreachable for " + personName, 0, e);
        } catch (RestClientException e) {
            log.warn("OAuth endpoint returned an unreadable response for {}: {}", personName, e.getMessage());
            throw new UpstreamUnavailableException(
                    "Brokerage OAuth endpoint returned an unreadable response for " + personName, 0, e);
        }

        OAuthTokenResponse parsed = OAuthTokenResponse.from(body);
        if (!parsed.isComplete()) {
            throw new UpstreamAuthException(personName, 200,
                    "token response missing " + String.join(", ", parsed.missingFields()));
        }
        return new OAuthTokenResponse(parsed.accessToken(), parsed.refreshToken(),
                ApiServerNormalizer.normalize(parsed.apiServer()), parsed.expiresInSeconds());
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
