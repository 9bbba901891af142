package com.example.chathub.identity;

import com.example.chathub.exception.AuthorizationDeniedException;
import com.example.chathub.exception.UpstreamUnavailableException;
import com.example.chathub.model.IdentityGrant;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Calls {@code GET /verify-group-access/{groupId}} with the bearer credential.
 * 200 grants access, 403 means not a member, anything else is an authentication failure.
 */
@Component
public class HttpIdentityClient implements IdentityClient {
    private static final Logger log = LoggerFactory.getLogger(HttpIdentityClient.class);

    static final String NOT_A_MEMBER = "You are not a member of this group";
    static final String AUTH_FAILED = "Authentication failed";
    static final String UNAVAILABLE = "Authentication service unavailable";

    private final RestTemplate restTemplate;

    public HttpIdentityClient(@Qualifier("identityRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public IdentityGrant verifyGroupAccess(String credential, long groupId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credential);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange("/verify-group-access/{groupId}", HttpMethod.GET,
                    new HttpEntity<>(headers), JsonNode.class, groupId);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode() == HttpStatus.FORBIDDEN) {
                throw new AuthorizationDeniedException(NOT_A_MEMBER);
            }
            log.warn("identity check rejected. groupId={} status={}", groupId, e.getRawStatusCode());
            throw new AuthorizationDeniedException(AUTH_FAILED);
        } catch (ResourceAccessException e) {
            log.warn("identity service unreachable: {}", e.getMessage());
            throw new UpstreamUnavailableException(UNAVAILABLE, e);
        } catch (RestClientException e) {
            // unreadable body on a 200
            log.warn("identity check failed. groupId={} error={}", groupId, e.toString());
            throw new AuthorizationDeniedException(AUTH_FAILED);
        }

        if (response.getStatusCode() != HttpStatus.OK) {
            throw new AuthorizationDeniedException(AUTH_FAILED);
        }
        JsonNode body = response.getBody();
        String user = body == null ? "" : body.path("user").asText("");
        if (user.isBlank()) {
            throw new AuthorizationDeniedException(AUTH_FAILED);
        }
        String groupName = body.path("group_name").asText(null);
        return new IdentityGrant(user, groupName);
    }
}
