package com.example.chathub.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves the group id from the path and the bearer credential from {@code ?token=} or the
 * Authorization header. A missing credential does not fail the handshake: the session closes
 * it with a policy-violation reason once accepted.
 */
public class GroupHandshakeInterceptor implements HandshakeInterceptor {
    private static final Logger log = LoggerFactory.getLogger(GroupHandshakeInterceptor.class);

    public static final String ATTR_GROUP_ID = "chathub.groupId";
    public static final String ATTR_CREDENTIAL = "chathub.credential";

    private static final String BEARER_PREFIX = "Bearer ";

    private final AntPathMatcher matcher = new AntPathMatcher();
    private final String pathPattern;

    public GroupHandshakeInterceptor(String pathPattern) {
        this.pathPattern = pathPattern;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        Long groupId = extractGroupId(request.getURI());
        if (groupId == null) {
            log.warn("handshake rejected: no group id. uri={}", request.getURI());
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }
        attributes.put(ATTR_GROUP_ID, groupId);

        String credential = extractCredential(request.getURI(), request.getHeaders());
        if (credential != null) {
            attributes.put(ATTR_CREDENTIAL, credential);
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    Long extractGroupId(URI uri) {
        String path = uri == null ? null : uri.getPath();
        if (path == null) return null;
        if (!matcher.match(pathPattern, path)) return null;
        String raw = matcher.extractUriTemplateVariables(pathPattern, path).get("groupId");
        try {
            return raw == null ? null : Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String extractCredential(URI uri, HttpHeaders headers) {
        String token = extractQueryParam(uri, "token");
        if (token != null && !token.isBlank()) return token;

        String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (auth == null) return null;
        String value = auth.startsWith(BEARER_PREFIX) ? auth.substring(BEARER_PREFIX.length()) : auth;
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static String extractQueryParam(URI uri, String name) {
        if (uri == null) return null;
        String query = uri.getRawQuery();
        if (query == null) return null;
        Map<String, String> map = new HashMap<>();
        for (String part : query.split("&")) {
            int idx = part.indexOf('=');
            if (idx > 0) {
                map.put(part.substring(0, idx), URLDecoder.decode(part.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }
        return map.get(name);
    }
}
