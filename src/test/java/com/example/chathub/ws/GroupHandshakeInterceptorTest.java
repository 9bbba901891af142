package com.example.chathub.ws;

import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class GroupHandshakeInterceptorTest {

    private final GroupHandshakeInterceptor interceptor = new GroupHandshakeInterceptor("/ws/group/{groupId}");

    private static ServletServerHttpRequest request(String path, String query, String authorization) {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", path);
        if (query != null) req.setQueryString(query);
        if (authorization != null) req.addHeader("Authorization", authorization);
        return new ServletServerHttpRequest(req);
    }

    @Test
    void tokenFromQueryParameter() {
        Map<String, Object> attrs = new HashMap<>();
        boolean ok = interceptor.beforeHandshake(request("/ws/group/7", "token=abc%2Edef", null),
                new ServletServerHttpResponse(new MockHttpServletResponse()), mock(WebSocketHandler.class), attrs);

        assertTrue(ok);
        assertEquals(7L, attrs.get(GroupHandshakeInterceptor.ATTR_GROUP_ID));
        assertEquals("abc.def", attrs.get(GroupHandshakeInterceptor.ATTR_CREDENTIAL));
    }

    @Test
    void tokenFromBearerHeader() {
        Map<String, Object> attrs = new HashMap<>();
        interceptor.beforeHandshake(request("/ws/group/12", null, "Bearer xyz"),
                new ServletServerHttpResponse(new MockHttpServletResponse()), mock(WebSocketHandler.class), attrs);

        assertEquals(12L, attrs.get(GroupHandshakeInterceptor.ATTR_GROUP_ID));
        assertEquals("xyz", attrs.get(GroupHandshakeInterceptor.ATTR_CREDENTIAL));
    }

    @Test
    void queryParameterWinsOverHeader() {
        Map<String, Object> attrs = new HashMap<>();
        interceptor.beforeHandshake(request("/ws/group/12", "token=q", "Bearer h"),
                new ServletServerHttpResponse(new MockHttpServletResponse()), mock(WebSocketHandler.class), attrs);

        assertEquals("q", attrs.get(GroupHandshakeInterceptor.ATTR_CREDENTIAL));
    }

    @Test
    void missingCredentialStillAcceptsHandshake() {
        Map<String, Object> attrs = new HashMap<>();
        boolean ok = interceptor.beforeHandshake(request("/ws/group/3", null, null),
                new ServletServerHttpResponse(new MockHttpServletResponse()), mock(WebSocketHandler.class), attrs);

        assertTrue(ok);
        assertFalse(attrs.containsKey(GroupHandshakeInterceptor.ATTR_CREDENTIAL));
    }

    @Test
    void nonNumericGroupIsRejected() {
        MockHttpServletResponse raw = new MockHttpServletResponse();
        boolean ok = interceptor.beforeHandshake(request("/ws/group/lobby", "token=a", null),
                new ServletServerHttpResponse(raw), mock(WebSocketHandler.class), new HashMap<>());

        assertFalse(ok);
    }
}
