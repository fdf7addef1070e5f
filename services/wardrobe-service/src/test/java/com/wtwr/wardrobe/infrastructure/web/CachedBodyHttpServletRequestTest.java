package com.wtwr.wardrobe.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.util.StreamUtils;

@DisplayName("CachedBodyHttpServletRequest")
class CachedBodyHttpServletRequestTest {

    private static final String BODY = "{\"name\":\"Wool hat\"}";

    @Test
    @DisplayName("replays a peeked body to every reader")
    void replaysBody() throws Exception {
        var cached = new CachedBodyHttpServletRequest(request(BODY), 1024);

        assertThat(cached.peekBody()).hasValueSatisfying(
                body -> assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo(BODY));
        String first = StreamUtils.copyToString(cached.getInputStream(), StandardCharsets.UTF_8);
        String second = StreamUtils.copyToString(cached.getInputStream(), StandardCharsets.UTF_8);
        String viaReader = cached.getReader().lines().collect(Collectors.joining());

        assertThat(first).isEqualTo(BODY);
        assertThat(second).isEqualTo(BODY);
        assertThat(viaReader).isEqualTo(BODY);
    }

    @Test
    @DisplayName("a body exactly at the limit is peeked whole")
    void bodyAtLimit() throws Exception {
        int length = BODY.getBytes(StandardCharsets.UTF_8).length;

        assertThat(new CachedBodyHttpServletRequest(request(BODY), length).peekBody()).isPresent();
    }

    @Test
    @DisplayName("a body over the limit is not peeked, and later readers still get all of it")
    void bodyOverLimit() throws Exception {
        String large = "{\"name\":\"" + "z".repeat(5000) + "\"}";
        var original = request(large);
        var cached = new CachedBodyHttpServletRequest(original, 16);

        assertThat(cached.peekBody()).isEmpty();
        assertThat(original.getInputStream().available()).isEqualTo(large.length() - 17);
        assertThat(StreamUtils.copyToString(cached.getInputStream(), StandardCharsets.UTF_8)).isEqualTo(large);
    }

    @Test
    @DisplayName("reads straight through when nothing was peeked")
    void passThrough() throws Exception {
        var cached = new CachedBodyHttpServletRequest(request(BODY), 4);

        assertThat(StreamUtils.copyToString(cached.getInputStream(), StandardCharsets.UTF_8)).isEqualTo(BODY);
    }

    @Test
    @DisplayName("an absent body peeks as empty")
    void emptyBody() throws Exception {
        var cached = new CachedBodyHttpServletRequest(new MockHttpServletRequest("GET", "/users/me"), 1024);

        assertThat(cached.peekBody()).hasValueSatisfying(body -> assertThat(body).isEmpty());
        assertThat(cached.getInputStream().isFinished()).isTrue();
    }

    @Test
    @DisplayName("decodes the reader with the request encoding")
    void honoursEncoding() throws Exception {
        var original = new MockHttpServletRequest("POST", "/signup");
        original.setCharacterEncoding("ISO-8859-1");
        original.setContent("{\"name\":\"Zoë\"}".getBytes(StandardCharsets.ISO_8859_1));
        var cached = new CachedBodyHttpServletRequest(original, 1024);
        cached.peekBody();

        assertThat(cached.getReader().readLine()).isEqualTo("{\"name\":\"Zoë\"}");
    }

    private static MockHttpServletRequest request(String body) {
        var request = new MockHttpServletRequest("POST", "/items");
        request.setContent(body.getBytes(StandardCharsets.UTF_8));
        return request;
    }
}
