package com.drover.core.inference;

import javax.net.ssl.SSLSession;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Canned HTTP responses keyed by request path, served through a mocked {@link HttpClient}.
 */
final class StubHttp {

    private final Map<String, Integer> statuses = new HashMap<>();
    private final Map<String, String> bodies = new HashMap<>();
    private final Set<String> streaming = new HashSet<>();
    private final List<HttpRequest> requests = new CopyOnWriteArrayList<>();

    StubHttp on(String path, int status, String body) {
        statuses.put(path, status);
        bodies.put(path, body);
        return this;
    }

    StubHttp on(String path, String body) {
        return on(path, 200, body);
    }

    StubHttp onStream(String path, String body) {
        streaming.add(path);
        return on(path, 200, body);
    }

    List<HttpRequest> requests() {
        return requests;
    }

    List<String> paths() {
        return requests.stream().map(r -> r.uri().getPath()).toList();
    }

    HttpClient client() throws Exception {
        HttpClient client = mock(HttpClient.class);
        when(client.send(any(HttpRequest.class), any())).thenAnswer(inv -> respond(inv.getArgument(0)));
        return client;
    }

    private HttpResponse<Object> respond(HttpRequest request) {
        requests.add(request);
        String path = request.uri().getPath();
        int status = statuses.getOrDefault(path, 404);
        String body = bodies.getOrDefault(path, "not found");
        Object payload = streaming.contains(path)
                ? new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8))
                : body;
        return new CannedResponse(request, status, payload);
    }

    private record CannedResponse(HttpRequest request, int statusCode, Object body) implements HttpResponse<Object> {

        @Override
        public Optional<HttpResponse<Object>> previousResponse() {
            return Optional.empty();
        }

        @Override
        public HttpHeaders headers() {
            return HttpHeaders.of(Map.of(), (a, b) -> true);
        }

        @Override
        public Optional<SSLSession> sslSession() {
            return Optional.empty();
        }

        @Override
        public URI uri() {
            return request.uri();
        }

        @Override
        public HttpClient.Version version() {
            return HttpClient.Version.HTTP_1_1;
        }
    }
}
