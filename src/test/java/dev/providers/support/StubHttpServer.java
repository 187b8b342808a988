package dev.providers.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process HTTP server that answers each path from a script of canned responses
 * and records every request it receives. The last response for a path repeats.
 */
public final class StubHttpServer implements AutoCloseable {

    public record Response(int status, String body, Map<String, String> headers) {
        public static Response json(int status, String body) {
            return new Response(status, body, Map.of("Content-Type", "application/json"));
        }

        public Response withHeader(String name, String value) {
            var copy = new HashMap<>(headers);
            copy.put(name, value);
            return new Response(status, body, copy);
        }
    }

    public record Recorded(String method, String path, Map<String, List<String>> headers, String body,
                           long receivedAtNanos) {
        public String header(String name) {
            for (var entry : headers.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                    return entry.getValue().get(0);
                }
            }
            return null;
        }
    }

    private final HttpServer server;
    private final Map<String, Deque<Response>> scripts = new HashMap<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();

    public StubHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    /** Queue responses for an exact path, served in order. */
    public synchronized StubHttpServer on(String path, Response... responses) {
        scripts.computeIfAbsent(path, p -> new ArrayDeque<>()).addAll(List.of(responses));
        return this;
    }

    public List<Recorded> requests() {
        return requests;
    }

    public List<Recorded> requestsTo(String path) {
        return requests.stream().filter(r -> r.path().equals(path)).toList();
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String path = exchange.getRequestURI().getRawPath();
        requests.add(new Recorded(exchange.getRequestMethod(), path,
            Map.copyOf(exchange.getRequestHeaders()), body, System.nanoTime()));

        Response response = next(path);
        response.headers().forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private synchronized Response next(String path) {
        Deque<Response> script = scripts.get(path);
        if (script == null || script.isEmpty()) {
            return Response.json(404, "{\"error\":{\"message\":\"no stub for " + path + "\"}}");
        }
        return script.size() > 1 ? script.poll() : script.peek();
    }
}
