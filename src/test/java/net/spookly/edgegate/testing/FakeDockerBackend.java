package net.spookly.edgegate.testing;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import lombok.Value;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Loopback HTTP/1.1 server answering a handful of Docker Engine endpoints, one request per connection.
 *
 * <ul>
 *     <li>{@code /_ping}: {@code OK}</li>
 *     <li>{@code /containers/json}: {@code []}</li>
 *     <li>{@code /containers/{id}/attach} with {@code Upgrade: tcp}: 101, then echoes the raw stream</li>
 *     <li>{@code /events}: chunked body of two events</li>
 *     <li>{@code /hang}: never answers; {@link #hangClosed()} counts down when the client goes away</li>
 *     <li>POST with a body: 201 echoing the body</li>
 *     <li>{@code Expect: 100-continue}: an interim 100 precedes the answer</li>
 * </ul>
 */
@Slf4j
public final class FakeDockerBackend implements AutoCloseable {
    private final ServerSocket server;
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "fake-docker");
        thread.setDaemon(true);
        return thread;
    });
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final List<Socket> sockets = new CopyOnWriteArrayList<>();
    private final CountDownLatch hangStarted = new CountDownLatch(1);
    private final CountDownLatch hangClosed = new CountDownLatch(1);

    public FakeDockerBackend() throws IOException {
        this.server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        executor.submit(this::acceptLoop);
    }

    public int port() {
        return server.getLocalPort();
    }

    public String tcpUrl() {
        return "tcp://127.0.0.1:" + port();
    }

    public List<RecordedRequest> requests() {
        return requests;
    }

    public CountDownLatch hangStarted() {
        return hangStarted;
    }

    public CountDownLatch hangClosed() {
        return hangClosed;
    }

    private void acceptLoop() {
        while (!server.isClosed()) {
            try {
                Socket socket = server.accept();
                sockets.add(socket);
                executor.submit(() -> serve(socket));
            } catch (IOException e) {
                if (!server.isClosed()) {
                    log.warn("Fake docker accept failed", e);
                }
                return;
            }
        }
    }

    private void serve(Socket socket) {
        try (socket) {
            InputStream in = socket.getInputStream();
            OutputStream out = socket.getOutputStream();
            String head = readHead(in);
            if (head == null) {
                return;
            }
            String[] lines = head.split("\r\n");
            String[] requestLine = lines[0].split(" ");
            Map<String, String> headers = new LinkedHashMap<>();
            for (int i = 1; i < lines.length; i++) {
                int colon = lines[i].indexOf(':');
                if (colon > 0) {
                    headers.put(lines[i].substring(0, colon).trim().toLowerCase(Locale.ROOT), lines[i].substring(colon + 1).trim());
                }
            }
            String method = requestLine[0];
            String path = requestLine[1];
            if ("100-continue".equalsIgnoreCase(headers.get("expect"))) {
                out.write("HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1));
                out.flush();
            }
            byte[] body = readBody(in, headers);
            requests.add(new RecordedRequest(method, path, headers, new String(body, StandardCharsets.UTF_8)));
            respond(method, path, headers, body, in, out);
        } catch (SocketException e) {
            log.debug("Fake docker client went away: {}", e.getMessage());
        } catch (IOException e) {
            log.warn("Fake docker connection failed", e);
        }
    }

    private void respond(String method, String path, Map<String, String> headers, byte[] body,
                         InputStream in, OutputStream out) throws IOException {
        String route = stripVersion(path);
        if (route.startsWith("/hang")) {
            hangStarted.countDown();
            try {
                while (in.read() >= 0) {
                    // wait for the client to close
                }
            } finally {
                hangClosed.countDown();
            }
            return;
        }
        if (route.contains("/attach") && "tcp".equalsIgnoreCase(headers.get("upgrade"))) {
            out.write(("HTTP/1.1 101 UPGRADED\r\n"
                    + "Content-Type: application/vnd.docker.raw-stream\r\n"
                    + "Connection: Upgrade\r\n"
                    + "Upgrade: tcp\r\n\r\n").getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
            byte[] chunk = new byte[1024];
            int read;
            while ((read = in.read(chunk)) >= 0) {
                out.write(chunk, 0, read);
                out.flush();
            }
            return;
        }
        if (route.startsWith("/events")) {
            out.write(("HTTP/1.1 200 OK\r\nContent-Type: application/json\r\nTransfer-Encoding: chunked\r\n\r\n"
                    + chunk("{\"status\":\"start\"}\n") + chunk("{\"status\":\"die\"}\n") + "0\r\n\r\n")
                    .getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
            return;
        }
        if ("POST".equals(method) && body.length > 0) {
            writeFixed(out, 201, "Created", "application/json", body);
            return;
        }
        if (route.startsWith("/_ping")) {
            writeFixed(out, 200, "OK", "text/plain; charset=utf-8", "OK".getBytes(StandardCharsets.UTF_8));
        } else if (route.startsWith("/containers/json")) {
            writeFixed(out, 200, "OK", "application/json", "[]".getBytes(StandardCharsets.UTF_8));
        } else {
            writeFixed(out, 404, "Not Found", "application/json",
                    "{\"message\":\"page not found\"}".getBytes(StandardCharsets.UTF_8));
        }
    }

    private static void writeFixed(OutputStream out, int status, String reason, String contentType, byte[] body)
            throws IOException {
        out.write(("HTTP/1.1 " + status + " " + reason + "\r\n"
                + "Api-Version: 1.43\r\n"
                + "Content-Type: " + contentType + "\r\n"
                + "Content-Length: " + body.length + "\r\n"
                + "Connection: close\r\n\r\n").getBytes(StandardCharsets.ISO_8859_1));
        out.write(body);
        out.flush();
    }

    private static String chunk(String text) {
        return Integer.toHexString(text.getBytes(StandardCharsets.UTF_8).length) + "\r\n" + text + "\r\n";
    }

    private static String stripVersion(String path) {
        return path.matches("^/v\\d+(\\.\\d+)?/.*") ? path.substring(path.indexOf('/', 1)) : path;
    }

    private static String readHead(InputStream in) throws IOException {
        ByteArrayOutputStream head = new ByteArrayOutputStream();
        int matched = 0;
        int next;
        while ((next = in.read()) >= 0) {
            head.write(next);
            matched = (next == '\r' && (matched == 0 || matched == 2)) || (next == '\n' && (matched == 1 || matched == 3))
                    ? matched + 1
                    : 0;
            if (matched == 4) {
                String text = head.toString(StandardCharsets.ISO_8859_1);
                return text.substring(0, text.length() - 4);
            }
        }
        return null;
    }

    private static byte[] readBody(InputStream in, Map<String, String> headers) throws IOException {
        String length = headers.get("content-length");
        if (length != null) {
            return in.readNBytes(Integer.parseInt(length));
        }
        if ("chunked".equalsIgnoreCase(headers.get("transfer-encoding"))) {
            ByteArrayOutputStream body = new ByteArrayOutputStream();
            while (true) {
                int size = Integer.parseInt(readLine(in).trim(), 16);
                if (size == 0) {
                    readLine(in);
                    return body.toByteArray();
                }
                body.write(in.readNBytes(size));
                readLine(in);
            }
        }
        return new byte[0];
    }

    private static String readLine(InputStream in) throws IOException {
        StringBuilder line = new StringBuilder();
        int next;
        while ((next = in.read()) >= 0 && next != '\n') {
            if (next != '\r') {
                line.append((char) next);
            }
        }
        return line.toString();
    }

    @Override
    public void close() throws IOException {
        server.close();
        for (Socket socket : sockets) {
            socket.close();
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Value
    @Accessors(fluent = true)
    public static class RecordedRequest {
        String method;
        String path;
        Map<String, String> headers;
        String body;
    }
}
