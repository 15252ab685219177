package org.waabox.auditsync.sync.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.auditsync.NodeId;
import org.waabox.auditsync.sync.SyncMessage;
import org.waabox.auditsync.sync.SyncMessageCodec;
import org.waabox.auditsync.sync.SyncMessageListener;
import org.waabox.auditsync.sync.SyncTransport;

/**
 * HTTP-based implementation of {@link SyncTransport}.
 *
 * <p>Uses Java's built-in {@code com.sun.net.httpserver.HttpServer} to
 * receive messages and {@code java.net.http.HttpClient} to POST them to
 * peers asynchronously. Messages travel as JSON produced by
 * {@link SyncMessageCodec}.
 *
 * <p>Since sends are asynchronous, delivery failures are reported to the
 * handler registered through {@link #onSendFailure(BiConsumer)} rather than
 * thrown.
 *
 * <p>Typical usage:
 * <pre>{@code
 * HttpSyncConfig config = HttpSyncConfig.create(8081, Map.of(
 *     NodeId.of("node-2"), "http://node2:8081"));
 * HttpSyncTransport transport = new HttpSyncTransport(config);
 * SyncDispatcher dispatcher = new SyncDispatcher(manager, transport, sink);
 * dispatcher.attach();
 * transport.onSendFailure(dispatcher::reportFailure);
 * transport.start();
 * // ... on shutdown
 * transport.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpSyncTransport implements SyncTransport {

  /** Logger for this class. */
  private static final Logger log =
      LoggerFactory.getLogger(HttpSyncTransport.class);

  /** HTTP 200 OK status code. */
  private static final int HTTP_OK = 200;

  /** HTTP 400 Bad Request status code. */
  private static final int HTTP_BAD_REQUEST = 400;

  /** HTTP 405 Method Not Allowed status code. */
  private static final int HTTP_METHOD_NOT_ALLOWED = 405;

  /** The delay in seconds before stopping the HTTP server. */
  private static final int SERVER_STOP_DELAY_SECONDS = 1;

  /** The configuration for this transport. */
  private final HttpSyncConfig config;

  /** The list of registered message listeners. */
  private final List<SyncMessageListener> listeners =
      new CopyOnWriteArrayList<>();

  /** Called when an outbound message cannot be delivered. */
  private volatile BiConsumer<NodeId, Throwable> failureHandler =
      (peer, cause) -> { };

  /** The HTTP server for receiving incoming messages. */
  private HttpServer server;

  /** The HTTP client for sending messages to peers. */
  private HttpClient client;

  /**
   * Creates a new HTTP transport with the given configuration.
   *
   * @param config the HTTP transport configuration, never null
   */
  public HttpSyncTransport(final HttpSyncConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  /**
   * Registers the handler notified when a message cannot be delivered.
   *
   * @param handler the handler, receives the peer and the failure, never
   *                null
   */
  public void onSendFailure(final BiConsumer<NodeId, Throwable> handler) {
    failureHandler = Objects.requireNonNull(handler,
        "handler cannot be null");
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the target has no configured URL
   * @throws IllegalStateException    if the transport was not started
   */
  @Override
  public void send(final NodeId target, final SyncMessage message) {
    Objects.requireNonNull(target, "target cannot be null");
    Objects.requireNonNull(message, "message cannot be null");

    final String peerUrl = config.peerUrls().get(target);
    if (peerUrl == null) {
      throw new IllegalArgumentException("Unknown peer: " + target);
    }
    if (client == null) {
      throw new IllegalStateException("Transport is not started");
    }

    final String url = peerUrl + config.path();
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(
            SyncMessageCodec.serialize(message)))
        .build();

    client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .thenAccept(response -> {
          if (response.statusCode() != HTTP_OK) {
            log.warn("Peer {} at {} responded with status {}", target, url,
                response.statusCode());
            failureHandler.accept(target, new IOException("Peer " + target
                + " responded with status " + response.statusCode()));
          }
        })
        .exceptionally(ex -> {
          log.warn("Failed to send {} to {} at {}", message.type(), target,
              url, ex);
          failureHandler.accept(target, ex);
          return null;
        });
  }

  /** {@inheritDoc} */
  @Override
  public void subscribe(final SyncMessageListener listener) {
    Objects.requireNonNull(listener, "listener cannot be null");
    listeners.add(listener);
  }

  /** {@inheritDoc} */
  @Override
  public void start() {
    try {
      server = HttpServer.create(
          new InetSocketAddress(config.port()), 0
      );
      server.createContext(config.path(), this::handleMessage);
      server.start();

      client = HttpClient.newHttpClient();

      log.info("HttpSyncTransport started on port {} at path {}",
          config.port(), config.path());
    } catch (final IOException e) {
      throw new IllegalStateException(
          "Failed to start HTTP server on port " + config.port(), e
      );
    }
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    if (server != null) {
      server.stop(SERVER_STOP_DELAY_SECONDS);
      log.info("HTTP server stopped");
    }
    client = null;
  }

  /**
   * Handles an incoming HTTP request on the message endpoint.
   *
   * <p>Only POST requests are accepted. The body must be a JSON message as
   * produced by {@link SyncMessageCodec}; anything else is rejected with a
   * 400 and no listener is notified.
   *
   * @param exchange the HTTP exchange, never null
   * @throws IOException if reading the request body or sending the
   *     response fails
   */
  private void handleMessage(final HttpExchange exchange) throws IOException {
    if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      sendResponse(exchange, HTTP_METHOD_NOT_ALLOWED, "Method Not Allowed");
      return;
    }

    final SyncMessage message;
    try (InputStream is = exchange.getRequestBody()) {
      final String body = new String(
          is.readAllBytes(), StandardCharsets.UTF_8
      );
      message = SyncMessageCodec.deserialize(body);
    } catch (final IllegalArgumentException e) {
      log.warn("Rejected malformed sync message: {}", e.getMessage());
      sendResponse(exchange, HTTP_BAD_REQUEST, "Bad Request");
      return;
    }

    sendResponse(exchange, HTTP_OK, "OK");

    for (final SyncMessageListener listener : listeners) {
      try {
        listener.onMessage(message);
      } catch (final RuntimeException e) {
        log.warn("Listener threw exception for {} from {}", message.type(),
            message.fromNode(), e);
      }
    }
  }

  /**
   * Sends an HTTP response with the given status code and body.
   *
   * @param exchange   the HTTP exchange
   * @param statusCode the HTTP status code
   * @param body       the response body text
   * @throws IOException if writing the response fails
   */
  private void sendResponse(final HttpExchange exchange,
      final int statusCode, final String body) throws IOException {
    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
