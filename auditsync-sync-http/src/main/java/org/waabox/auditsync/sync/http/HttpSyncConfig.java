package org.waabox.auditsync.sync.http;

import java.util.Map;
import java.util.Objects;

import org.waabox.auditsync.NodeId;

/**
 * Configuration holder for the HTTP transport.
 *
 * <p>Holds the port to listen on, the base URL of every peer node, and the
 * HTTP path where synchronization messages are exchanged.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpSyncConfig {

  /** The default HTTP path for synchronization messages. */
  private static final String DEFAULT_PATH = "/auditsync/messages";

  /** The port to listen on for incoming messages. */
  private final int port;

  /** The base URLs of the peer nodes, keyed by node id. */
  private final Map<NodeId, String> peerUrls;

  /** The HTTP path for the message endpoint. */
  private final String path;

  /** Private constructor; use the static factory methods instead. */
  private HttpSyncConfig(final int port, final Map<NodeId, String> peerUrls,
      final String path) {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
    Objects.requireNonNull(peerUrls, "peerUrls cannot be null");
    Objects.requireNonNull(path, "path cannot be null");
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/': " + path);
    }
    this.port = port;
    this.peerUrls = Map.copyOf(peerUrls);
    this.path = path;
  }

  /**
   * Creates a new configuration with the given port and peer URLs, using
   * the default path ({@value #DEFAULT_PATH}).
   *
   * @param port     the port to listen on
   * @param peerUrls the base URL of each peer node, never null
   * @return a new {@link HttpSyncConfig} instance, never null
   */
  public static HttpSyncConfig create(final int port,
      final Map<NodeId, String> peerUrls) {
    return new HttpSyncConfig(port, peerUrls, DEFAULT_PATH);
  }

  /**
   * Creates a new configuration with the given port, peer URLs, and path.
   *
   * @param port     the port to listen on
   * @param peerUrls the base URL of each peer node, never null
   * @param path     the HTTP path for the message endpoint, never null
   * @return a new {@link HttpSyncConfig} instance, never null
   */
  public static HttpSyncConfig create(final int port,
      final Map<NodeId, String> peerUrls, final String path) {
    return new HttpSyncConfig(port, peerUrls, path);
  }

  /**
   * Returns the port to listen on.
   *
   * @return the listening port
   */
  public int port() {
    return port;
  }

  /**
   * Returns an unmodifiable map of peer base URLs.
   *
   * @return the peer URLs keyed by node id, never null
   */
  public Map<NodeId, String> peerUrls() {
    return peerUrls;
  }

  /**
   * Returns the HTTP path for the message endpoint.
   *
   * @return the path, never null
   */
  public String path() {
    return path;
  }
}
