package io.agenthive.controlplane.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ControlPlaneTransport} over the JDK WebSocket client, one JSON document per text frame.
 */
public final class WebSocketControlPlaneTransport implements ControlPlaneTransport {

  private static final Logger log = LoggerFactory.getLogger(WebSocketControlPlaneTransport.class);
  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient http;
  private final Duration connectTimeout;

  public WebSocketControlPlaneTransport() {
    this(DEFAULT_CONNECT_TIMEOUT);
  }

  public WebSocketControlPlaneTransport(Duration connectTimeout) {
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    this.http = HttpClient.newBuilder()
        .connectTimeout(connectTimeout)
        .build();
  }

  @Override
  public ControlPlaneSession open(URI uri, String token, SessionListener listener) throws IOException {
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(listener, "listener");
    FrameAssembler assembler = new FrameAssembler(listener);
    CompletableFuture<WebSocket> connecting = http.newWebSocketBuilder()
        .connectTimeout(connectTimeout)
        .header("Authorization", "Bearer " + token)
        .buildAsync(uri, assembler);
    WebSocket socket;
    try {
      socket = connecting.get(connectTimeout.toMillis() + 1_000L, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      connecting.cancel(true);
      throw new IOException("Interrupted while connecting to " + uri, ex);
    } catch (ExecutionException ex) {
      throw new IOException("Failed to connect to " + uri + ": " + ex.getCause().getMessage(), ex.getCause());
    } catch (TimeoutException ex) {
      connecting.cancel(true);
      throw new IOException("Timed out connecting to " + uri, ex);
    }
    log.debug("WebSocket session to {} established", uri);
    WebSocketSession session = new WebSocketSession(socket);
    assembler.bind(session);
    return session;
  }

  private static final class WebSocketSession implements ControlPlaneSession {

    private final WebSocket socket;
    private final AtomicBoolean closedLocally = new AtomicBoolean();
    private CompletableFuture<Void> sendChain = CompletableFuture.completedFuture(null);

    private WebSocketSession(WebSocket socket) {
      this.socket = socket;
    }

    @Override
    public synchronized CompletableFuture<Void> send(String frame) {
      // WebSocket forbids overlapping sends, so each frame waits for the previous one
      CompletableFuture<Void> next = sendChain
          .exceptionally(error -> null)
          .thenCompose(ignored -> socket.sendText(frame, true))
          .thenApply(ws -> null);
      sendChain = next;
      return next;
    }

    @Override
    public boolean isOpen() {
      return !closedLocally.get() && !socket.isOutputClosed() && !socket.isInputClosed();
    }

    @Override
    public void close() {
      if (!closedLocally.compareAndSet(false, true)) {
        return;
      }
      CompletableFuture<Void> pending;
      synchronized (this) {
        pending = sendChain;
      }
      pending.exceptionally(error -> null)
          .thenCompose(ignored -> socket.sendClose(WebSocket.NORMAL_CLOSURE, "worker closing"))
          .whenComplete((ws, error) -> {
            if (error != null) {
              log.debug("Close handshake failed: {}", error.getMessage());
              socket.abort();
            }
          });
    }

    private boolean closedLocally() {
      return closedLocally.get();
    }
  }

  private static final class FrameAssembler implements WebSocket.Listener {

    private final SessionListener listener;
    private final StringBuilder partial = new StringBuilder();
    private volatile WebSocketSession session;

    private FrameAssembler(SessionListener listener) {
      this.listener = listener;
    }

    private void bind(WebSocketSession session) {
      this.session = session;
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      partial.append(data);
      if (last) {
        String frame = partial.toString();
        partial.setLength(0);
        listener.onFrame(frame);
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      WebSocketSession current = session;
      if (current == null || !current.closedLocally()) {
        listener.onClosed(statusCode, reason);
      }
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      WebSocketSession current = session;
      if (current == null || !current.closedLocally()) {
        listener.onError(error);
      }
    }
  }
}
