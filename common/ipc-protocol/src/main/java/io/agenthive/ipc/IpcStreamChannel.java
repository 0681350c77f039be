package io.agenthive.ipc;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Newline-delimited framing of {@link IpcMessage}s over a pair of byte streams.
 *
 * <p>Writes are serialised, so the channel can be shared by a timer thread and a reader thread.
 * Reads are expected from a single thread.</p>
 */
public final class IpcStreamChannel implements Closeable {

  private final IpcMessageCodec codec;
  private final BufferedReader reader;
  private final Writer writer;
  private final Object writeLock = new Object();

  public IpcStreamChannel(InputStream in, OutputStream out, IpcMessageCodec codec) {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(out, "out");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
  }

  public void send(IpcMessage message) throws IOException {
    String frame = codec.encode(message);
    synchronized (writeLock) {
      writer.write(frame);
      writer.write('\n');
      writer.flush();
    }
  }

  /**
   * Blocks until the next frame arrives.
   *
   * @return the decoded message, or empty once the peer closed its end
   * @throws IpcProtocolException if the frame is not a valid message; the channel stays usable
   */
  public Optional<IpcMessage> receive() throws IOException {
    String line;
    do {
      line = reader.readLine();
      if (line == null) {
        return Optional.empty();
      }
    } while (line.isBlank());
    return Optional.of(codec.decode(line));
  }

  @Override
  public void close() throws IOException {
    IOException failure = null;
    try {
      synchronized (writeLock) {
        writer.close();
      }
    } catch (IOException ex) {
      failure = ex;
    }
    try {
      reader.close();
    } catch (IOException ex) {
      if (failure == null) {
        failure = ex;
      } else {
        failure.addSuppressed(ex);
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
