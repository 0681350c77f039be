package io.agenthive.ipc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class IpcStreamChannelTest {

  private final IpcMessageCodec codec = new IpcMessageCodec();

  @Test
  void framesAreNewlineDelimited() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    IpcStreamChannel channel = new IpcStreamChannel(new ByteArrayInputStream(new byte[0]), out, codec);

    channel.send(new IpcMessage.Ping(5L));
    channel.send(new IpcMessage.ShutdownRequest(null));

    String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
    assertThat(lines).hasSize(2);
    assertThat(codec.decode(lines[0])).isEqualTo(new IpcMessage.Ping(5L));
    assertThat(codec.decode(lines[1])).isEqualTo(new IpcMessage.ShutdownRequest(null));
  }

  @Test
  void receivesAcrossPipeAndReportsEndOfStream() throws Exception {
    PipedOutputStream writerEnd = new PipedOutputStream();
    PipedInputStream readerEnd = new PipedInputStream(writerEnd, 4096);
    IpcStreamChannel sender = new IpcStreamChannel(new ByteArrayInputStream(new byte[0]), writerEnd, codec);
    IpcStreamChannel receiver = new IpcStreamChannel(readerEnd, new ByteArrayOutputStream(), codec);

    sender.send(new IpcMessage.Pong(1L, 2L));
    sender.send(new IpcMessage.UserExit("done"));
    sender.close();

    assertThat(receiver.receive()).contains(new IpcMessage.Pong(1L, 2L));
    assertThat(receiver.receive()).contains(new IpcMessage.UserExit("done"));
    assertThat(receiver.receive()).isEmpty();
  }

  @Test
  void malformedFrameDoesNotPoisonTheChannel() throws Exception {
    byte[] input = "garbage\n\n{\"type\":\"shutdownResponse\"}\n".getBytes(StandardCharsets.UTF_8);
    IpcStreamChannel channel = new IpcStreamChannel(new ByteArrayInputStream(input), new ByteArrayOutputStream(), codec);

    assertThatThrownBy(channel::receive).isInstanceOf(IpcProtocolException.class);
    assertThat(channel.receive()).contains(new IpcMessage.ShutdownResponse());
    assertThat(channel.receive()).isEmpty();
  }
}
