package io.agenthive.process;

import io.agenthive.ipc.IpcMessage;
import io.agenthive.ipc.IpcProtocolException;

@FunctionalInterface
public interface IpcMessageListener {

  void onMessage(IpcMessage message);

  default void onProtocolError(IpcProtocolException error) {
  }
}
