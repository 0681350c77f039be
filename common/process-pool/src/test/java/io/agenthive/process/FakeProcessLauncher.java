package io.agenthive.process;

import io.agenthive.ipc.IpcMessage;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory launcher whose processes answer the IPC protocol according to simple switches.
 */
final class FakeProcessLauncher implements ProcessLauncher {

  final List<FakeProcess> launched = new CopyOnWriteArrayList<>();
  private final AtomicLong pids = new AtomicLong(1000);

  volatile boolean failLaunches;
  volatile boolean answerPings = true;
  volatile boolean acceptJobs = true;
  volatile boolean exitOnShutdown = true;

  @Override
  public JobProcessHandle launch(ProcessLaunchSpec spec, IpcMessageListener listener) {
    if (failLaunches) {
      throw new ProcessLaunchException("launcher broken");
    }
    FakeProcess process = new FakeProcess(spec, listener, pids.incrementAndGet());
    launched.add(process);
    if (acceptJobs && spec.runningJob() != null) {
      CompletableFuture.runAsync(() -> process.emit(IpcMessage.StartJobResponse.success()));
    }
    return process;
  }

  FakeProcess get(int index) {
    return launched.get(index);
  }

  final class FakeProcess implements JobProcessHandle {

    final ProcessLaunchSpec spec;
    final List<IpcMessage> received = new CopyOnWriteArrayList<>();
    private final IpcMessageListener listener;
    private final long pid;
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    volatile boolean killed;

    private FakeProcess(ProcessLaunchSpec spec, IpcMessageListener listener, long pid) {
      this.spec = spec;
      this.listener = listener;
      this.pid = pid;
    }

    void emit(IpcMessage message) {
      listener.onMessage(message);
    }

    void exit(int code) {
      exit.complete(code);
    }

    <T extends IpcMessage> List<T> receivedOf(Class<T> type) {
      return received.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Override
    public long pid() {
      return pid;
    }

    @Override
    public boolean send(IpcMessage message) {
      if (exit.isDone()) {
        return false;
      }
      received.add(message);
      if (message instanceof IpcMessage.Ping ping && answerPings) {
        CompletableFuture.runAsync(() -> emit(new IpcMessage.Pong(ping.timestamp(), ping.timestamp())));
      } else if (message instanceof IpcMessage.StartJobRequest && acceptJobs) {
        CompletableFuture.runAsync(() -> emit(IpcMessage.StartJobResponse.success()));
      } else if (message instanceof IpcMessage.ShutdownRequest && exitOnShutdown) {
        CompletableFuture.runAsync(() -> {
          emit(new IpcMessage.ShutdownResponse());
          exit(0);
        });
      }
      return true;
    }

    @Override
    public void kill() {
      killed = true;
      exit.complete(137);
    }

    @Override
    public boolean isAlive() {
      return !exit.isDone();
    }

    @Override
    public CompletableFuture<Integer> onExit() {
      return exit;
    }
  }
}
