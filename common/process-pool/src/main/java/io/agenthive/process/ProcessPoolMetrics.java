package io.agenthive.process;

/**
 * Metrics sink for pool activity.
 */
public interface ProcessPoolMetrics {

  void processSpawned(boolean withJob);

  void jobStarted();

  void processFailed(JobProcessFailure failure);

  void processClosed();

  void updatePoolSize(int idle, int running);

  void close();

  static ProcessPoolMetrics noop() {
    return new ProcessPoolMetrics() {
      @Override
      public void processSpawned(boolean withJob) {
      }

      @Override
      public void jobStarted() {
      }

      @Override
      public void processFailed(JobProcessFailure failure) {
      }

      @Override
      public void processClosed() {
      }

      @Override
      public void updatePoolSize(int idle, int running) {
      }

      @Override
      public void close() {
      }
    };
  }
}
