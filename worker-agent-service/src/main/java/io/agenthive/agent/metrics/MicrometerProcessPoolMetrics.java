package io.agenthive.agent.metrics;

import io.agenthive.process.JobProcessFailure;
import io.agenthive.process.ProcessPoolMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

public final class MicrometerProcessPoolMetrics implements ProcessPoolMetrics {

  private final MeterRegistry meterRegistry;
  private final Tags tags;

  private final AtomicInteger idleValue = new AtomicInteger(0);
  private final AtomicInteger runningValue = new AtomicInteger(0);

  private final Counter spawnedIdle;
  private final Counter spawnedWithJob;
  private final Counter jobsStarted;
  private final Counter closed;

  private Gauge idleGauge;
  private Gauge runningGauge;

  public MicrometerProcessPoolMetrics(MeterRegistry meterRegistry, Tags tags) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.tags = Objects.requireNonNull(tags, "tags");
    this.spawnedIdle = spawnedCounter("idle");
    this.spawnedWithJob = spawnedCounter("job");
    this.jobsStarted = Counter.builder("agenthive_process_jobs_started")
        .description("Jobs that reported a successful start")
        .tags(tags)
        .register(meterRegistry);
    this.closed = Counter.builder("agenthive_process_closed")
        .description("Job processes that exited")
        .tags(tags)
        .register(meterRegistry);
    registerGauges();
  }

  private Counter spawnedCounter(String kind) {
    return Counter.builder("agenthive_process_spawned")
        .description("Job processes spawned, idle or straight into a job")
        .tags(tags)
        .tag("kind", kind)
        .register(meterRegistry);
  }

  private void registerGauges() {
    idleGauge = Gauge.builder("agenthive_process_idle", idleValue, AtomicInteger::doubleValue)
        .description("Warm processes waiting for a job")
        .tags(tags)
        .register(meterRegistry);
    runningGauge = Gauge.builder("agenthive_process_running", runningValue, AtomicInteger::doubleValue)
        .description("Processes owning a job")
        .tags(tags)
        .register(meterRegistry);
  }

  @Override
  public void processSpawned(boolean withJob) {
    (withJob ? spawnedWithJob : spawnedIdle).increment();
  }

  @Override
  public void jobStarted() {
    jobsStarted.increment();
  }

  @Override
  public void processFailed(JobProcessFailure failure) {
    Counter.builder("agenthive_process_failures")
        .description("Job process failures by reason")
        .tags(tags)
        .tag("reason", failure.tag())
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void processClosed() {
    closed.increment();
  }

  @Override
  public void updatePoolSize(int idle, int running) {
    idleValue.set(idle);
    runningValue.set(running);
  }

  @Override
  public void close() {
    if (idleGauge != null) {
      meterRegistry.remove(idleGauge);
      idleGauge = null;
    }
    if (runningGauge != null) {
      meterRegistry.remove(runningGauge);
      runningGauge = null;
    }
  }
}
