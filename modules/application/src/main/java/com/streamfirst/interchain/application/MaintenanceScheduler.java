package com.streamfirst.interchain.application;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Background loop running {@link BufferMaintenance#run()} at a fixed delay. A failed cycle is
 * logged and counted; the loop keeps going and the next cycle retries.
 */
@Slf4j
public class MaintenanceScheduler implements AutoCloseable {

  private final BufferMaintenance<?> maintenance;
  private final Duration interval;
  private final ScheduledExecutorService executor;
  private ScheduledFuture<?> task;

  public MaintenanceScheduler(@NonNull BufferMaintenance<?> maintenance, @NonNull Duration interval) {
    this.maintenance = maintenance;
    this.interval = interval;
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "buffer-maintenance");
              thread.setDaemon(true);
              return thread;
            });
  }

  public synchronized void start() {
    if (task != null) {
      throw new IllegalStateException("Maintenance loop already started");
    }
    log.info("Starting buffer maintenance every {} ms", interval.toMillis());
    task =
        executor.scheduleWithFixedDelay(
            this::runOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  public synchronized boolean isRunning() {
    return task != null && !task.isDone();
  }

  /** Runs one cycle, never throwing; used by the loop. */
  void runOnce() {
    try {
      maintenance.run();
    } catch (RuntimeException e) {
      maintenance.recordFailure();
      log.error("Buffer maintenance failed", e);
    }
  }

  @Override
  public synchronized void close() {
    if (task != null) {
      task.cancel(false);
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(interval.toMillis() * 10, TimeUnit.MILLISECONDS)) {
        log.warn("Maintenance cycle still running after shutdown request");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    log.info("Buffer maintenance stopped");
  }
}
