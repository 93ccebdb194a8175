package io.hookbox.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for hookbox worker and poller pools.
 *
 * <p>Threads are daemons numbered from 1 after the given prefix
 * ({@code hookbox-worker-1}, {@code hookbox-worker-2}, ...). An exception that
 * escapes a thread is logged at SEVERE instead of going to stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, error) ->
      logger.log(Level.SEVERE, "Uncaught exception in " + thread.getName(), error);

  private final String namePrefix;
  private final AtomicInteger sequence = new AtomicInteger();

  public DaemonThreadFactory(String namePrefix) {
    this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread thread = new Thread(task, namePrefix + sequence.incrementAndGet());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(LOG_UNCAUGHT);
    return thread;
  }
}
