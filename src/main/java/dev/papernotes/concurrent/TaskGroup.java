package dev.papernotes.concurrent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * Structured fan-out/join over an {@link AsyncTaskExecutor}.
 *
 * <p>Subtasks are forked onto the executor and {@link #join()} waits for all of them. A failing
 * subtask does not affect its siblings: its exception is kept on its {@link Subtask}. If the
 * joining thread is interrupted every unfinished subtask is cancelled with interruption before the
 * {@link InterruptedException} is rethrown. When a deadline is set, subtasks still running once it
 * passes are cancelled and report a {@link TimeoutException} as their failure.
 *
 * <p>A group is used by a single orchestrating thread and joined once.
 */
public final class TaskGroup {

  private final AsyncTaskExecutor executor;
  private final Clock clock;
  private final @Nullable Instant deadline;
  private final List<Subtask<?>> subtasks = new ArrayList<>();
  private boolean joined;

  public TaskGroup(AsyncTaskExecutor executor, Clock clock, @Nullable Instant deadline) {
    this.executor = executor;
    this.clock = clock;
    this.deadline = deadline;
  }

  /** Computes the absolute deadline for a run starting now, or null when no budget is given. */
  public static @Nullable Instant deadlineFrom(Clock clock, @Nullable Duration budget) {
    return budget == null ? null : clock.instant().plus(budget);
  }

  /**
   * Forks a subtask.
   *
   * @param name label used in failure reporting
   * @param task the work to run
   * @return handle to the subtask's outcome, readable after {@link #join()}
   */
  public <T> Subtask<T> fork(String name, Callable<T> task) {
    if (joined) {
      throw new IllegalStateException("TaskGroup already joined");
    }
    Subtask<T> subtask = new Subtask<>(name, executor.submit(task));
    subtasks.add(subtask);
    return subtask;
  }

  /**
   * Waits for every forked subtask to complete, fail or be cancelled.
   *
   * @throws InterruptedException if the joining thread was interrupted; all subtasks are cancelled
   */
  public void join() throws InterruptedException {
    joined = true;
    try {
      for (Subtask<?> subtask : subtasks) {
        subtask.await(this);
      }
    } catch (InterruptedException e) {
      cancelAll();
      throw e;
    }
  }

  /** Cancels every unfinished subtask, interrupting running ones. */
  public void cancelAll() {
    for (Subtask<?> subtask : subtasks) {
      subtask.future.cancel(true);
    }
  }

  private long remainingNanos() {
    if (deadline == null) {
      return Long.MAX_VALUE;
    }
    return Math.max(0L, Duration.between(clock.instant(), deadline).toNanos());
  }

  /**
   * Outcome of one forked task.
   *
   * @param <T> result type
   */
  public static final class Subtask<T> {

    private final String name;
    private final Future<T> future;
    private @Nullable T result;
    private @Nullable Throwable failure;
    private boolean done;

    private Subtask(String name, Future<T> future) {
      this.name = name;
      this.future = future;
    }

    private void await(TaskGroup group) throws InterruptedException {
      try {
        long remaining = group.remainingNanos();
        result =
            remaining == Long.MAX_VALUE
                ? future.get()
                : future.get(remaining, TimeUnit.NANOSECONDS);
      } catch (ExecutionException e) {
        failure = e.getCause() != null ? e.getCause() : e;
      } catch (TimeoutException e) {
        future.cancel(true);
        failure = e;
      } catch (CancellationException e) {
        failure = e;
      } finally {
        done = true;
      }
    }

    public String name() {
      return name;
    }

    /** The task's result, empty if it failed, was cancelled or returned null. */
    public Optional<T> result() {
      requireJoined();
      return Optional.ofNullable(result);
    }

    /** The failure cause, or null on success. */
    public @Nullable Throwable failure() {
      requireJoined();
      return failure;
    }

    public boolean succeeded() {
      requireJoined();
      return failure == null;
    }

    private void requireJoined() {
      if (!done) {
        throw new IllegalStateException("Subtask '" + name + "' read before join");
      }
    }
  }
}
