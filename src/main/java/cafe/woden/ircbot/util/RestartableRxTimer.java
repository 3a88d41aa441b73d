package cafe.woden.ircbot.util;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A one-shot timer with restart/stop semantics on top of RxJava.
 *
 * <p>Used for the per-channel topic query timeout. Not thread-safe: callers own it from the event
 * loop.
 */
public final class RestartableRxTimer implements AutoCloseable {
  private final Scheduler scheduler;
  private final Consumer<Throwable> onError;
  private Disposable current;

  public RestartableRxTimer(Scheduler scheduler, Consumer<Throwable> onError) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.onError = Objects.requireNonNull(onError, "onError");
  }

  public void restart(long delay, TimeUnit unit, Runnable action) {
    stop();
    if (action == null) return;
    current = Completable.timer(delay, unit, scheduler).subscribe(action::run, onError::accept);
  }

  public boolean isRunning() {
    return current != null && !current.isDisposed();
  }

  public void stop() {
    Disposable prev = current;
    current = null;
    if (prev != null && !prev.isDisposed()) {
      prev.dispose();
    }
  }

  @Override
  public void close() {
    stop();
  }
}
