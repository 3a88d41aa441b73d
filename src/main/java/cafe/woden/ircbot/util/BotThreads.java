package cafe.woden.ircbot.util;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating named, app-owned threads and executors. */
public final class BotThreads {

  private BotThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger seq = new AtomicInteger(1);
    return r -> {
      Thread t = new Thread(r, base + "-" + seq.getAndIncrement());
      t.setDaemon(false);
      return t;
    };
  }

  /**
   * The bot event loop: every event delivery, request handler and timer callback runs on this one
   * thread.
   */
  public static ScheduledExecutorService newEventLoop(String baseName) {
    return Executors.newSingleThreadScheduledExecutor(namedFactory(baseName));
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "ircbot-thread" : s;
  }
}
