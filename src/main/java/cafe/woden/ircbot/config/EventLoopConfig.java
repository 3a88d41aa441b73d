package cafe.woden.ircbot.config;

import cafe.woden.ircbot.util.BotThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Owns the bot event loop.
 *
 * <p>Everything that mutates plugin state (event delivery, request handlers, timers) is confined to
 * the single thread behind {@link #EVENT_LOOP_SCHEDULER}, so the state tables need no locks.
 */
@Configuration
public class EventLoopConfig {
  public static final String EVENT_LOOP_EXECUTOR = "botEventLoopExecutor";
  public static final String EVENT_LOOP_SCHEDULER = "botEventLoopScheduler";

  @Bean(name = EVENT_LOOP_EXECUTOR, destroyMethod = "shutdownNow")
  public ScheduledExecutorService botEventLoopExecutor(BotProperties props) {
    return BotThreads.newEventLoop(props.eventLoopThreadName());
  }

  @Bean(name = EVENT_LOOP_SCHEDULER)
  public Scheduler botEventLoopScheduler(
      @Qualifier(EVENT_LOOP_EXECUTOR) ScheduledExecutorService executor) {
    return Schedulers.from(executor);
  }
}
