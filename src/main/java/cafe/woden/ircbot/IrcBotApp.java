package cafe.woden.ircbot;

import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.config.EventLoopConfig;
import cafe.woden.ircbot.plugin.PluginRegistry;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(BotProperties.class)
public class IrcBotApp {
  private static final Logger log = LoggerFactory.getLogger(IrcBotApp.class);

  public static void main(String[] args) {
    SpringApplication.run(IrcBotApp.class, args);
  }

  /** Loads the configured plugins on the event loop once the context is up. */
  @Bean
  public ApplicationRunner loadPlugins(
      PluginRegistry registry,
      @Qualifier(EventLoopConfig.EVENT_LOOP_SCHEDULER) Scheduler eventLoop) {
    return args ->
        eventLoop.scheduleDirect(
            () -> {
              List<String> failed = registry.loadAll();
              if (failed.isEmpty()) {
                log.info("[ircbot] Plugins loaded: {}", registry.loadedPlugins());
              } else {
                log.warn(
                    "[ircbot] Plugins loaded: {}; failed: {}", registry.loadedPlugins(), failed);
              }
            });
  }
}
