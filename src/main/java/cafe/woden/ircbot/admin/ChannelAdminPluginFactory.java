package cafe.woden.ircbot.admin;

import cafe.woden.ircbot.config.EventLoopConfig;
import cafe.woden.ircbot.plugin.BotPlugin;
import cafe.woden.ircbot.plugin.PluginFactory;
import cafe.woden.ircbot.plugin.PluginRegistry;
import cafe.woden.ircbot.transport.Transport;
import io.reactivex.rxjava3.core.Scheduler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class ChannelAdminPluginFactory implements PluginFactory {

  private final Scheduler scheduler;

  public ChannelAdminPluginFactory(
      @Qualifier(EventLoopConfig.EVENT_LOOP_SCHEDULER) Scheduler scheduler) {
    this.scheduler = scheduler;
  }

  @Override
  public String pluginName() {
    return ChannelAdminPlugin.NAME;
  }

  @Override
  public BotPlugin create(String name, Transport transport, PluginRegistry registry) {
    return new ChannelAdminPlugin(name, transport, registry, scheduler);
  }
}
