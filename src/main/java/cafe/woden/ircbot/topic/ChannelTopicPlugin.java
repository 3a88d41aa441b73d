package cafe.woden.ircbot.topic;

import cafe.woden.ircbot.irc.IrcEvents;
import cafe.woden.ircbot.irc.OperationFailedException;
import cafe.woden.ircbot.plugin.AbstractBotPlugin;
import cafe.woden.ircbot.plugin.CommandContext;
import cafe.woden.ircbot.plugin.PluginRegistry;
import cafe.woden.ircbot.transport.BotEvent;
import cafe.woden.ircbot.transport.Transport;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Topic editing commands on top of a {@link TopicConsensus}.
 *
 * <p>Failures the issuer can act on are answered in the reply; the returned {@link Completable}
 * then completes normally.
 */
public class ChannelTopicPlugin extends AbstractBotPlugin {
  private static final Logger log = LoggerFactory.getLogger(ChannelTopicPlugin.class);

  public static final String NAME = "topic.ChannelTopic";

  private final TopicConsensus consensus;

  public ChannelTopicPlugin(
      String name, Transport transport, PluginRegistry registry, Scheduler scheduler) {
    super(name, transport, registry);
    this.consensus = new TopicConsensus(transport, scheduler);
  }

  @Override
  public List<String> requires() {
    return List.of("irc.ChanMode", "irc.OpProvider");
  }

  @Override
  protected void onStart() {
    onEvent(IrcEvents.TOPIC_UPDATED, this::onTopicUpdated);
  }

  @Override
  protected void onStop() {
    consensus.clear();
  }

  public TopicConsensus consensus() {
    return consensus;
  }

  private void onTopicUpdated(BotEvent event) {
    String channel = event.string("channel");
    if (channel == null || channel.isBlank()) {
      log.debug("[ircbot] topic.updated without a channel: {}", event);
      return;
    }
    consensus.onObservedTopic(channel, event.string("topic"));
  }

  public Completable append(CommandContext ctx, String text) {
    return answered(ctx, consensus.append(ctx.channel(), text));
  }

  public Completable insert(CommandContext ctx, int pos, String text) {
    return answered(ctx, consensus.insert(ctx.channel(), pos, text));
  }

  public Completable replace(CommandContext ctx, int pos, String text) {
    return answered(ctx, consensus.replace(ctx.channel(), pos, text));
  }

  public Completable remove(CommandContext ctx, int pos) {
    return answered(ctx, consensus.remove(ctx.channel(), pos));
  }

  public Completable pop(CommandContext ctx) {
    return answered(ctx, consensus.pop(ctx.channel()));
  }

  public Completable undo(CommandContext ctx) {
    return answered(ctx, consensus.undo(ctx.channel()));
  }

  private static Completable answered(CommandContext ctx, Completable work) {
    return work.onErrorResumeNext(
        err -> {
          if (err instanceof TopicUnavailableException) {
            ctx.reply("Could not determine current topic");
          } else if (err instanceof TopicPositionException
              || err instanceof NothingToUndoException) {
            ctx.reply(err.getMessage());
          } else if (err instanceof OperationFailedException) {
            ctx.reply("Channel is +t and I can't acquire op! Reason: " + err.getMessage());
          } else {
            return Completable.error(err);
          }
          return Completable.complete();
        });
  }
}
