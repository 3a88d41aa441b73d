package cafe.woden.ircbot.plugin;

import java.util.Objects;
import java.util.function.Consumer;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Where a chat command came from and how to answer it.
 *
 * @param channel channel the command was issued in
 * @param user full {@code nick!user@host} of the issuer
 * @param replySink delivers a reply line back to the issuer
 */
@ValueObject
public record CommandContext(String channel, String user, Consumer<String> replySink) {
  public CommandContext {
    channel = Objects.requireNonNull(channel, "channel").trim();
    user = Objects.toString(user, "").trim();
    Objects.requireNonNull(replySink, "replySink");
  }

  /** The issuer's nick, i.e. the part of {@link #user()} before {@code !}. */
  public String nick() {
    int bang = user.indexOf('!');
    return (bang < 0) ? user : user.substring(0, bang);
  }

  public void reply(String message) {
    replySink.accept(message);
  }
}
