package cafe.woden.ircbot.irc;

import cafe.woden.ircbot.transport.BotEvent;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A single observed channel mode change, e.g. {@code -q x!*@*} on {@code #a}. */
@ValueObject
public record ModeChange(String channel, char mode, boolean set, String arg) {
  public ModeChange {
    channel = Objects.toString(channel, "");
    arg = Objects.toString(arg, "");
  }

  public static ModeChange fromEvent(BotEvent event) {
    String letter = Objects.toString(event.string("mode"), "").trim();
    if (letter.length() != 1) {
      throw new IllegalArgumentException("mode.changed carries no single mode letter: " + letter);
    }
    return new ModeChange(
        event.string("channel"), letter.charAt(0), event.flag("set"), event.string("arg"));
  }

  /** Sign plus letter, e.g. {@code "+b"}. */
  public String modeSpec() {
    return (set ? "+" : "-") + mode;
  }
}
