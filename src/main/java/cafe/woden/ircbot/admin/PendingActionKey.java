package cafe.woden.ircbot.admin;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Identity of one pending scheduled action. At most one timer exists per key.
 *
 * @param parameter mode argument, usually a mask; empty for parameterless modes
 * @param channel channel the mode applies to
 * @param modeSpec sign plus one mode letter, e.g. {@code "-q"}
 */
@ValueObject
public record PendingActionKey(String parameter, String channel, String modeSpec) {
  public PendingActionKey {
    parameter = Objects.toString(parameter, "");
    channel = Objects.requireNonNull(channel, "channel");
    modeSpec = Objects.requireNonNull(modeSpec, "modeSpec").trim();
    if (modeSpec.length() != 2 || (modeSpec.charAt(0) != '+' && modeSpec.charAt(0) != '-')) {
      throw new IllegalArgumentException("mode must be a sign plus one letter: " + modeSpec);
    }
  }
}
