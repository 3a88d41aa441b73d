package cafe.woden.ircbot.irc;

import java.util.Objects;

/** Small helpers for {@code nick!user@host} masks and extended bans. */
public final class Hostmasks {

  private Hostmasks() {}

  /** True for a full mask ({@code !} and {@code @} present) or an extban ({@code $...}). */
  public static boolean isMaskOrExtban(String target) {
    String t = Objects.toString(target, "").trim();
    return (t.indexOf('!') >= 0 && t.indexOf('@') >= 0) || t.startsWith("$");
  }

  /** True if the text contains none of the mask delimiters, i.e. it can only be a nick. */
  public static boolean isPlainNick(String target) {
    String t = Objects.toString(target, "").trim();
    return !t.isEmpty() && t.indexOf('!') < 0 && t.indexOf('@') < 0 && t.indexOf('$') < 0;
  }

  /** The part before {@code !}, or the whole text if there is none. */
  public static String nickPart(String mask) {
    String m = Objects.toString(mask, "").trim();
    int bang = m.indexOf('!');
    return (bang < 0) ? m : m.substring(0, bang);
  }

  public static boolean hasWildcard(String text) {
    String t = Objects.toString(text, "");
    return t.indexOf('*') >= 0 || t.indexOf('?') >= 0;
  }
}
