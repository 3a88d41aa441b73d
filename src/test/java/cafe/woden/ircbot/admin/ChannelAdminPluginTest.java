package cafe.woden.ircbot.admin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.config.MasterConfigStore;
import cafe.woden.ircbot.config.PluginConfig;
import cafe.woden.ircbot.irc.FakeIrcProvider;
import cafe.woden.ircbot.irc.IrcEvents;
import cafe.woden.ircbot.irc.IrcRequests;
import cafe.woden.ircbot.irc.OperationFailedException;
import cafe.woden.ircbot.irc.WhoisTimeoutException;
import cafe.woden.ircbot.plugin.CommandContext;
import cafe.woden.ircbot.plugin.PluginLoadException;
import cafe.woden.ircbot.plugin.PluginRegistry;
import cafe.woden.ircbot.plugin.TestPluginFactory;
import cafe.woden.ircbot.transport.BotRequest;
import cafe.woden.ircbot.transport.LocalTransport;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChannelAdminPluginTest {

  @TempDir Path tempDir;

  private final TestScheduler scheduler = new TestScheduler();
  private final LocalTransport transport = new LocalTransport();
  private final List<String> replies = new ArrayList<>();
  private final CommandContext ctx = new CommandContext("#a", "alice!al@example.org", replies::add);

  private PluginRegistry registry;
  private FakeIrcProvider irc;
  private ChannelAdminPlugin admin;

  @BeforeEach
  void setUp() {
    MasterConfigStore store =
        new MasterConfigStore(new BotProperties(tempDir.toString(), List.of(), null));
    registry =
        new PluginRegistry(
            transport,
            store,
            List.of(
                new TestPluginFactory(FakeIrcProvider.NAME, FakeIrcProvider::new),
                new TestPluginFactory(
                    ChannelAdminPlugin.NAME,
                    (n, t, r) -> new ChannelAdminPlugin(n, t, r, scheduler))));
    irc = (FakeIrcProvider) registry.load(FakeIrcProvider.NAME);
    irc.user("bob", "bobby", "unaffiliated/bob");
    admin = (ChannelAdminPlugin) registry.load(ChannelAdminPlugin.NAME);
  }

  @Test
  void quietResolvesTheHostAndLiftsItLater() {
    admin.quiet(ctx, "bob", "10m").test().assertComplete();

    List<BotRequest> quiets = irc.requests(IrcRequests.OP_QUIET);
    assertEquals(1, quiets.size());
    assertEquals("*!*@unaffiliated/bob", quiets.get(0).arg("target"));
    assertEquals(
        Set.of(new PendingActionKey("*!*@unaffiliated/bob", "#a", "-q")),
        admin.engine().pendingKeys());

    scheduler.advanceTimeBy(10, TimeUnit.MINUTES);

    List<BotRequest> unquiets = irc.requests(IrcRequests.OP_UNQUIET);
    assertEquals(1, unquiets.size());
    assertEquals("*!*@unaffiliated/bob", unquiets.get(0).arg("target"));
    assertTrue(admin.engine().persistedKeys().isEmpty());
  }

  @Test
  void quietOfUnknownNickExplainsHowToUseAMask() {
    admin.quiet(ctx, "nobody", null).test().assertComplete();

    assertEquals(
        List.of(
            "There is no user by that nick on the network. Try nobody!*@* to quiet anyone with"
                + " that nick, or specify a full hostmask."),
        replies);
    assertTrue(irc.requests(IrcRequests.OP_QUIET).isEmpty());
  }

  @Test
  void quietWithUnreadableTimeRepliesAndDoesNothing() {
    admin.quiet(ctx, "bob", "whenever you like").test().assertComplete();

    assertEquals(List.of(TimeSpecParser.NOT_UNDERSTOOD), replies);
    assertTrue(irc.requests.isEmpty());
  }

  @Test
  void whoisTimeoutIsReported() {
    irc.failing(IrcRequests.DIRECTORY_WHOIS, () -> new WhoisTimeoutException("bob"));

    admin.quiet(ctx, "bob", "5m").test().assertComplete();

    assertEquals(List.of("That's odd, the whois I did on bob didn't work. Sorry."), replies);
  }

  @Test
  void quietWithoutTimeFallsBackToTheConfiguredDefault() {
    PluginConfig cfg = registry.getPluginConfig(ChannelAdminPlugin.NAME);
    cfg.put(ChannelAdminPlugin.DEFAULT_TIME, 120);
    cfg.save();
    registry.reload(ChannelAdminPlugin.NAME);

    admin.quiet(ctx, "x!*@*", null).test().assertComplete();

    assertEquals(Set.of(new PendingActionKey("x!*@*", "#a", "-q")), admin.engine().pendingKeys());
    scheduler.advanceTimeBy(120, TimeUnit.SECONDS);
    assertEquals(1, irc.requests(IrcRequests.OP_UNQUIET).size());
  }

  @Test
  void observedUnquietCancelsThePendingReversal() {
    admin.quiet(ctx, "x!*@*", "1 hour").test().assertComplete();
    assertEquals(1, admin.engine().pendingKeys().size());

    transport.sendEvent(IrcEvents.modeChanged("#a", 'q', false, "x!*@*"));

    assertTrue(admin.engine().pendingKeys().isEmpty());
    assertTrue(admin.engine().persistedKeys().isEmpty());
    scheduler.advanceTimeBy(2, TimeUnit.HOURS);
    assertTrue(irc.requests(IrcRequests.OP_UNQUIET).isEmpty());
  }

  @Test
  void refusedQuietSchedulesNothing() {
    irc.failing(IrcRequests.OP_QUIET, () -> new OperationFailedException("I am not opped"));

    admin.quiet(ctx, "x!*@*", "10m").test().assertComplete();

    assertEquals(List.of("I am not opped"), replies);
    assertTrue(admin.engine().pendingKeys().isEmpty());
  }

  @Test
  void banOfANickKicksAndUsesUnreadableTimeAsReason() {
    admin.ban(ctx, "bob", "spamming links").test().assertComplete();

    assertEquals("*!*@unaffiliated/bob", irc.requests(IrcRequests.OP_BAN).get(0).arg("target"));
    BotRequest kick = irc.requests(IrcRequests.OP_KICK).get(0);
    assertEquals("bob", kick.arg("target"));
    assertEquals("spamming links", kick.arg("reason"));
    assertTrue(admin.engine().pendingKeys().isEmpty());
  }

  @Test
  void banOfAFullMaskKicksItsNickWithTheDefaultReason() {
    admin.ban(ctx, "bob!*@*", "1d").test().assertComplete();

    BotRequest kick = irc.requests(IrcRequests.OP_KICK).get(0);
    assertEquals("bob", kick.arg("target"));
    assertEquals("Banned by alice", kick.arg("reason"));
    assertEquals(Set.of(new PendingActionKey("bob!*@*", "#a", "-b")), admin.engine().pendingKeys());
  }

  @Test
  void banOfAWildcardMaskOrExtbanDoesNotKick() {
    admin.ban(ctx, "*!*@spam.example", null).test().assertComplete();
    admin.ban(ctx, "$a:spammer", null).test().assertComplete();

    assertEquals(2, irc.requests(IrcRequests.OP_BAN).size());
    assertTrue(irc.requests(IrcRequests.OP_KICK).isEmpty());
  }

  @Test
  void opFansOutAndReportsTheFirstFailureOnce() {
    irc.failing(IrcRequests.OP_OP, () -> new OperationFailedException("Cannot op"));

    admin.op(ctx, List.of("bob", "carol")).test().assertComplete();

    assertEquals(2, irc.requests(IrcRequests.OP_OP).size());
    assertEquals(List.of("Cannot op"), replies);
  }

  @Test
  void voiceWithoutNicksVoicesTheCaller() {
    admin.voice(ctx, List.of()).test().assertComplete();

    List<BotRequest> voices = irc.requests(IrcRequests.OP_VOICE);
    assertEquals(1, voices.size());
    assertEquals("alice", voices.get(0).arg("target"));
  }

  @Test
  void kickReportsRefusal() {
    irc.failing(IrcRequests.OP_KICK, () -> new OperationFailedException("bob is protected"));

    admin.kick(ctx, "bob", "bye").test().assertComplete();

    assertEquals(List.of("bob is protected"), replies);
  }

  @Test
  void delayedUnbanOnlySchedules() {
    admin.unban(ctx, "x!*@*", "in 5 minutes").test().assertComplete();

    assertEquals(List.of("It shall be done."), replies);
    assertTrue(irc.requests(IrcRequests.OP_UNBAN).isEmpty());

    scheduler.advanceTimeBy(5, TimeUnit.MINUTES);
    assertEquals(1, irc.requests(IrcRequests.OP_UNBAN).size());
  }

  @Test
  void immediateUnquietResolvesTheNick() {
    admin.unquiet(ctx, "bob", null).test().assertComplete();

    assertEquals(
        "*!*@unaffiliated/bob", irc.requests(IrcRequests.OP_UNQUIET).get(0).arg("target"));
    assertTrue(replies.isEmpty());
  }

  @Test
  void redirectBansTheUsernameForTwoHours() {
    admin.redirect(ctx, "bob", null).test().assertComplete();

    String mask = "*!bobby@*$##FIX_YOUR_CONNECTION";
    assertEquals(mask, irc.requests(IrcRequests.OP_BAN).get(0).arg("target"));
    assertEquals(
        "Redirected to ##FIX_YOUR_CONNECTION",
        irc.requests(IrcRequests.OP_KICK).get(0).arg("reason"));
    assertEquals(List.of("Redirected bob to ##FIX_YOUR_CONNECTION for 2 hours"), replies);

    scheduler.advanceTimeBy(2, TimeUnit.HOURS);
    assertEquals(mask, irc.requests(IrcRequests.OP_UNBAN).get(0).arg("target"));
  }

  @Test
  void redirectOfUnknownNickBansTheNick() {
    admin.redirect(ctx, "ghost", "#elsewhere").test().assertComplete();

    assertEquals("ghost!*@*$#elsewhere", irc.requests(IrcRequests.OP_BAN).get(0).arg("target"));
  }

  @Test
  void modeInTheFutureIsOnlyBooked() {
    admin.mode(ctx, "+v", "bob", "in 10 minutes").test().assertComplete();

    assertEquals(List.of("Doing a +v bob in 600 seconds"), replies);
    assertTrue(irc.requests.isEmpty());

    scheduler.advanceTimeBy(10, TimeUnit.MINUTES);
    assertEquals("bob", irc.requests(IrcRequests.OP_VOICE).get(0).arg("target"));
  }

  @Test
  void modeAfterADelayIsOnlyBooked() {
    admin.mode(ctx, "+v", "bob", "after 10 minutes").test().assertComplete();

    assertEquals(List.of("Doing a +v bob in 600 seconds"), replies);
    assertTrue(irc.requests.isEmpty());
    assertEquals(Set.of(new PendingActionKey("bob", "#a", "+v")), admin.engine().pendingKeys());
  }

  @Test
  void modeForADurationIsAppliedNowAndReversedLater() {
    admin.mode(ctx, "+m", null, "for 1 hour").test().assertComplete();

    assertEquals("+m", irc.requests(IrcRequests.OP_MODE).get(0).arg("mode"));
    assertEquals(Set.of(new PendingActionKey("", "#a", "-m")), admin.engine().pendingKeys());

    scheduler.advanceTimeBy(1, TimeUnit.HOURS);
    assertEquals("-m", irc.requests(IrcRequests.OP_MODE).get(1).arg("mode"));
  }

  @Test
  void moderatedTogglesAgainstTheCurrentChannelModes() {
    irc.channelModes("nt");
    admin.moderated(ctx).test().assertComplete();
    assertEquals("+m", irc.requests(IrcRequests.OP_MODE).get(0).arg("mode"));
    assertEquals("alice", irc.requests(IrcRequests.OP_OP).get(0).arg("target"));

    irc.channelModes("ntm");
    admin.moderated(ctx).test().assertComplete();
    assertEquals("-m", irc.requests(IrcRequests.OP_MODE).get(1).arg("mode"));
    assertEquals("alice", irc.requests(IrcRequests.OP_DEOP).get(0).arg("target"));
  }

  @Test
  void timedQuietRequestIsServedToOtherPlugins() {
    transport
        .issueRequest(
            BotRequest.of(
                ChannelAdminPlugin.TIMED_QUIET,
                "channel",
                "#a",
                "target",
                "bob",
                "duration",
                "5 minutes"))
        .test()
        .assertComplete();

    assertEquals(
        Set.of(new PendingActionKey("*!*@unaffiliated/bob", "#a", "-q")),
        admin.engine().pendingKeys());
  }

  @Test
  void timedQuietRejectsUnreadableDuration() {
    transport
        .issueRequest(
            BotRequest.of(
                ChannelAdminPlugin.TIMED_QUIET, "channel", "#a", "target", "bob", "duration", "??"))
        .test()
        .assertError(TimeSpecParseException.class);

    assertTrue(irc.requests(IrcRequests.OP_QUIET).isEmpty());
  }

  @Test
  void failedStartLeavesNoTimerBehind() throws Exception {
    registry.unload(ChannelAdminPlugin.NAME);
    // The duplicate makes resync rewrite the file; the directory in the way makes that fail.
    Files.writeString(
        tempDir.resolve("admin.ChannelAdmin.json"),
        "{\"laters\":[[5.0,\"x!*@*\",\"#a\",\"-q\"],[5.0,\"x!*@*\",\"#a\",\"-q\"]]}");
    Files.createDirectory(tempDir.resolve("admin.ChannelAdmin.json~"));

    assertThrows(PluginLoadException.class, () -> registry.load(ChannelAdminPlugin.NAME));
    assertFalse(registry.isLoaded(ChannelAdminPlugin.NAME));

    scheduler.advanceTimeBy(10, TimeUnit.SECONDS);
    assertTrue(irc.requests(IrcRequests.OP_UNQUIET).isEmpty());
  }

  @Test
  void pendingActionsSurviveAReload() {
    admin.quiet(ctx, "x!*@*", "1 hour").test().assertComplete();

    registry.unload(ChannelAdminPlugin.NAME);
    ChannelAdminPlugin next = (ChannelAdminPlugin) registry.load(ChannelAdminPlugin.NAME);

    assertNotSame(admin, next);
    assertEquals(Set.of(new PendingActionKey("x!*@*", "#a", "-q")), next.engine().pendingKeys());
    scheduler.advanceTimeBy(1, TimeUnit.HOURS);
    assertEquals(1, irc.requests(IrcRequests.OP_UNQUIET).size());
  }
}
