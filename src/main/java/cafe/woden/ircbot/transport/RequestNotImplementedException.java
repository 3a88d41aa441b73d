package cafe.woden.ircbot.transport;

/** No started plugin provides the requested name. */
public class RequestNotImplementedException extends RuntimeException {

  private final String requestName;

  public RequestNotImplementedException(String requestName) {
    super("No plugin provides the request '" + requestName + "'");
    this.requestName = requestName;
  }

  public String requestName() {
    return requestName;
  }
}
