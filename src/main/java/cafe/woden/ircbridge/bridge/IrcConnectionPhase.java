package cafe.woden.ircbridge.bridge;

/** Where the IRC session is in its lifecycle. Only {@link #READY} lines are relayed. */
public enum IrcConnectionPhase {
  DISCONNECTED,
  HANDSHAKING,
  READY
}
