package ca.gc.cra.continuum.domain.evidence;

import java.util.concurrent.ThreadLocalRandom;

/**
 * <strong>What:</strong> ULID-style opaque identifiers for analysis and feedback events.
 * <p><strong>Why:</strong> Each event is written as its own object, so a fresh sortable id per event removes
 * any need for conflict resolution in the remote store.</p>
 * <p><strong>Thread-safety:</strong> Stateless; randomness comes from {@link ThreadLocalRandom}.</p>
 *
 * @implNote Not suitable for cryptographic purposes; ids only need to be unique and sortable.
 * @since 0.1.0
 */
public final class EventId {
  private static final char[] ENC = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();

  private EventId() {}

  /**
   * Generates a 26-character identifier whose prefix encodes {@code epochMillis}.
   *
   * @param epochMillis creation time of the event
   * @return lexicographically sortable identifier
   */
  public static String newId(long epochMillis) {
    ThreadLocalRandom random = ThreadLocalRandom.current();
    char[] out = new char[26];
    long time = epochMillis;
    for (int i = 9; i >= 0; i--) {
      out[i] = ENC[(int) (time & 31)];
      time >>>= 5;
    }
    long high = random.nextLong();
    long low = random.nextLong();
    for (int i = 25; i >= 18; i--) {
      out[i] = ENC[(int) (low & 31)];
      low >>>= 5;
    }
    for (int i = 17; i >= 10; i--) {
      out[i] = ENC[(int) (high & 31)];
      high >>>= 5;
    }
    return new String(out);
  }
}
