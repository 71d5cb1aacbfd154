package io.stackwarden.runtime.ports;

import java.time.Instant;

/**
 * Pluggable clock used for timestamps, retention and timeouts.
 */
public interface Clock {

  long currentTimeMillis();

  Instant now();

  static Clock system() {
    return new Clock() {
      @Override
      public long currentTimeMillis() {
        return System.currentTimeMillis();
      }

      @Override
      public Instant now() {
        return Instant.now();
      }
    };
  }

  static Clock fixed(Instant instant) {
    return new Clock() {
      @Override
      public long currentTimeMillis() {
        return instant.toEpochMilli();
      }

      @Override
      public Instant now() {
        return instant;
      }
    };
  }
}
