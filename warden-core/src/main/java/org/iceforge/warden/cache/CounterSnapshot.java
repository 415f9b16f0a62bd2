package org.iceforge.warden.cache;

import java.time.Instant;

/** Counter value right after an increment, with the instant its window closes. */
public record CounterSnapshot(long value, Instant expiresAt) {}
