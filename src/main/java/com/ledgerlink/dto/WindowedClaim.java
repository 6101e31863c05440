package com.ledgerlink.dto;

/** Outcome of a time-windowed dedup claim; {@code reason} is set when the claim was rejected. */
public record WindowedClaim(boolean accepted, String reason) {
  public static WindowedClaim accept() {
    return new WindowedClaim(true, null);
  }

  public static WindowedClaim reject(String reason) {
    return new WindowedClaim(false, reason);
  }
}
