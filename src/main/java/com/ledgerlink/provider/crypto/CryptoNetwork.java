package com.ledgerlink.provider.crypto;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

public enum CryptoNetwork {
  ETHEREUM("ethereum", "ETH", Pattern.compile("^0x[a-fA-F0-9]{40}$")),
  // legacy base58 (P2PKH/P2SH) or native segwit bech32
  BITCOIN("bitcoin", "BTC", Pattern.compile("^(?:[13][a-km-zA-HJ-NP-Z1-9]{25,34}|bc1[a-zA-HJ-NP-Z0-9]{39,59})$"));

  private final String id;
  private final String currency;
  private final Pattern addressPattern;

  CryptoNetwork(String id, String currency, Pattern addressPattern) {
    this.id = id;
    this.currency = currency;
    this.addressPattern = addressPattern;
  }

  public String id() {
    return id;
  }

  public String currency() {
    return currency;
  }

  public String displayName() {
    return id.substring(0, 1).toUpperCase(Locale.ROOT) + id.substring(1);
  }

  public boolean isValidAddress(String address) {
    return address != null && addressPattern.matcher(address).matches();
  }

  public static Optional<CryptoNetwork> fromId(Object value) {
    if (value == null) {
      return Optional.empty();
    }
    String id = value.toString().trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(network -> network.id.equals(id)).findFirst();
  }
}
