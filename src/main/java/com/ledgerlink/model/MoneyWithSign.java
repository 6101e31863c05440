package com.ledgerlink.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Locale;
import java.util.Map;

/**
 * Monetary value in the currency's minor units. {@code amount} is never negative; the direction
 * is carried by {@link MoneySign} ({@code POSITIVE} credits the account, {@code NEGATIVE} debits it).
 */
public record MoneyWithSign(long amount, String currency, MoneySign sign) {
  private static final Map<String, Integer> CRYPTO_SCALES = Map.of("BTC", 8, "ETH", 8);
  private static final int DEFAULT_SCALE = 2;

  public MoneyWithSign {
    if (amount < 0) {
      throw new IllegalArgumentException("amount must not be negative");
    }
    if (currency == null || currency.isBlank()) {
      throw new IllegalArgumentException("currency is required");
    }
    currency = currency.toUpperCase(Locale.ROOT);
    if (sign == null) {
      sign = MoneySign.POSITIVE;
    }
  }

  public static MoneyWithSign zero(String currency) {
    return new MoneyWithSign(0, currency, MoneySign.POSITIVE);
  }

  public static MoneyWithSign fromSigned(long signedAmount, String currency) {
    return new MoneyWithSign(Math.abs(signedAmount), currency,
        signedAmount < 0 ? MoneySign.NEGATIVE : MoneySign.POSITIVE);
  }

  /** Converts a decimal major-unit value (e.g. {@code 12.34} USD) into minor units. */
  public static MoneyWithSign fromDecimal(BigDecimal value, String currency) {
    if (value == null) {
      return zero(currency);
    }
    long minor = value.movePointRight(scaleOf(currency))
        .setScale(0, RoundingMode.HALF_UP)
        .longValueExact();
    return fromSigned(minor, currency);
  }

  public static int scaleOf(String currency) {
    String code = currency.toUpperCase(Locale.ROOT);
    Integer crypto = CRYPTO_SCALES.get(code);
    if (crypto != null) {
      return crypto;
    }
    try {
      int digits = Currency.getInstance(code).getDefaultFractionDigits();
      return digits < 0 ? DEFAULT_SCALE : digits;
    } catch (IllegalArgumentException ex) {
      return DEFAULT_SCALE;
    }
  }

  public long signedAmount() {
    return sign == MoneySign.NEGATIVE ? -amount : amount;
  }

  public BigDecimal toDecimal() {
    return BigDecimal.valueOf(signedAmount(), scaleOf(currency));
  }

  public MoneyWithSign plus(long signedDelta) {
    return fromSigned(Math.addExact(signedAmount(), signedDelta), currency);
  }
}
