package com.ledgerlink.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
public class MoneyColumns {
  @Column(nullable = false)
  private long amount;

  @Column(nullable = false, length = 16)
  private String currency;

  public MoneyColumns(long amount, String currency) {
    this.amount = amount;
    this.currency = currency;
  }

  public static MoneyColumns of(MoneyWithSign money) {
    return new MoneyColumns(money.signedAmount(), money.currency());
  }

  public MoneyWithSign toMoney() {
    return MoneyWithSign.fromSigned(amount, currency);
  }
}
