package com.ledgerlink.model;

public enum MoneySign {
  POSITIVE,
  NEGATIVE
}
