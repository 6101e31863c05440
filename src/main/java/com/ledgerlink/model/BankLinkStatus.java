package com.ledgerlink.model;

public enum BankLinkStatus {
  OK,
  ERROR,
  PENDING_REAUTH
}
