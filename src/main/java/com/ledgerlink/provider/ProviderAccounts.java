package com.ledgerlink.provider;

import java.util.List;

public record ProviderAccounts(List<ProviderAccount> accounts, Institution institution) {
  public ProviderAccounts {
    accounts = accounts == null ? List.of() : List.copyOf(accounts);
  }
}
