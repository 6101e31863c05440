package com.ledgerlink.provider;

import java.util.List;
import java.util.Map;

/**
 * One completed authorization: the credentials a new bank link stores plus the accounts it covers.
 * Produced both by webhook completion and by providers that link synchronously.
 */
public record LinkCompletion(
    Map<String, Object> authentication,
    String itemId,
    List<ProviderAccount> accounts,
    Institution institution) {

  public LinkCompletion {
    authentication = authentication == null ? Map.of() : Map.copyOf(authentication);
    accounts = accounts == null ? List.of() : List.copyOf(accounts);
  }
}
