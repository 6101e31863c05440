package com.ledgerlink.provider;

import com.ledgerlink.model.MoneyWithSign;

/**
 * Account as reported by a provider. {@code accountId} is the provider's stable identifier and
 * becomes the local account's external id.
 */
public record ProviderAccount(
    String accountId,
    String name,
    String mask,
    String type,
    String subType,
    MoneyWithSign availableBalance,
    MoneyWithSign currentBalance) {}
