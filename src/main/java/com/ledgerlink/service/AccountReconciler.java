package com.ledgerlink.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlink.event.LinkedAccountCreatedEvent;
import com.ledgerlink.event.LinkedAccountState;
import com.ledgerlink.event.LinkedAccountUpdatedEvent;
import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.MoneyColumns;
import com.ledgerlink.provider.ProviderAccount;
import com.ledgerlink.repository.FinancialAccountRepository;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Upserts provider accounts into the local ledger, keyed on {@code (userId, externalAccountId)}. */
@Service
public class AccountReconciler {
  private static final Logger log = LoggerFactory.getLogger(AccountReconciler.class);

  private final FinancialAccountRepository accountRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final ObjectMapper objectMapper;

  public AccountReconciler(FinancialAccountRepository accountRepository,
                           ApplicationEventPublisher eventPublisher,
                           ObjectMapper objectMapper) {
    this.accountRepository = accountRepository;
    this.eventPublisher = eventPublisher;
    this.objectMapper = objectMapper;
  }

  /**
   * @param accountIdToBankLinkId owning bank link for every provider account id in {@code providerAccounts}
   * @throws IllegalStateException if an account has no bank link mapping
   */
  @Transactional
  public List<FinancialAccount> upsertAccounts(List<ProviderAccount> providerAccounts,
                                               Map<String, UUID> accountIdToBankLinkId,
                                               UUID userId) {
    if (providerAccounts == null || providerAccounts.isEmpty()) {
      return List.of();
    }
    for (ProviderAccount providerAccount : providerAccounts) {
      if (accountIdToBankLinkId.get(providerAccount.accountId()) == null) {
        throw new IllegalStateException("No bank link mapped for provider account " + providerAccount.accountId());
      }
    }

    Set<String> externalIds = providerAccounts.stream()
        .map(ProviderAccount::accountId)
        .collect(Collectors.toSet());
    Map<String, FinancialAccount> existing = accountRepository.findByUserIdAndExternalAccountIdIn(userId, externalIds)
        .stream()
        .collect(Collectors.toMap(FinancialAccount::getExternalAccountId, Function.identity(), (first, second) -> first));

    Set<String> created = new HashSet<>();
    Map<String, FinancialAccount> toSave = new LinkedHashMap<>();
    for (ProviderAccount providerAccount : providerAccounts) {
      FinancialAccount account = toSave.get(providerAccount.accountId());
      if (account == null) {
        account = existing.get(providerAccount.accountId());
      }
      if (account == null) {
        account = new FinancialAccount();
        account.setUserId(userId);
        account.setExternalAccountId(providerAccount.accountId());
        created.add(providerAccount.accountId());
      } else if (!created.contains(providerAccount.accountId())) {
        logBalanceChange(account, providerAccount);
      }
      apply(account, providerAccount, accountIdToBankLinkId.get(providerAccount.accountId()));
      toSave.put(providerAccount.accountId(), account);
    }

    List<FinancialAccount> saved = accountRepository.saveAll(toSave.values());
    int createdCount = 0;
    for (FinancialAccount account : saved) {
      LinkedAccountState state = LinkedAccountState.of(account);
      if (created.contains(account.getExternalAccountId())) {
        createdCount++;
        eventPublisher.publishEvent(new LinkedAccountCreatedEvent(state));
      } else {
        eventPublisher.publishEvent(new LinkedAccountUpdatedEvent(state));
      }
    }
    log.info("Reconciled {} accounts for user {} ({} created, {} updated)",
        saved.size(), userId, createdCount, saved.size() - createdCount);
    return saved;
  }

  private void apply(FinancialAccount account, ProviderAccount providerAccount, UUID bankLinkId) {
    account.setName(providerAccount.name() == null ? providerAccount.accountId() : providerAccount.name());
    account.setMask(providerAccount.mask());
    account.setType(providerAccount.type());
    account.setSubType(providerAccount.subType());
    account.setCurrentBalance(MoneyColumns.of(providerAccount.currentBalance()));
    account.setAvailableBalance(MoneyColumns.of(providerAccount.availableBalance()));
    account.setBankLinkId(bankLinkId);
    account.setRawApiAccount(toJson(providerAccount));
  }

  private void logBalanceChange(FinancialAccount account, ProviderAccount providerAccount) {
    long before = account.getCurrentBalance() == null ? 0 : account.getCurrentBalance().getAmount();
    long after = providerAccount.currentBalance().signedAmount();
    if (before != after) {
      log.info("Account {} balance changed {} -> {} {}", account.getId(), before, after,
          providerAccount.currentBalance().currency());
    }
  }

  private String toJson(ProviderAccount providerAccount) {
    try {
      return objectMapper.writeValueAsString(providerAccount);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize provider account " + providerAccount.accountId(), ex);
    }
  }
}
