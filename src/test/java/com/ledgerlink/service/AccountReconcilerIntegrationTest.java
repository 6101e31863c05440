package com.ledgerlink.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlink.event.LinkedAccountCreatedEvent;
import com.ledgerlink.event.LinkedAccountUpdatedEvent;
import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.MoneyWithSign;
import com.ledgerlink.provider.ProviderAccount;
import com.ledgerlink.repository.FinancialAccountRepository;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

@DataJpaTest
@RecordApplicationEvents
@Import({AccountReconciler.class, AccountReconcilerIntegrationTest.Config.class})
class AccountReconcilerIntegrationTest {

  @TestConfiguration
  static class Config {
    @Bean
    ObjectMapper objectMapper() {
      return new ObjectMapper();
    }
  }

  @Autowired
  private AccountReconciler reconciler;

  @Autowired
  private FinancialAccountRepository accountRepository;

  @Autowired
  private ApplicationEvents events;

  private UUID userId;
  private UUID bankLinkId;

  @BeforeEach
  void setUp() {
    userId = UUID.randomUUID();
    bankLinkId = UUID.randomUUID();
  }

  private static ProviderAccount providerAccount(String accountId, long balance) {
    MoneyWithSign money = MoneyWithSign.fromSigned(balance, "USD");
    return new ProviderAccount(accountId, "Account " + accountId, "0001", "depository", "checking", money, money);
  }

  private Map<String, Long> balancesByExternalId() {
    return accountRepository.findByUserId(userId).stream()
        .collect(Collectors.toMap(FinancialAccount::getExternalAccountId,
            account -> account.getCurrentBalance().getAmount()));
  }

  @Test
  @DisplayName("Should not create rows or move balances when the same accounts are reconciled again")
  void reconcilingTwiceIsIdempotent() {
    // Given
    List<ProviderAccount> accounts = List.of(providerAccount("acc-1", 12_500), providerAccount("acc-2", -3_000));
    Map<String, UUID> owners = Map.of("acc-1", bankLinkId, "acc-2", bankLinkId);
    reconciler.upsertAccounts(accounts, owners, userId);
    Map<String, Long> afterFirst = balancesByExternalId();
    List<UUID> idsAfterFirst = accountRepository.findByUserId(userId).stream().map(FinancialAccount::getId).toList();

    // When
    reconciler.upsertAccounts(accounts, owners, userId);

    // Then
    assertThat(accountRepository.findByUserId(userId)).hasSize(2);
    assertThat(accountRepository.findByUserId(userId)).extracting(FinancialAccount::getId)
        .containsExactlyInAnyOrderElementsOf(idsAfterFirst);
    assertThat(balancesByExternalId()).isEqualTo(afterFirst).containsEntry("acc-1", 12_500L);
    assertThat(events.stream(LinkedAccountCreatedEvent.class)).hasSize(2);
    assertThat(events.stream(LinkedAccountUpdatedEvent.class)).hasSize(2);
  }

  @Test
  @DisplayName("Should keep accounts of other users apart")
  void accountsAreScopedByUser() {
    UUID otherUser = UUID.randomUUID();
    reconciler.upsertAccounts(List.of(providerAccount("acc-1", 100)), Map.of("acc-1", bankLinkId), userId);

    reconciler.upsertAccounts(List.of(providerAccount("acc-1", 900)), Map.of("acc-1", UUID.randomUUID()), otherUser);

    assertThat(balancesByExternalId()).containsExactly(Map.entry("acc-1", 100L));
    assertThat(accountRepository.findByUserId(otherUser)).hasSize(1);
  }
}
