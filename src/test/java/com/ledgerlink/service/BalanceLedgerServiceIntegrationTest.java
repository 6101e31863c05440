package com.ledgerlink.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlink.event.TransactionState;
import com.ledgerlink.model.BalanceSnapshot;
import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.MoneyColumns;
import com.ledgerlink.model.MoneyWithSign;
import com.ledgerlink.model.SnapshotType;
import com.ledgerlink.repository.BalanceSnapshotRepository;
import com.ledgerlink.repository.FinancialAccountRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs the ledger against a real database. Test methods are not transactional so each ledger
 * operation commits in its own transaction as it does in production.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({BalanceLedgerService.class, BalanceSnapshotService.class, UserService.class,
    BalanceLedgerServiceIntegrationTest.Config.class})
class BalanceLedgerServiceIntegrationTest {
  private static final LocalDate TODAY = LocalDate.of(2024, 1, 15);
  private static final LocalDate FIRST_DAY = LocalDate.of(2024, 1, 8);
  private static final long OPENING = 100_000;

  @TestConfiguration
  static class Config {
    @Bean
    Clock clock() {
      return Clock.fixed(Instant.parse("2024-01-15T12:00:00Z"), ZoneOffset.UTC);
    }

    @Bean
    ObjectMapper objectMapper() {
      return new ObjectMapper();
    }
  }

  @Autowired
  private BalanceLedgerService ledgerService;

  @Autowired
  private FinancialAccountRepository accountRepository;

  @Autowired
  private BalanceSnapshotRepository snapshotRepository;

  private UUID userId;
  private UUID accountId;

  @BeforeEach
  void setUp() {
    userId = UUID.randomUUID();
    FinancialAccount account = new FinancialAccount();
    account.setUserId(userId);
    account.setName("Checking");
    account.setCurrentBalance(new MoneyColumns(OPENING, "USD"));
    account.setAvailableBalance(new MoneyColumns(OPENING, "USD"));
    accountId = accountRepository.save(account).getId();

    for (LocalDate date = FIRST_DAY; !date.isAfter(TODAY); date = date.plusDays(1)) {
      BalanceSnapshot snapshot = new BalanceSnapshot();
      snapshot.setUserId(userId);
      snapshot.setAccountId(accountId);
      snapshot.setSnapshotDate(date);
      snapshot.setCurrentBalance(new MoneyColumns(OPENING, "USD"));
      snapshot.setAvailableBalance(new MoneyColumns(OPENING, "USD"));
      snapshot.setSnapshotType(SnapshotType.SYNC);
      snapshotRepository.save(snapshot);
    }
  }

  @AfterEach
  void tearDown() {
    snapshotRepository.deleteAll();
    accountRepository.deleteAll();
  }

  private TransactionState transaction(UUID transactionId, long signedAmount, LocalDate date) {
    return new TransactionState(transactionId, userId, accountId, MoneyWithSign.fromSigned(signedAmount, "USD"), date);
  }

  private long accountBalance() {
    return accountRepository.findById(accountId).orElseThrow().getCurrentBalance().getAmount();
  }

  private Map<LocalDate, Long> snapshotBalances() {
    List<BalanceSnapshot> snapshots = snapshotRepository.findByAccountIdAndUserIdOrderBySnapshotDateAsc(accountId, userId);
    return snapshots.stream().collect(Collectors.toMap(BalanceSnapshot::getSnapshotDate,
        snapshot -> snapshot.getCurrentBalance().getAmount()));
  }

  @Test
  @DisplayName("Should shift the account and every snapshot from the transaction date")
  void createShiftsHistory() {
    // When
    ledgerService.applyCreated(transaction(UUID.randomUUID(), -50_000, LocalDate.of(2024, 1, 10)));

    // Then
    assertThat(accountBalance()).isEqualTo(50_000);
    Map<LocalDate, Long> balances = snapshotBalances();
    assertThat(balances.get(LocalDate.of(2024, 1, 9))).isEqualTo(OPENING);
    assertThat(balances.get(LocalDate.of(2024, 1, 10))).isEqualTo(50_000);
    assertThat(balances.get(LocalDate.of(2024, 1, 14))).isEqualTo(50_000);
    BalanceSnapshot today = snapshotRepository.findByAccountIdAndSnapshotDate(accountId, TODAY).orElseThrow();
    assertThat(today.getCurrentBalance().getAmount()).isEqualTo(50_000);
    assertThat(today.getAvailableBalance().getAmount()).isEqualTo(50_000);
    assertThat(today.getSnapshotType()).isEqualTo(SnapshotType.USER_UPDATE);
  }

  @Test
  @DisplayName("Should restore every balance when a created transaction is deleted")
  void createThenDeleteRoundTrips() {
    // Given
    Map<LocalDate, Long> before = snapshotBalances();
    TransactionState transaction = transaction(UUID.randomUUID(), -50_000, LocalDate.of(2024, 1, 10));

    // When
    ledgerService.applyCreated(transaction);
    ledgerService.applyDeleted(transaction);

    // Then
    assertThat(accountBalance()).isEqualTo(OPENING);
    assertThat(snapshotBalances()).isEqualTo(before);
  }

  @Test
  @DisplayName("Should restore today's snapshot when a future-dated transaction is deleted")
  void futureDatedRoundTrips() {
    // Given
    Map<LocalDate, Long> before = snapshotBalances();
    TransactionState transaction = transaction(UUID.randomUUID(), 50_000, LocalDate.of(2024, 1, 20));

    // When
    ledgerService.applyCreated(transaction);
    long todayAfterCreate = snapshotBalances().get(TODAY);
    ledgerService.applyDeleted(transaction);

    // Then
    assertThat(todayAfterCreate).isEqualTo(OPENING + 50_000);
    assertThat(accountBalance()).isEqualTo(OPENING);
    assertThat(snapshotBalances()).isEqualTo(before);
  }

  @Test
  @DisplayName("Should keep today's snapshot in step with the account when a future transaction is edited")
  void futureDatedUpdateMovesToday() {
    // Given
    UUID transactionId = UUID.randomUUID();
    TransactionState original = transaction(transactionId, 50_000, LocalDate.of(2024, 1, 20));
    ledgerService.applyCreated(original);

    // When
    ledgerService.applyUpdated(original, transaction(transactionId, 20_000, LocalDate.of(2024, 1, 25)));

    // Then
    assertThat(accountBalance()).isEqualTo(OPENING + 20_000);
    Map<LocalDate, Long> balances = snapshotBalances();
    assertThat(balances.get(TODAY)).isEqualTo(OPENING + 20_000);
    assertThat(balances.get(LocalDate.of(2024, 1, 14))).isEqualTo(OPENING);
  }

  @Test
  @DisplayName("Should apply only the difference when an amount changes")
  void updateAppliesDifference() {
    // Given
    UUID transactionId = UUID.randomUUID();
    TransactionState original = transaction(transactionId, -50_000, LocalDate.of(2024, 1, 10));
    ledgerService.applyCreated(original);

    // When
    TransactionState edited = transaction(transactionId, -45_000, LocalDate.of(2024, 1, 12));
    ledgerService.applyUpdated(original, edited);

    // Then
    assertThat(accountBalance()).isEqualTo(55_000);
    Map<LocalDate, Long> balances = snapshotBalances();
    assertThat(balances.get(LocalDate.of(2024, 1, 9))).isEqualTo(OPENING);
    assertThat(balances.get(LocalDate.of(2024, 1, 12))).isEqualTo(55_000);
    assertThat(balances.get(TODAY)).isEqualTo(55_000);
  }

  @Test
  @DisplayName("Should end where a single create of the final state would")
  void updatesTelescope() {
    // Given
    UUID transactionId = UUID.randomUUID();
    TransactionState first = transaction(transactionId, -10_000, LocalDate.of(2024, 1, 11));
    TransactionState second = transaction(transactionId, -25_000, LocalDate.of(2024, 1, 11));
    TransactionState third = transaction(transactionId, 5_000, LocalDate.of(2024, 1, 11));

    // When
    ledgerService.applyCreated(first);
    ledgerService.applyUpdated(first, second);
    ledgerService.applyUpdated(second, third);

    // Then
    assertThat(accountBalance()).isEqualTo(OPENING + 5_000);
    Map<LocalDate, Long> balances = snapshotBalances();
    assertThat(balances.get(LocalDate.of(2024, 1, 10))).isEqualTo(OPENING);
    assertThat(balances.get(LocalDate.of(2024, 1, 11))).isEqualTo(OPENING + 5_000);
    assertThat(balances.get(TODAY)).isEqualTo(OPENING + 5_000);
  }

  @Test
  @DisplayName("Should leave balances untouched when the amount does not change")
  void zeroDeltaUpdateIsNoop() {
    UUID transactionId = UUID.randomUUID();
    TransactionState original = transaction(transactionId, -50_000, LocalDate.of(2024, 1, 10));
    ledgerService.applyCreated(original);
    Map<LocalDate, Long> before = snapshotBalances();

    ledgerService.applyUpdated(original, transaction(transactionId, -50_000, LocalDate.of(2024, 1, 12)));

    assertThat(accountBalance()).isEqualTo(50_000);
    assertThat(snapshotBalances()).isEqualTo(before);
  }

  @Test
  @DisplayName("Should move the amount when a transaction changes account")
  void moveBetweenAccounts() {
    // Given
    FinancialAccount savings = new FinancialAccount();
    savings.setUserId(userId);
    savings.setName("Savings");
    savings.setCurrentBalance(new MoneyColumns(0, "USD"));
    savings.setAvailableBalance(new MoneyColumns(0, "USD"));
    UUID savingsId = accountRepository.save(savings).getId();
    UUID transactionId = UUID.randomUUID();
    TransactionState original = transaction(transactionId, -50_000, LocalDate.of(2024, 1, 10));
    ledgerService.applyCreated(original);

    // When
    ledgerService.applyUpdated(original, new TransactionState(transactionId, userId, savingsId,
        MoneyWithSign.fromSigned(-50_000, "USD"), LocalDate.of(2024, 1, 10)));

    // Then
    assertThat(accountBalance()).isEqualTo(OPENING);
    assertThat(accountRepository.findById(savingsId).orElseThrow().getCurrentBalance().getAmount()).isEqualTo(-50_000);
  }

  @Test
  @DisplayName("Should fail with a drift error when the account is gone")
  void missingAccountIsDrift() {
    TransactionState orphan = new TransactionState(UUID.randomUUID(), userId, UUID.randomUUID(),
        MoneyWithSign.fromSigned(-100, "USD"), LocalDate.of(2024, 1, 10));

    assertThatThrownBy(() -> ledgerService.applyCreated(orphan)).isInstanceOf(BalanceDriftException.class);
  }
}
