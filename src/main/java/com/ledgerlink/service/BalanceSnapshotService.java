package com.ledgerlink.service;

import com.ledgerlink.dto.BalanceSnapshotResponse;
import com.ledgerlink.event.LinkedAccountState;
import com.ledgerlink.model.BalanceSnapshot;
import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.MoneyColumns;
import com.ledgerlink.model.MoneyWithSign;
import com.ledgerlink.model.SnapshotType;
import com.ledgerlink.repository.BalanceSnapshotRepository;
import com.ledgerlink.repository.FinancialAccountRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
public class BalanceSnapshotService {
  private static final Logger log = LoggerFactory.getLogger(BalanceSnapshotService.class);

  private final BalanceSnapshotRepository snapshotRepository;
  private final FinancialAccountRepository accountRepository;
  private final UserService userService;
  private final Clock clock;

  public BalanceSnapshotService(BalanceSnapshotRepository snapshotRepository,
                                FinancialAccountRepository accountRepository,
                                UserService userService,
                                Clock clock) {
    this.snapshotRepository = snapshotRepository;
    this.accountRepository = accountRepository;
    this.userService = userService;
    this.clock = clock;
  }

  public LocalDate today(UUID userId) {
    return today(userService.getZone(userId));
  }

  public LocalDate today(ZoneId zone) {
    return LocalDate.now(clock.withZone(zone));
  }

  /** Writes (or overwrites) the snapshot for {@code date} with the given balances. */
  @Transactional
  public BalanceSnapshot upsert(UUID accountId,
                                UUID userId,
                                LocalDate date,
                                MoneyWithSign currentBalance,
                                MoneyWithSign availableBalance,
                                SnapshotType type) {
    BalanceSnapshot snapshot = snapshotRepository.findByAccountIdAndSnapshotDate(accountId, date)
        .orElseGet(() -> {
          BalanceSnapshot created = new BalanceSnapshot();
          created.setAccountId(accountId);
          created.setUserId(userId);
          created.setSnapshotDate(date);
          return created;
        });
    snapshot.setCurrentBalance(MoneyColumns.of(currentBalance));
    snapshot.setAvailableBalance(MoneyColumns.of(availableBalance));
    snapshot.setSnapshotType(type);
    return snapshotRepository.save(snapshot);
  }

  @Transactional
  public BalanceSnapshot upsert(FinancialAccount account, LocalDate date, SnapshotType type) {
    return upsert(account.getId(), account.getUserId(), date,
        account.getCurrentBalance().toMoney(), account.getAvailableBalance().toMoney(), type);
  }

  /** Records today's provider-reported balances for a freshly synced account. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public BalanceSnapshot recordSync(LinkedAccountState account) {
    LocalDate date = today(account.userId());
    return upsert(account.accountId(), account.userId(), date,
        account.currentBalance(), account.availableBalance(), SnapshotType.SYNC);
  }

  /**
   * Copies the most recent earlier snapshot into {@code date} when that day has none.
   *
   * @return the created snapshot, or empty when the day already had one or there is nothing to copy
   */
  @Transactional
  public Optional<BalanceSnapshot> forwardFill(UUID accountId, LocalDate date) {
    if (snapshotRepository.findByAccountIdAndSnapshotDate(accountId, date).isPresent()) {
      return Optional.empty();
    }
    Optional<BalanceSnapshot> previous =
        snapshotRepository.findFirstByAccountIdAndSnapshotDateBeforeOrderBySnapshotDateDesc(accountId, date);
    if (previous.isEmpty()) {
      log.debug("No earlier snapshot to forward fill for account {} on {}", accountId, date);
      return Optional.empty();
    }
    BalanceSnapshot source = previous.get();
    BalanceSnapshot filled = upsert(accountId, source.getUserId(), date,
        source.getCurrentBalance().toMoney(), source.getAvailableBalance().toMoney(), SnapshotType.FORWARD_FILL);
    return Optional.of(filled);
  }

  @Transactional(readOnly = true)
  public List<BalanceSnapshotResponse> listSnapshots(UUID userId, UUID accountId) {
    accountRepository.findByIdAndUserId(accountId, userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Account not found"));
    return snapshotRepository.findByAccountIdAndUserIdOrderBySnapshotDateAsc(accountId, userId).stream()
        .map(BalanceSnapshotResponse::from)
        .toList();
  }
}
