package com.ledgerlink.service;

import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.repository.FinancialAccountRepository;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Fills gaps in the daily snapshot history by carrying the last known balance forward. */
@Component
public class BalanceSnapshotScheduler {
  private static final Logger log = LoggerFactory.getLogger(BalanceSnapshotScheduler.class);

  private final FinancialAccountRepository accountRepository;
  private final BalanceSnapshotService snapshotService;
  private final UserService userService;

  public BalanceSnapshotScheduler(FinancialAccountRepository accountRepository,
                                  BalanceSnapshotService snapshotService,
                                  UserService userService) {
    this.accountRepository = accountRepository;
    this.snapshotService = snapshotService;
    this.userService = userService;
  }

  @Scheduled(cron = "${ledgerlink.snapshots.forward-fill-cron:0 0 */6 * * *}")
  public void forwardFillYesterday() {
    Map<UUID, ZoneId> zones = new HashMap<>();
    int filled = 0;
    int failed = 0;
    for (FinancialAccount account : accountRepository.findAll()) {
      ZoneId zone = zones.computeIfAbsent(account.getUserId(), userService::getZone);
      LocalDate yesterday = snapshotService.today(zone).minusDays(1);
      try {
        if (snapshotService.forwardFill(account.getId(), yesterday).isPresent()) {
          filled++;
        }
      } catch (RuntimeException ex) {
        failed++;
        log.error("Forward fill failed for account {} on {}", account.getId(), yesterday, ex);
      }
    }
    log.info("Forward fill finished: {} snapshots created, {} failures", filled, failed);
  }
}
