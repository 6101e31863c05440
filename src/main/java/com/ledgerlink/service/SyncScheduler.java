package com.ledgerlink.service;

import com.ledgerlink.config.SyncProperties;
import com.ledgerlink.provider.ItemIdSupport;
import com.ledgerlink.provider.ProviderRegistry;
import com.ledgerlink.provider.SyncCadence;
import com.ledgerlink.dto.AccountResponse;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SyncScheduler {
  private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

  private final BankLinkService bankLinkService;
  private final ProviderRegistry providerRegistry;
  private final SyncProperties syncProperties;

  public SyncScheduler(BankLinkService bankLinkService,
                       ProviderRegistry providerRegistry,
                       SyncProperties syncProperties) {
    this.bankLinkService = bankLinkService;
    this.providerRegistry = providerRegistry;
    this.syncProperties = syncProperties;
  }

  @Scheduled(cron = "${ledgerlink.sync.daily-cron:0 0 17 * * *}", zone = "${ledgerlink.sync.zone:America/Los_Angeles}")
  public void syncDaily() {
    run(SyncCadence.DAILY);
  }

  @Scheduled(cron = "${ledgerlink.sync.frequent-cron:0 0 * * * *}")
  public void syncHourly() {
    run(SyncCadence.HOURLY);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void backfillItemIds() {
    if (!syncProperties.backfillItemIdsOnStartup()) {
      return;
    }
    providerRegistry.list().stream()
        .filter(provider -> provider instanceof ItemIdSupport)
        .forEach(provider -> bankLinkService.backfillItemIds(provider.getProviderName()));
  }

  private void run(SyncCadence cadence) {
    if (!syncProperties.enabled()) {
      return;
    }
    List<AccountResponse> accounts = bankLinkService.syncByCadence(cadence);
    log.info("{} sync finished, {} accounts refreshed", cadence, accounts.size());
  }
}
