package com.ledgerlink.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlink.config.SyncProperties;
import com.ledgerlink.dto.AccountResponse;
import com.ledgerlink.dto.BankLinkResponse;
import com.ledgerlink.dto.InitiateLinkResponse;
import com.ledgerlink.dto.WebhookOutcome;
import com.ledgerlink.dto.WebhookResult;
import com.ledgerlink.dto.WindowedClaim;
import com.ledgerlink.model.BankLink;
import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.WebhookEvent;
import com.ledgerlink.provider.BankLinkProvider;
import com.ledgerlink.provider.Institution;
import com.ledgerlink.provider.ItemIdSupport;
import com.ledgerlink.provider.LinkCompletion;
import com.ledgerlink.provider.LinkInitiation;
import com.ledgerlink.provider.LinkInitiationRequest;
import com.ledgerlink.provider.ProviderAccount;
import com.ledgerlink.provider.ProviderAccounts;
import com.ledgerlink.provider.ProviderRegistry;
import com.ledgerlink.provider.StatusWebhook;
import com.ledgerlink.provider.StatusWebhookSupport;
import com.ledgerlink.provider.SyncCadence;
import com.ledgerlink.provider.UpdateWebhook;
import com.ledgerlink.provider.UpdateWebhookSupport;
import com.ledgerlink.repository.BankLinkRepository;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Drives the link lifecycle (initiate, provider callback, completion) and later account syncs.
 * Provider calls never run inside a database transaction; persistence happens in the
 * repositories and the {@link AccountReconciler}.
 */
@Service
public class BankLinkService {
  private static final Logger log = LoggerFactory.getLogger(BankLinkService.class);
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final String UPDATE_EVENT_PREFIX = "update-";
  private static final String STATUS_EVENT_PREFIX = "status-";

  private final BankLinkRepository bankLinkRepository;
  private final ProviderRegistry providerRegistry;
  private final WebhookEventService webhookEventService;
  private final AccountReconciler accountReconciler;
  private final UserService userService;
  private final CryptoService cryptoService;
  private final ObjectMapper objectMapper;
  private final Executor syncExecutor;
  private final Duration linkTimeout;
  private final Clock clock;

  public BankLinkService(BankLinkRepository bankLinkRepository,
                         ProviderRegistry providerRegistry,
                         WebhookEventService webhookEventService,
                         AccountReconciler accountReconciler,
                         UserService userService,
                         CryptoService cryptoService,
                         ObjectMapper objectMapper,
                         @Qualifier("syncExecutor") Executor syncExecutor,
                         SyncProperties syncProperties,
                         Clock clock) {
    this.bankLinkRepository = bankLinkRepository;
    this.providerRegistry = providerRegistry;
    this.webhookEventService = webhookEventService;
    this.accountReconciler = accountReconciler;
    this.userService = userService;
    this.cryptoService = cryptoService;
    this.objectMapper = objectMapper;
    this.syncExecutor = syncExecutor;
    this.linkTimeout = syncProperties.linkTimeout();
    this.clock = clock;
  }

  public InitiateLinkResponse initiateLinking(String providerName,
                                              UUID userId,
                                              String redirectUri,
                                              Map<String, Object> linkInput) {
    BankLinkProvider provider = providerRegistry.require(providerName);
    Map<String, Object> details = new HashMap<>(userService.getProviderDetails(userId, providerName));
    if (linkInput != null) {
      details.putAll(linkInput);
    }
    log.info("Initiating {} link for user {}", providerName, userId);
    LinkInitiation initiation = provider.initiateLinking(new LinkInitiationRequest(userId, redirectUri, details));

    if (initiation.updatedProviderUserDetails() != null) {
      userService.updateProviderDetails(userId, providerName, initiation.updatedProviderUserDetails());
    }
    if (initiation.webhookId() != null) {
      webhookEventService.createPending(initiation.webhookId(), providerName, userId, initiation.expiresAt());
    }
    List<BankLinkResponse> immediate = List.of();
    if (!initiation.immediateLinks().isEmpty()) {
      immediate = completeLinks(providerName, userId, initiation.immediateLinks()).stream()
          .map(BankLinkResponse::from)
          .toList();
      log.info("Created {} immediate {} links for user {}", immediate.size(), providerName, userId);
    }
    return new InitiateLinkResponse(initiation.linkUrl(), initiation.expiresAt(), initiation.webhookId(), immediate);
  }

  /**
   * Verifies and dispatches a provider callback. Exactly one handler runs, tried in order: link
   * status change, data update, link completion.
   *
   * @throws ResponseStatusException UNAUTHORIZED when the signature check fails; nothing is written
   */
  public WebhookResult handleWebhook(String providerName, String rawBody, Map<String, String> headers) {
    return handleWebhook(providerName, rawBody, headers, null);
  }

  /** As above, with a payload already parsed by the caller; a null payload is parsed from {@code rawBody}. */
  public WebhookResult handleWebhook(String providerName,
                                     String rawBody,
                                     Map<String, String> headers,
                                     JsonNode parsedPayload) {
    BankLinkProvider provider = providerRegistry.require(providerName);
    if (!provider.verifyWebhook(rawBody, headers)) {
      log.warn("Webhook verification failed for provider {}", providerName);
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid webhook signature");
    }
    JsonNode payload = parsedPayload == null ? parsePayload(rawBody) : parsedPayload;
    log.info("Verified {} webhook", providerName);

    if (provider instanceof StatusWebhookSupport) {
      Optional<StatusWebhook> status = ((StatusWebhookSupport) provider).parseStatusWebhook(payload);
      if (status.isPresent()) {
        return handleStatusWebhook(providerName, status.get(), rawBody);
      }
    }
    if (provider instanceof UpdateWebhookSupport) {
      Optional<UpdateWebhook> update = ((UpdateWebhookSupport) provider).parseUpdateWebhook(payload);
      if (update.isPresent()) {
        return handleUpdateWebhook(providerName, update.get(), rawBody);
      }
    }
    Optional<String> webhookId = provider.shouldProcessWebhook(payload);
    if (webhookId.isPresent()) {
      return handleLinkCompletionWebhook(provider, webhookId.get(), payload, rawBody);
    }
    log.info("{} webhook is not a processable type, skipping", providerName);
    return WebhookResult.of(WebhookOutcome.IGNORED, "Webhook type not handled");
  }

  public List<AccountResponse> syncAccounts(UUID bankLinkId, UUID userId) {
    BankLink bankLink = bankLinkRepository.findByIdAndUserId(bankLinkId, userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Bank link not found"));
    return syncBankLink(bankLink);
  }

  public List<AccountResponse> syncAllAccounts(UUID userId) {
    List<BankLink> links = bankLinkRepository.findByUserId(userId);
    log.info("Syncing {} bank links for user {}", links.size(), userId);
    return syncInParallel(links);
  }

  /** Syncs every link whose provider is not kept fresh by webhooks. */
  public List<AccountResponse> syncAllAccountsSystem() {
    List<String> providers = new ArrayList<>(providerRegistry.namesWithCadence(SyncCadence.DAILY));
    providers.addAll(providerRegistry.namesWithCadence(SyncCadence.HOURLY));
    return syncProviders(providers);
  }

  public List<AccountResponse> syncByCadence(SyncCadence cadence) {
    return syncProviders(providerRegistry.namesWithCadence(cadence));
  }

  public List<BankLinkResponse> listBankLinks(UUID userId) {
    return bankLinkRepository.findByUserId(userId).stream().map(BankLinkResponse::from).toList();
  }

  /**
   * Fills in the provider item id for links created before it was recorded, so update and status
   * webhooks can find them.
   *
   * @return number of links updated
   */
  public int backfillItemIds(String providerName) {
    BankLinkProvider provider = providerRegistry.require(providerName);
    if (!(provider instanceof ItemIdSupport)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Provider " + providerName + " has no item ids");
    }
    ItemIdSupport itemIds = (ItemIdSupport) provider;
    int updated = 0;
    for (BankLink link : bankLinkRepository.findByProviderNameAndExternalItemIdIsNull(providerName)) {
      try {
        Map<String, Object> authentication = loadAuthentication(link);
        Object stored = authentication.get("itemId");
        String itemId = stored instanceof String ? (String) stored : itemIds.getItemId(authentication);
        link.setExternalItemId(itemId);
        bankLinkRepository.save(link);
        updated++;
      } catch (RuntimeException ex) {
        log.error("Item id backfill failed for bank link {}: {}", link.getId(), ex.getMessage(), ex);
      }
    }
    log.info("Backfilled item ids for {} {} bank links", updated, providerName);
    return updated;
  }

  private List<AccountResponse> syncProviders(List<String> providerNames) {
    if (providerNames.isEmpty()) {
      return List.of();
    }
    List<BankLink> links = bankLinkRepository.findByProviderNameIn(providerNames);
    log.info("System sync of {} bank links for providers {}", links.size(), providerNames);
    return syncInParallel(links);
  }

  /**
   * Runs one sync per link concurrently; a failed or timed-out link is logged and skipped.
   *
   * <p>A timeout does not stop the worker thread. The abandoned sync checks its flag once the
   * provider answers and drops the result instead of reconciling, so a late answer cannot overwrite
   * accounts after the batch has reported the link as failed. A timeout that fires while the
   * reconcile itself is running still lets that reconcile commit.
   */
  private List<AccountResponse> syncInParallel(List<BankLink> links) {
    List<CompletableFuture<List<AccountResponse>>> futures = new ArrayList<>();
    List<AtomicBoolean> abandonedFlags = new ArrayList<>();
    for (BankLink link : links) {
      AtomicBoolean abandoned = new AtomicBoolean();
      abandonedFlags.add(abandoned);
      CompletableFuture<List<AccountResponse>> future =
          CompletableFuture.supplyAsync(() -> syncBankLink(link, abandoned::get), syncExecutor)
              .orTimeout(linkTimeout.toMillis(), TimeUnit.MILLISECONDS);
      future.whenComplete((accounts, error) -> {
        if (isTimeout(error)) {
          abandoned.set(true);
        }
      });
      futures.add(future);
    }
    List<AccountResponse> accounts = new ArrayList<>();
    int failed = 0;
    for (int i = 0; i < futures.size(); i++) {
      BankLink link = links.get(i);
      try {
        accounts.addAll(futures.get(i).join());
      } catch (CompletionException ex) {
        failed++;
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        if (isTimeout(cause)) {
          abandonedFlags.get(i).set(true);
          log.error("Sync of bank link {} ({}) timed out after {}", link.getId(), link.getProviderName(), linkTimeout);
        } else {
          log.error("Sync of bank link {} ({}) failed: {}", link.getId(), link.getProviderName(), cause.getMessage(),
              cause);
        }
      }
    }
    if (failed > 0) {
      log.warn("{} of {} bank link syncs failed", failed, links.size());
    }
    return accounts;
  }

  private static boolean isTimeout(Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    return cause instanceof TimeoutException;
  }

  private List<AccountResponse> syncBankLink(BankLink bankLink) {
    return syncBankLink(bankLink, () -> false);
  }

  private List<AccountResponse> syncBankLink(BankLink bankLink, BooleanSupplier abandoned) {
    log.info("Syncing bank link {} ({}) for user {}", bankLink.getId(), bankLink.getProviderName(),
        bankLink.getUserId());
    BankLinkProvider provider = providerRegistry.require(bankLink.getProviderName());
    ProviderAccounts fetched = provider.getAccounts(loadAuthentication(bankLink));
    if (abandoned.getAsBoolean()) {
      log.warn("Discarding late sync result for bank link {} after timeout", bankLink.getId());
      return List.of();
    }

    boolean changed = applyInstitution(bankLink, fetched.institution());
    for (ProviderAccount account : fetched.accounts()) {
      changed |= bankLink.getAccountIds().add(account.accountId());
    }
    if (changed) {
      bankLinkRepository.save(bankLink);
    }

    Map<String, UUID> accountIdToBankLinkId = new HashMap<>();
    fetched.accounts().forEach(account -> accountIdToBankLinkId.put(account.accountId(), bankLink.getId()));
    List<FinancialAccount> saved =
        accountReconciler.upsertAccounts(fetched.accounts(), accountIdToBankLinkId, bankLink.getUserId());
    return saved.stream().map(AccountResponse::from).toList();
  }

  private WebhookResult handleStatusWebhook(String providerName, StatusWebhook status, String rawBody) {
    Optional<BankLink> found = findByItemId(providerName, status.itemId());
    if (found.isEmpty()) {
      log.warn("No bank link found for {} item {}", providerName, status.itemId());
      return WebhookResult.of(WebhookOutcome.IGNORED, "No bank link for item " + status.itemId());
    }
    BankLink bankLink = found.get();
    WindowedClaim claim = webhookEventService.claimWindowed(providerName,
        STATUS_EVENT_PREFIX + status.webhookCode(), status.itemId(), bankLink.getUserId(), rawBody);
    if (!claim.accepted()) {
      return new WebhookResult(WebhookOutcome.DUPLICATE, claim.reason(), List.of(bankLink.getId()));
    }

    bankLink.setStatus(status.status());
    bankLink.setStatusDate(clock.instant());
    bankLink.setStatusBody(toJson(status.statusBody()));
    bankLinkRepository.save(bankLink);
    log.info("Bank link {} status is now {} ({})", bankLink.getId(), status.status(), status.webhookCode());

    if (status.shouldSync()) {
      syncBankLink(bankLink);
    }
    return new WebhookResult(WebhookOutcome.STATUS_UPDATED, status.webhookCode(), List.of(bankLink.getId()));
  }

  private WebhookResult handleUpdateWebhook(String providerName, UpdateWebhook update, String rawBody) {
    Optional<BankLink> found = findByItemId(providerName, update.itemId());
    if (found.isEmpty()) {
      log.warn("No bank link found for {} item {}", providerName, update.itemId());
      return WebhookResult.of(WebhookOutcome.IGNORED, "No bank link for item " + update.itemId());
    }
    BankLink bankLink = found.get();
    WindowedClaim claim = webhookEventService.claimWindowed(providerName,
        UPDATE_EVENT_PREFIX + update.type(), update.itemId(), bankLink.getUserId(), rawBody);
    if (!claim.accepted()) {
      return new WebhookResult(WebhookOutcome.DUPLICATE, claim.reason(), List.of(bankLink.getId()));
    }
    syncBankLink(bankLink);
    return new WebhookResult(WebhookOutcome.SYNCED, update.type(), List.of(bankLink.getId()));
  }

  private WebhookResult handleLinkCompletionWebhook(BankLinkProvider provider,
                                                    String webhookId,
                                                    JsonNode payload,
                                                    String rawBody) {
    Optional<WebhookEvent> pending = webhookEventService.findPendingByWebhookId(webhookId);
    if (pending.isEmpty()) {
      log.info("No pending link session for webhook {}: already handled, expired or unknown", webhookId);
      return WebhookResult.of(WebhookOutcome.IGNORED, "No pending link session");
    }
    if (!webhookEventService.claimPending(webhookId)) {
      return WebhookResult.of(WebhookOutcome.IGNORED, "Link session already being processed");
    }
    UUID userId = pending.get().getUserId();
    try {
      Optional<List<LinkCompletion>> completions = provider.processWebhook(payload);
      if (completions.isEmpty() || completions.get().isEmpty()) {
        webhookEventService.markFailed(webhookId, "No link completion responses", rawBody);
        return WebhookResult.of(WebhookOutcome.LINK_FAILED, "No link completion responses");
      }
      List<BankLink> links = completeLinks(provider.getProviderName(), userId, completions.get());
      webhookEventService.markCompleted(webhookId, rawBody);
      log.info("Link session {} completed with {} bank links for user {}", webhookId, links.size(), userId);
      return new WebhookResult(WebhookOutcome.LINK_COMPLETED, null, links.stream().map(BankLink::getId).toList());
    } catch (RuntimeException ex) {
      log.error("Link session {} failed: {}", webhookId, ex.getMessage(), ex);
      webhookEventService.markFailed(webhookId, ex.getMessage() == null ? ex.getClass().getName() : ex.getMessage(),
          rawBody);
      throw ex;
    }
  }

  /** Creates one bank link per distinct authentication and reconciles all of their accounts. */
  private List<BankLink> completeLinks(String providerName, UUID userId, List<LinkCompletion> completions) {
    Map<Map<String, Object>, List<LinkCompletion>> byAuthentication = new LinkedHashMap<>();
    for (LinkCompletion completion : completions) {
      byAuthentication.computeIfAbsent(completion.authentication(), key -> new ArrayList<>()).add(completion);
    }

    List<BankLink> links = new ArrayList<>();
    List<ProviderAccount> accounts = new ArrayList<>();
    Map<String, UUID> accountIdToBankLinkId = new HashMap<>();
    for (Map.Entry<Map<String, Object>, List<LinkCompletion>> entry : byAuthentication.entrySet()) {
      LinkCompletion first = entry.getValue().get(0);
      BankLink bankLink = new BankLink();
      bankLink.setUserId(userId);
      bankLink.setProviderName(providerName);
      bankLink.setEncryptedAuthentication(storeAuthentication(entry.getKey()));
      bankLink.setExternalItemId(first.itemId());
      applyInstitution(bankLink, first.institution());
      entry.getValue().forEach(completion ->
          completion.accounts().forEach(account -> bankLink.getAccountIds().add(account.accountId())));
      BankLink saved = bankLinkRepository.save(bankLink);
      links.add(saved);
      for (LinkCompletion completion : entry.getValue()) {
        for (ProviderAccount account : completion.accounts()) {
          accounts.add(account);
          accountIdToBankLinkId.put(account.accountId(), saved.getId());
        }
      }
    }
    accountReconciler.upsertAccounts(accounts, accountIdToBankLinkId, userId);
    return links;
  }

  private Optional<BankLink> findByItemId(String providerName, String itemId) {
    if (itemId == null) {
      return Optional.empty();
    }
    return bankLinkRepository.findFirstByProviderNameAndExternalItemId(providerName, itemId);
  }

  private boolean applyInstitution(BankLink bankLink, Institution institution) {
    if (institution == null) {
      return false;
    }
    if (Objects.equals(bankLink.getInstitutionId(), institution.id())
        && Objects.equals(bankLink.getInstitutionName(), institution.name())) {
      return false;
    }
    bankLink.setInstitutionId(institution.id());
    bankLink.setInstitutionName(institution.name());
    log.info("Institution for bank link {} set to {} ({})", bankLink.getId(), institution.name(), institution.id());
    return true;
  }

  private JsonNode parsePayload(String rawBody) {
    try {
      return objectMapper.readTree(rawBody == null ? "" : rawBody);
    } catch (JsonProcessingException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Webhook body is not valid JSON");
    }
  }

  private String storeAuthentication(Map<String, Object> authentication) {
    return cryptoService.encrypt(toJson(authentication));
  }

  private Map<String, Object> loadAuthentication(BankLink bankLink) {
    String json = cryptoService.decrypt(bankLink.getEncryptedAuthentication());
    if (json == null) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Stored authentication for bank link " + bankLink.getId() + " is unreadable", ex);
    }
  }

  private String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize value", ex);
    }
  }
}
