package com.ledgerlink.provider.plaid;

import com.fasterxml.jackson.databind.JsonNode;
import com.ledgerlink.config.WebhookProperties;
import com.ledgerlink.model.BankLinkStatus;
import com.ledgerlink.model.MoneyWithSign;
import com.ledgerlink.provider.BankLinkProvider;
import com.ledgerlink.provider.Institution;
import com.ledgerlink.provider.ItemIdSupport;
import com.ledgerlink.provider.LinkCompletion;
import com.ledgerlink.provider.LinkInitiation;
import com.ledgerlink.provider.LinkInitiationRequest;
import com.ledgerlink.provider.ProviderAccount;
import com.ledgerlink.provider.ProviderAccounts;
import com.ledgerlink.provider.ProviderException;
import com.ledgerlink.provider.StatusWebhook;
import com.ledgerlink.provider.StatusWebhookSupport;
import com.ledgerlink.provider.SyncCadence;
import com.ledgerlink.provider.UpdateWebhook;
import com.ledgerlink.provider.UpdateWebhookSupport;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PlaidProvider implements BankLinkProvider, UpdateWebhookSupport, StatusWebhookSupport, ItemIdSupport {
  public static final String PROVIDER_NAME = "plaid";
  private static final Logger log = LoggerFactory.getLogger(PlaidProvider.class);
  private static final Set<String> UPDATE_TYPES = Set.of("TRANSACTIONS", "INVESTMENTS");

  private final PlaidClient plaidClient;
  private final PlaidWebhookVerifier webhookVerifier;
  private final WebhookProperties webhookProperties;
  private final Clock clock;

  public PlaidProvider(PlaidClient plaidClient,
                       PlaidWebhookVerifier webhookVerifier,
                       WebhookProperties webhookProperties,
                       Clock clock) {
    this.plaidClient = plaidClient;
    this.webhookVerifier = webhookVerifier;
    this.webhookProperties = webhookProperties;
    this.clock = clock;
  }

  @Override
  public String getProviderName() {
    return PROVIDER_NAME;
  }

  @Override
  public SyncCadence getSyncCadence() {
    return SyncCadence.WEBHOOK;
  }

  @Override
  public LinkInitiation initiateLinking(LinkInitiationRequest request) {
    String clientUserId = request.userId().toString();
    Object existingToken = request.providerUserDetails().get("userToken");
    String userToken;
    Map<String, Object> updatedDetails = null;
    if (existingToken instanceof String && !((String) existingToken).isBlank()) {
      userToken = (String) existingToken;
      log.info("Reusing Plaid user token for user {}", request.userId());
    } else {
      userToken = plaidClient.createUser(clientUserId);
      updatedDetails = Map.of("userToken", userToken);
      log.info("Created Plaid user for user {}", request.userId());
    }

    JsonNode response = plaidClient.createLinkToken(clientUserId, userToken, request.redirectUri(), webhookUrl());
    String linkToken = response.path("link_token").asText(null);
    if (linkToken == null) {
      throw new ProviderException(PROVIDER_NAME, "Plaid did not return a link_token");
    }
    Instant expiresAt = response.hasNonNull("expiration")
        ? OffsetDateTime.parse(response.get("expiration").asText()).toInstant()
        : null;
    log.info("Plaid link token created for user {}, expires {}", request.userId(), expiresAt);
    return new LinkInitiation(
        response.path("hosted_link_url").asText(null),
        expiresAt,
        linkToken,
        updatedDetails,
        List.of());
  }

  @Override
  public boolean verifyWebhook(String rawBody, Map<String, String> headers) {
    return webhookVerifier.verify(rawBody, headers);
  }

  @Override
  public Optional<String> shouldProcessWebhook(JsonNode payload) {
    String webhookCode = payload.path("webhook_code").asText(null);
    String linkToken = payload.path("link_token").isTextual() ? payload.get("link_token").asText() : null;
    String status = payload.path("status").isTextual() ? payload.get("status").asText() : null;
    if (webhookCode == null || linkToken == null || status == null) {
      log.debug("Not a Plaid link session webhook");
      return Optional.empty();
    }
    if (!"SESSION_FINISHED".equals(webhookCode)) {
      log.info("Ignoring Plaid webhook code {}", webhookCode);
      return Optional.empty();
    }
    if (!"success".equalsIgnoreCase(status)) {
      log.warn("Ignoring Plaid SESSION_FINISHED with status {}", status);
      return Optional.empty();
    }
    return Optional.of(linkToken);
  }

  @Override
  public Optional<List<LinkCompletion>> processWebhook(JsonNode payload) {
    JsonNode publicTokens = payload.path("public_tokens");
    if (!publicTokens.isArray() || publicTokens.isEmpty()) {
      log.warn("Plaid SESSION_FINISHED carried no public tokens");
      return Optional.empty();
    }
    List<LinkCompletion> completions = new ArrayList<>();
    for (JsonNode publicToken : publicTokens) {
      PlaidClient.ExchangedItem item = plaidClient.exchangePublicToken(publicToken.asText());
      Map<String, Object> authentication = new LinkedHashMap<>();
      authentication.put("accessToken", item.accessToken());
      authentication.put("itemId", item.itemId());
      ProviderAccounts accounts = getAccounts(authentication);
      completions.add(new LinkCompletion(authentication, item.itemId(), accounts.accounts(), accounts.institution()));
    }
    log.info("Exchanged {} Plaid public tokens", completions.size());
    return Optional.of(completions);
  }

  @Override
  public ProviderAccounts getAccounts(Map<String, Object> authentication) {
    String accessToken = accessToken(authentication);
    JsonNode response = plaidClient.getAccounts(accessToken);
    JsonNode item = response.path("item");
    Institution institution = new Institution(
        item.path("institution_id").asText(null),
        item.path("institution_name").asText(null));
    List<ProviderAccount> accounts = new ArrayList<>();
    for (JsonNode account : response.path("accounts")) {
      accounts.add(toAccount(account));
    }
    log.info("Received {} accounts from Plaid", accounts.size());
    return new ProviderAccounts(accounts, institution);
  }

  @Override
  public Optional<UpdateWebhook> parseUpdateWebhook(JsonNode payload) {
    String webhookType = payload.path("webhook_type").asText(null);
    String webhookCode = payload.path("webhook_code").asText(null);
    JsonNode itemId = payload.path("item_id");
    if (webhookType != null && UPDATE_TYPES.contains(webhookType)
        && "DEFAULT_UPDATE".equals(webhookCode)
        && itemId.isTextual()) {
      return Optional.of(new UpdateWebhook(itemId.asText(), webhookType));
    }
    return Optional.empty();
  }

  @Override
  public Optional<StatusWebhook> parseStatusWebhook(JsonNode payload) {
    if (!"ITEM".equals(payload.path("webhook_type").asText(null))) {
      return Optional.empty();
    }
    String webhookCode = payload.path("webhook_code").asText("");
    String itemId = payload.path("item_id").asText(null);
    String receivedAt = clock.instant().toString();
    switch (webhookCode) {
      case "ERROR": {
        JsonNode error = payload.path("error");
        Map<String, Object> body = null;
        if (error.isObject()) {
          body = new LinkedHashMap<>();
          body.put("error_type", error.path("error_type").asText(null));
          body.put("error_code", error.path("error_code").asText(null));
          body.put("error_message", error.path("error_message").asText(null));
          body.put("display_message", error.path("display_message").asText(null));
          body.put("suggested_action", error.path("suggested_action").asText(null));
          body.put("receivedAt", receivedAt);
        }
        return Optional.of(new StatusWebhook(itemId, webhookCode, BankLinkStatus.ERROR, body, false));
      }
      case "LOGIN_REPAIRED":
        return Optional.of(new StatusWebhook(itemId, webhookCode, BankLinkStatus.OK, null, true));
      case "PENDING_DISCONNECT": {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reason", payload.path("reason").asText(null));
        body.put("environment", payload.path("environment").asText(null));
        body.put("receivedAt", receivedAt);
        return Optional.of(new StatusWebhook(itemId, webhookCode, BankLinkStatus.PENDING_REAUTH, body, false));
      }
      case "PENDING_EXPIRATION": {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("consent_expiration_time", payload.path("consent_expiration_time").asText(null));
        body.put("environment", payload.path("environment").asText(null));
        body.put("receivedAt", receivedAt);
        return Optional.of(new StatusWebhook(itemId, webhookCode, BankLinkStatus.PENDING_REAUTH, body, false));
      }
      default:
        return Optional.empty();
    }
  }

  @Override
  public String getItemId(Map<String, Object> authentication) {
    String itemId = plaidClient.getItem(accessToken(authentication)).path("item").path("item_id").asText(null);
    if (itemId == null) {
      throw new ProviderException(PROVIDER_NAME, "Plaid /item/get returned no item_id");
    }
    return itemId;
  }

  private ProviderAccount toAccount(JsonNode account) {
    JsonNode balances = account.path("balances");
    String currency = firstText(balances, "iso_currency_code", "unofficial_currency_code");
    if (currency == null) {
      currency = "USD";
    }
    String name = firstText(account, "official_name", "name");
    return new ProviderAccount(
        account.path("account_id").asText(),
        name,
        account.path("mask").asText(null),
        account.path("type").asText(null),
        account.path("subtype").asText(null),
        MoneyWithSign.fromDecimal(balances.path("available").isNumber() ? balances.get("available").decimalValue() : null, currency),
        MoneyWithSign.fromDecimal(balances.path("current").isNumber() ? balances.get("current").decimalValue() : null, currency));
  }

  private String webhookUrl() {
    String baseUrl = webhookProperties.baseUrl();
    if (baseUrl == null || baseUrl.isBlank()) {
      return null;
    }
    return baseUrl.replaceAll("/+$", "") + "/api/bank-links/webhook/" + PROVIDER_NAME;
  }

  private static String accessToken(Map<String, Object> authentication) {
    Object accessToken = authentication.get("accessToken");
    if (!(accessToken instanceof String) || ((String) accessToken).isBlank()) {
      throw new ProviderException(PROVIDER_NAME, "Missing accessToken in authentication data");
    }
    return (String) accessToken;
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.path(field);
      if (value.isTextual() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }
}
