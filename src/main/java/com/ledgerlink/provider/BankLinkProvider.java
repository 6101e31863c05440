package com.ledgerlink.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A financial data source that can link a user's accounts and report balances for them.
 * Optional webhook capabilities are expressed by also implementing {@link UpdateWebhookSupport},
 * {@link StatusWebhookSupport} or {@link ItemIdSupport}.
 */
public interface BankLinkProvider {
  String getProviderName();

  SyncCadence getSyncCadence();

  LinkInitiation initiateLinking(LinkInitiationRequest request);

  /** Returns false for missing or invalid signatures; must not throw for a merely bad request. */
  boolean verifyWebhook(String rawBody, Map<String, String> headers);

  ProviderAccounts getAccounts(Map<String, Object> authentication);

  /** Completions for a link-finished webhook, or empty when the payload yields none. */
  default Optional<List<LinkCompletion>> processWebhook(JsonNode payload) {
    return Optional.empty();
  }

  /** Correlation id of a link-completion webhook worth processing, or empty. */
  default Optional<String> shouldProcessWebhook(JsonNode payload) {
    return Optional.empty();
  }
}
