package com.ledgerlink.provider.plaid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlink.config.WebhookProperties;
import com.ledgerlink.model.BankLinkStatus;
import com.ledgerlink.model.MoneySign;
import com.ledgerlink.provider.LinkCompletion;
import com.ledgerlink.provider.LinkInitiation;
import com.ledgerlink.provider.LinkInitiationRequest;
import com.ledgerlink.provider.ProviderAccount;
import com.ledgerlink.provider.ProviderAccounts;
import com.ledgerlink.provider.StatusWebhook;
import com.ledgerlink.provider.UpdateWebhook;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PlaidProviderTest {
  private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock
  private PlaidClient plaidClient;

  @Mock
  private PlaidWebhookVerifier webhookVerifier;

  private PlaidProvider provider;

  @BeforeEach
  void setUp() {
    provider = new PlaidProvider(plaidClient, webhookVerifier,
        new WebhookProperties(Duration.ofMinutes(5), "https://api.ledgerlink.test/"),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private JsonNode json(String value) throws Exception {
    return objectMapper.readTree(value);
  }

  @Nested
  @DisplayName("Link initiation")
  class LinkInitiationTests {

    @Test
    @DisplayName("Should create a Plaid user when none is stored and return it for persistence")
    void createsUserOnFirstLink() throws Exception {
      // Given
      UUID userId = UUID.randomUUID();
      when(plaidClient.createUser(userId.toString())).thenReturn("user-token-1");
      when(plaidClient.createLinkToken(userId.toString(), "user-token-1", "https://app/return",
          "https://api.ledgerlink.test/api/bank-links/webhook/plaid"))
          .thenReturn(json("{\"link_token\":\"link-sandbox-1\",\"hosted_link_url\":\"https://hosted/1\","
              + "\"expiration\":\"2024-01-15T16:00:00Z\"}"));

      // When
      LinkInitiation initiation = provider.initiateLinking(
          new LinkInitiationRequest(userId, "https://app/return", Map.of()));

      // Then
      assertThat(initiation.webhookId()).isEqualTo("link-sandbox-1");
      assertThat(initiation.linkUrl()).isEqualTo("https://hosted/1");
      assertThat(initiation.expiresAt()).isEqualTo(Instant.parse("2024-01-15T16:00:00Z"));
      assertThat(initiation.updatedProviderUserDetails()).containsEntry("userToken", "user-token-1");
      assertThat(initiation.immediateLinks()).isEmpty();
    }

    @Test
    @DisplayName("Should reuse a stored user token")
    void reusesStoredUserToken() throws Exception {
      // Given
      UUID userId = UUID.randomUUID();
      when(plaidClient.createLinkToken(eq(userId.toString()), eq("stored"), any(), any()))
          .thenReturn(json("{\"link_token\":\"link-2\"}"));

      // When
      LinkInitiation initiation = provider.initiateLinking(
          new LinkInitiationRequest(userId, null, Map.of("userToken", "stored")));

      // Then
      verify(plaidClient, never()).createUser(any());
      assertThat(initiation.updatedProviderUserDetails()).isNull();
      assertThat(initiation.expiresAt()).isNull();
    }
  }

  @Nested
  @DisplayName("Webhook classification")
  class WebhookClassification {

    @Test
    @DisplayName("Should process only successful SESSION_FINISHED webhooks")
    void sessionFinishedSuccessIsProcessed() throws Exception {
      assertThat(provider.shouldProcessWebhook(json(
          "{\"webhook_code\":\"SESSION_FINISHED\",\"link_token\":\"link-1\",\"status\":\"SUCCESS\"}")))
          .contains("link-1");
      assertThat(provider.shouldProcessWebhook(json(
          "{\"webhook_code\":\"SESSION_FINISHED\",\"link_token\":\"link-1\",\"status\":\"EXITED\"}")))
          .isEmpty();
      assertThat(provider.shouldProcessWebhook(json(
          "{\"webhook_code\":\"ITEM_ADD_RESULT\",\"link_token\":\"link-1\",\"status\":\"success\"}")))
          .isEmpty();
      assertThat(provider.shouldProcessWebhook(json("{\"webhook_code\":\"SESSION_FINISHED\"}"))).isEmpty();
    }

    @Test
    @DisplayName("Should recognize DEFAULT_UPDATE for transactions and investments")
    void parsesUpdateWebhooks() throws Exception {
      assertThat(provider.parseUpdateWebhook(json(
          "{\"webhook_type\":\"TRANSACTIONS\",\"webhook_code\":\"DEFAULT_UPDATE\",\"item_id\":\"item-1\"}")))
          .contains(new UpdateWebhook("item-1", "TRANSACTIONS"));
      assertThat(provider.parseUpdateWebhook(json(
          "{\"webhook_type\":\"TRANSACTIONS\",\"webhook_code\":\"SYNC_UPDATES_AVAILABLE\",\"item_id\":\"item-1\"}")))
          .isEmpty();
      assertThat(provider.parseUpdateWebhook(json(
          "{\"webhook_type\":\"AUTH\",\"webhook_code\":\"DEFAULT_UPDATE\",\"item_id\":\"item-1\"}")))
          .isEmpty();
    }

    @Test
    @DisplayName("Should map ITEM ERROR to an ERROR status without a sync")
    void itemErrorMapsToError() throws Exception {
      Optional<StatusWebhook> status = provider.parseStatusWebhook(json(
          "{\"webhook_type\":\"ITEM\",\"webhook_code\":\"ERROR\",\"item_id\":\"item-9\","
              + "\"error\":{\"error_type\":\"ITEM_ERROR\",\"error_code\":\"ITEM_LOGIN_REQUIRED\"}}"));

      assertThat(status).isPresent();
      assertThat(status.get().status()).isEqualTo(BankLinkStatus.ERROR);
      assertThat(status.get().shouldSync()).isFalse();
      assertThat(status.get().statusBody())
          .containsEntry("error_code", "ITEM_LOGIN_REQUIRED")
          .containsEntry("receivedAt", NOW.toString());
    }

    @Test
    @DisplayName("Should map LOGIN_REPAIRED to OK and request a sync")
    void loginRepairedTriggersSync() throws Exception {
      StatusWebhook status = provider.parseStatusWebhook(json(
          "{\"webhook_type\":\"ITEM\",\"webhook_code\":\"LOGIN_REPAIRED\",\"item_id\":\"item-9\"}")).orElseThrow();

      assertThat(status.status()).isEqualTo(BankLinkStatus.OK);
      assertThat(status.statusBody()).isNull();
      assertThat(status.shouldSync()).isTrue();
    }

    @Test
    @DisplayName("Should map pending disconnect and expiration to PENDING_REAUTH")
    void pendingCodesNeedReauth() throws Exception {
      assertThat(provider.parseStatusWebhook(json(
          "{\"webhook_type\":\"ITEM\",\"webhook_code\":\"PENDING_DISCONNECT\",\"item_id\":\"i\",\"reason\":\"INSTITUTION_MIGRATION\"}"))
          .map(StatusWebhook::status)).contains(BankLinkStatus.PENDING_REAUTH);
      assertThat(provider.parseStatusWebhook(json(
          "{\"webhook_type\":\"ITEM\",\"webhook_code\":\"PENDING_EXPIRATION\",\"item_id\":\"i\"}"))
          .map(StatusWebhook::status)).contains(BankLinkStatus.PENDING_REAUTH);
      assertThat(provider.parseStatusWebhook(json(
          "{\"webhook_type\":\"ITEM\",\"webhook_code\":\"WEBHOOK_UPDATE_ACKNOWLEDGED\",\"item_id\":\"i\"}")))
          .isEmpty();
    }
  }

  @Nested
  @DisplayName("Accounts")
  class Accounts {

    @Test
    @DisplayName("Should map balances, currencies and institution")
    void mapsAccounts() throws Exception {
      // Given
      when(plaidClient.getAccounts("access-1")).thenReturn(json("{"
          + "\"item\":{\"institution_id\":\"ins_1\",\"institution_name\":\"First Bank\"},"
          + "\"accounts\":["
          + "{\"account_id\":\"acc-1\",\"name\":\"Checking\",\"official_name\":\"Gold Checking\",\"mask\":\"0000\","
          + "\"type\":\"depository\",\"subtype\":\"checking\","
          + "\"balances\":{\"available\":100.5,\"current\":110.25,\"iso_currency_code\":\"USD\"}},"
          + "{\"account_id\":\"acc-2\",\"name\":\"Card\",\"type\":\"credit\","
          + "\"balances\":{\"available\":null,\"current\":-20,\"iso_currency_code\":null,"
          + "\"unofficial_currency_code\":\"EUR\"}}"
          + "]}"));

      // When
      ProviderAccounts accounts = provider.getAccounts(Map.of("accessToken", "access-1"));

      // Then
      assertThat(accounts.institution().name()).isEqualTo("First Bank");
      ProviderAccount checking = accounts.accounts().get(0);
      assertThat(checking.name()).isEqualTo("Gold Checking");
      assertThat(checking.availableBalance().amount()).isEqualTo(10050);
      assertThat(checking.currentBalance().amount()).isEqualTo(11025);
      ProviderAccount card = accounts.accounts().get(1);
      assertThat(card.currentBalance().currency()).isEqualTo("EUR");
      assertThat(card.currentBalance().sign()).isEqualTo(MoneySign.NEGATIVE);
      assertThat(card.availableBalance().amount()).isZero();
    }

    @Test
    @DisplayName("Should exchange every public token into its own completion")
    void exchangesPublicTokens() throws Exception {
      // Given
      when(plaidClient.exchangePublicToken("public-1")).thenReturn(new PlaidClient.ExchangedItem("access-1", "item-1"));
      when(plaidClient.exchangePublicToken("public-2")).thenReturn(new PlaidClient.ExchangedItem("access-2", "item-2"));
      when(plaidClient.getAccounts(any())).thenReturn(json("{\"item\":{},\"accounts\":[]}"));

      // When
      Optional<List<LinkCompletion>> completions = provider.processWebhook(json(
          "{\"webhook_code\":\"SESSION_FINISHED\",\"public_tokens\":[\"public-1\",\"public-2\"]}"));

      // Then
      assertThat(completions).isPresent();
      assertThat(completions.get()).extracting(LinkCompletion::itemId).containsExactly("item-1", "item-2");
      assertThat(completions.get().get(1).authentication())
          .containsEntry("accessToken", "access-2")
          .containsEntry("itemId", "item-2");
    }

    @Test
    @DisplayName("Should yield nothing when the session carried no public tokens")
    void noPublicTokens() throws Exception {
      assertThat(provider.processWebhook(json("{\"public_tokens\":[]}"))).isEmpty();
    }
  }
}
