package com.ledgerlink.provider.plaid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ledgerlink.config.PlaidProperties;
import com.ledgerlink.provider.ProviderException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/** Thin JSON-over-HTTP client for the Plaid endpoints the link flow uses. */
@Component
public class PlaidClient {
  private static final Logger log = LoggerFactory.getLogger(PlaidClient.class);
  private static final int MAX_ERROR_BODY = 300;

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final PlaidProperties properties;

  public PlaidClient(PlaidProperties properties, ObjectMapper objectMapper) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout((int) properties.connectTimeout().toMillis());
    requestFactory.setReadTimeout((int) properties.readTimeout().toMillis());
    this.restClient = RestClient.builder()
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader("PLAID-CLIENT-ID", properties.clientId() == null ? "" : properties.clientId())
        .defaultHeader("PLAID-SECRET", properties.secret() == null ? "" : properties.secret())
        .build();
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public String createUser(String clientUserId) {
    ObjectNode request = objectMapper.createObjectNode().put("client_user_id", clientUserId);
    String userToken = post("/user/create", request).path("user_token").asText(null);
    if (userToken == null || userToken.isBlank()) {
      throw new ProviderException(PlaidProvider.PROVIDER_NAME, "Plaid user creation did not return a user_token");
    }
    return userToken;
  }

  /** Creates a hosted Link session. Response carries link_token, expiration and hosted_link_url. */
  public JsonNode createLinkToken(String clientUserId, String userToken, String redirectUri, String webhookUrl) {
    ObjectNode request = objectMapper.createObjectNode();
    request.put("client_name", properties.clientName());
    request.put("language", "en");
    request.set("country_codes", stringArray(properties.countryCodes()));
    request.putObject("user").put("client_user_id", clientUserId);
    request.set("products", stringArray(properties.products()));
    request.set("optional_products", stringArray(List.of("investments")));
    request.put("enable_multi_item_link", true);
    request.put("user_token", userToken);
    if (webhookUrl != null) {
      request.put("webhook", webhookUrl);
    }
    ObjectNode hostedLink = request.putObject("hosted_link");
    if (redirectUri != null && !redirectUri.isBlank()) {
      request.put("redirect_uri", redirectUri);
      hostedLink.put("completion_redirect_uri", redirectUri);
    }
    return post("/link/token/create", request);
  }

  public ExchangedItem exchangePublicToken(String publicToken) {
    JsonNode response = post("/item/public_token/exchange",
        objectMapper.createObjectNode().put("public_token", publicToken));
    return new ExchangedItem(response.path("access_token").asText(), response.path("item_id").asText());
  }

  public JsonNode getAccounts(String accessToken) {
    return post("/accounts/get", objectMapper.createObjectNode().put("access_token", accessToken));
  }

  public JsonNode getItem(String accessToken) {
    return post("/item/get", objectMapper.createObjectNode().put("access_token", accessToken));
  }

  /** Returns the JWK used to sign webhooks for {@code keyId}. */
  public JsonNode getWebhookVerificationKey(String keyId) {
    return post("/webhook_verification_key/get", objectMapper.createObjectNode().put("key_id", keyId)).path("key");
  }

  private JsonNode post(String path, ObjectNode request) {
    try {
      JsonNode body = restClient.post()
          .uri(path)
          .contentType(MediaType.APPLICATION_JSON)
          .body(request)
          .retrieve()
          .body(JsonNode.class);
      if (body == null) {
        throw new ProviderException(PlaidProvider.PROVIDER_NAME, "Plaid " + path + " returned an empty body");
      }
      return body;
    } catch (RestClientResponseException ex) {
      String detail = abbreviate(ex.getResponseBodyAsString());
      log.error("Plaid {} failed with {}: {}", path, ex.getStatusCode().value(), detail);
      throw new ProviderException(PlaidProvider.PROVIDER_NAME,
          "Plaid " + path + " failed: " + ex.getStatusCode().value() + " " + detail, ex);
    } catch (RestClientException ex) {
      log.error("Plaid {} failed: {}", path, ex.getMessage());
      throw new ProviderException(PlaidProvider.PROVIDER_NAME, "Plaid " + path + " failed: " + ex.getMessage(), ex);
    }
  }

  private static String abbreviate(String responseBody) {
    if (responseBody == null) {
      return "";
    }
    return responseBody.length() <= MAX_ERROR_BODY ? responseBody : responseBody.substring(0, MAX_ERROR_BODY) + "...";
  }

  private ArrayNode stringArray(List<String> values) {
    ArrayNode array = objectMapper.createArrayNode();
    values.forEach(array::add);
    return array;
  }

  public record ExchangedItem(String accessToken, String itemId) {}
}
