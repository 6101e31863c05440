package com.ledgerlink.provider.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.ledgerlink.config.TatumProperties;
import com.ledgerlink.provider.ProviderException;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Native-coin balance lookups through the Tatum blockchain API. Balances are in whole coins. */
@Component
public class TatumClient {
  private static final Logger log = LoggerFactory.getLogger(TatumClient.class);
  private static final String PROVIDER = "crypto";

  private final RestClient restClient;
  private final String apiKey;

  public TatumClient(TatumProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout((int) properties.connectTimeout().toMillis());
    requestFactory.setReadTimeout((int) properties.readTimeout().toMillis());
    this.restClient = RestClient.builder()
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .build();
    this.apiKey = properties.apiKey();
  }

  public BigDecimal getBalance(CryptoNetwork network, String address) {
    return switch (network) {
      case ETHEREUM -> getEthereumBalance(address);
      case BITCOIN -> getBitcoinBalance(address);
    };
  }

  public BigDecimal getEthereumBalance(String address) {
    JsonNode body = get("/v3/ethereum/account/balance/{address}", address, "getEthereumBalance");
    return decimal(body.path("balance"));
  }

  public BigDecimal getBitcoinBalance(String address) {
    JsonNode body = get("/v3/bitcoin/address/balance/{address}", address, "getBitcoinBalance");
    return decimal(body.path("incoming")).subtract(decimal(body.path("outgoing")));
  }

  private JsonNode get(String uri, String address, String operation) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new ProviderException(PROVIDER, "ledgerlink.providers.tatum.api-key is not configured");
    }
    try {
      JsonNode body = restClient.get()
          .uri(uri, address)
          .header("x-api-key", apiKey)
          .retrieve()
          .body(JsonNode.class);
      if (body == null) {
        throw new ProviderException(PROVIDER, "Tatum " + operation + " returned an empty body");
      }
      return body;
    } catch (RestClientException ex) {
      log.error("Tatum {} failed: {}", operation, ex.getMessage());
      throw new ProviderException(PROVIDER, "Tatum " + operation + " failed: " + ex.getMessage(), ex);
    }
  }

  private static BigDecimal decimal(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
      return BigDecimal.ZERO;
    }
    try {
      return new BigDecimal(node.asText().trim());
    } catch (NumberFormatException ex) {
      throw new ProviderException(PROVIDER, "Unparseable balance from Tatum: " + node.asText(), ex);
    }
  }
}
