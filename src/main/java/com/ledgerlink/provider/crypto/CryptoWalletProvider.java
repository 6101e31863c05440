package com.ledgerlink.provider.crypto;

import com.ledgerlink.model.MoneyWithSign;
import com.ledgerlink.provider.BankLinkProvider;
import com.ledgerlink.provider.Institution;
import com.ledgerlink.provider.LinkCompletion;
import com.ledgerlink.provider.LinkInitiation;
import com.ledgerlink.provider.LinkInitiationRequest;
import com.ledgerlink.provider.ProviderAccount;
import com.ledgerlink.provider.ProviderAccounts;
import com.ledgerlink.provider.ProviderException;
import com.ledgerlink.provider.SyncCadence;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * Links a public wallet address. Linking is synchronous: the address is validated, its balance
 * fetched, and the account returned immediately. No webhooks; balances are polled hourly.
 */
@Component
public class CryptoWalletProvider implements BankLinkProvider {
  public static final String PROVIDER_NAME = "crypto";
  private static final Logger log = LoggerFactory.getLogger(CryptoWalletProvider.class);
  private static final String ACCOUNT_TYPE = "crypto_wallet";

  private final TatumClient tatumClient;

  public CryptoWalletProvider(TatumClient tatumClient) {
    this.tatumClient = tatumClient;
  }

  @Override
  public String getProviderName() {
    return PROVIDER_NAME;
  }

  @Override
  public SyncCadence getSyncCadence() {
    return SyncCadence.HOURLY;
  }

  @Override
  public LinkInitiation initiateLinking(LinkInitiationRequest request) {
    Object rawAddress = request.providerUserDetails().get("walletAddress");
    String address = rawAddress == null ? "" : rawAddress.toString().trim();
    if (address.isEmpty()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "walletAddress is required");
    }
    CryptoNetwork network = CryptoNetwork.fromId(request.providerUserDetails().get("network"))
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
            "network must be one of: ethereum, bitcoin"));
    if (!network.isValidAddress(address)) {
      log.warn("Invalid {} address {}...", network.id(), hint(address));
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid " + network.id() + " address format");
    }

    log.info("Linking {} wallet {}... for user {}", network.id(), hint(address), request.userId());
    ProviderAccount account = toAccount(network, address, tatumClient.getBalance(network, address));
    LinkCompletion completion = new LinkCompletion(
        Map.of("address", address, "network", network.id()),
        null,
        List.of(account),
        institution(network));
    return LinkInitiation.immediate(List.of(completion));
  }

  @Override
  public boolean verifyWebhook(String rawBody, Map<String, String> headers) {
    return false;
  }

  @Override
  public ProviderAccounts getAccounts(Map<String, Object> authentication) {
    Object rawAddress = authentication.get("address");
    CryptoNetwork network = CryptoNetwork.fromId(authentication.get("network"))
        .orElseThrow(() -> new ProviderException(PROVIDER_NAME, "Stored wallet link has no valid network"));
    if (rawAddress == null || rawAddress.toString().isBlank()) {
      throw new ProviderException(PROVIDER_NAME, "Stored wallet link has no address");
    }
    String address = rawAddress.toString();
    BigDecimal balance = tatumClient.getBalance(network, address);
    log.info("Fetched {} wallet {}... balance", network.id(), hint(address));
    return new ProviderAccounts(List.of(toAccount(network, address, balance)), institution(network));
  }

  private ProviderAccount toAccount(CryptoNetwork network, String address, BigDecimal balance) {
    MoneyWithSign money = MoneyWithSign.fromDecimal(balance, network.currency());
    return new ProviderAccount(
        network.id() + ":" + address,
        network.displayName() + " Wallet",
        address.substring(Math.max(0, address.length() - 4)),
        ACCOUNT_TYPE,
        null,
        money,
        money);
  }

  private Institution institution(CryptoNetwork network) {
    return new Institution(network.id(), network.displayName() + " Wallet");
  }

  private static String hint(String address) {
    return address.substring(0, Math.min(10, address.length()));
  }
}
