package com.ledgerlink.provider;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

@Component
public class ProviderRegistry {
  private final Map<String, BankLinkProvider> providers;

  public ProviderRegistry(List<BankLinkProvider> providers) {
    this.providers = Map.copyOf(providers.stream()
        .collect(Collectors.toMap(BankLinkProvider::getProviderName, Function.identity(),
            (first, second) -> {
              throw new IllegalStateException("Duplicate bank link provider: " + first.getProviderName());
            },
            TreeMap::new)));
  }

  public BankLinkProvider require(String providerName) {
    BankLinkProvider provider = providerName == null ? null : providers.get(providerName);
    if (provider == null) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND,
          "Provider '" + providerName + "' not found. Available providers: " + String.join(", ", names()));
    }
    return provider;
  }

  public List<BankLinkProvider> list() {
    return providers.values().stream().toList();
  }

  public List<String> names() {
    return providers.keySet().stream().sorted().toList();
  }

  public List<String> namesWithCadence(SyncCadence cadence) {
    return providers.values().stream()
        .filter(provider -> provider.getSyncCadence() == cadence)
        .map(BankLinkProvider::getProviderName)
        .sorted()
        .toList();
  }
}
