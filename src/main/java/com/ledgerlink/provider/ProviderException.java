package com.ledgerlink.provider;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** Upstream provider call failed (transport error, timeout, or unusable response). */
@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class ProviderException extends RuntimeException {
  private final String providerName;

  public ProviderException(String providerName, String message) {
    super(message);
    this.providerName = providerName;
  }

  public ProviderException(String providerName, String message, Throwable cause) {
    super(message, cause);
    this.providerName = providerName;
  }

  public String getProviderName() {
    return providerName;
  }
}
