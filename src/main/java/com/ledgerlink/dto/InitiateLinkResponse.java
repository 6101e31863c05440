package com.ledgerlink.dto;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class InitiateLinkResponse {
  private String linkUrl;
  private Instant expiresAt;
  private String webhookId;

  /** Links completed during initiation by providers that link synchronously. */
  private List<BankLinkResponse> bankLinks;
}
