package com.ledgerlink.dto;

import java.util.Map;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class InitiateLinkRequest {
  private String redirectUri;

  /** Provider-specific input for this link attempt, e.g. a wallet address. */
  private Map<String, Object> linkInput;
}
