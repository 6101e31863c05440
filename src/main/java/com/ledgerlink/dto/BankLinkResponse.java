package com.ledgerlink.dto;

import com.ledgerlink.model.BankLink;
import com.ledgerlink.model.BankLinkStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BankLinkResponse {
  private UUID id;
  private String providerName;
  private String institutionId;
  private String institutionName;
  private BankLinkStatus status;
  private Instant statusDate;
  private List<String> accountIds;
  private Instant createdAt;

  public static BankLinkResponse from(BankLink bankLink) {
    return new BankLinkResponse(
        bankLink.getId(),
        bankLink.getProviderName(),
        bankLink.getInstitutionId(),
        bankLink.getInstitutionName(),
        bankLink.getStatus(),
        bankLink.getStatusDate(),
        bankLink.getAccountIds().stream().sorted().toList(),
        bankLink.getCreatedAt());
  }
}
