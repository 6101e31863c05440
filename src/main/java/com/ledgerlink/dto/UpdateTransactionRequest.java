package com.ledgerlink.dto;

import com.ledgerlink.model.MoneySign;
import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/** Partial update; null fields keep their current value. */
@Getter
@Setter
public class UpdateTransactionRequest {
  private UUID accountId;

  @DecimalMin("0")
  private BigDecimal amount;

  private MoneySign sign;
  private LocalDate date;
  private String merchantName;
  private String description;
  private Boolean pending;
}
