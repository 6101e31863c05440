package com.ledgerlink.dto;

import com.ledgerlink.model.MoneySign;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateTransactionRequest {
  @NotNull
  private UUID accountId;

  @NotNull
  @DecimalMin("0")
  private BigDecimal amount;

  @NotBlank
  private String currency;

  @NotNull
  private MoneySign sign;

  @NotNull
  private LocalDate date;

  private String merchantName;
  private String description;
  private boolean pending;
}
