package com.ledgerlink.dto;

import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateAccountRequest {
  @NotBlank
  private String name;

  @NotBlank
  private String currency;

  private BigDecimal openingBalance;
  private String type;
}
