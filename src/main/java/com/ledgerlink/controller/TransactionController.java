package com.ledgerlink.controller;

import com.ledgerlink.dto.CreateTransactionRequest;
import com.ledgerlink.dto.TransactionResponse;
import com.ledgerlink.dto.UpdateTransactionRequest;
import com.ledgerlink.service.CurrentUserService;
import com.ledgerlink.service.TransactionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/transactions")
public class TransactionController {
  private final TransactionService transactionService;
  private final CurrentUserService currentUserService;

  public TransactionController(TransactionService transactionService, CurrentUserService currentUserService) {
    this.transactionService = transactionService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<TransactionResponse> list(@RequestParam(value = "accountId", required = false) UUID accountId) {
    UUID userId = currentUserService.requireUserId();
    return transactionService.listTransactions(userId, accountId);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public TransactionResponse create(@Valid @RequestBody CreateTransactionRequest request) {
    UUID userId = currentUserService.requireUserId();
    return transactionService.createTransaction(userId, request);
  }

  @PatchMapping("/{transactionId}")
  public TransactionResponse update(@PathVariable UUID transactionId,
                                    @Valid @RequestBody UpdateTransactionRequest request) {
    UUID userId = currentUserService.requireUserId();
    return transactionService.updateTransaction(userId, transactionId, request);
  }

  @DeleteMapping("/{transactionId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable UUID transactionId) {
    UUID userId = currentUserService.requireUserId();
    transactionService.deleteTransaction(userId, transactionId);
  }
}
