package com.ledgerlink.controller;

import com.ledgerlink.dto.AccountResponse;
import com.ledgerlink.dto.BalanceSnapshotResponse;
import com.ledgerlink.dto.CreateAccountRequest;
import com.ledgerlink.service.AccountService;
import com.ledgerlink.service.BalanceSnapshotService;
import com.ledgerlink.service.CurrentUserService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/accounts")
public class AccountController {
  private final AccountService accountService;
  private final BalanceSnapshotService snapshotService;
  private final CurrentUserService currentUserService;

  public AccountController(AccountService accountService,
                           BalanceSnapshotService snapshotService,
                           CurrentUserService currentUserService) {
    this.accountService = accountService;
    this.snapshotService = snapshotService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<AccountResponse> list() {
    UUID userId = currentUserService.requireUserId();
    return accountService.listAccounts(userId);
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public AccountResponse create(@Valid @RequestBody CreateAccountRequest request) {
    UUID userId = currentUserService.requireUserId();
    return accountService.createManualAccount(userId, request);
  }

  @GetMapping("/{accountId}/snapshots")
  public List<BalanceSnapshotResponse> snapshots(@PathVariable UUID accountId) {
    UUID userId = currentUserService.requireUserId();
    return snapshotService.listSnapshots(userId, accountId);
  }
}
