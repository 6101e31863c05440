package com.ledgerlink.controller;

import com.ledgerlink.dto.AccountResponse;
import com.ledgerlink.dto.BankLinkResponse;
import com.ledgerlink.dto.InitiateLinkRequest;
import com.ledgerlink.dto.InitiateLinkResponse;
import com.ledgerlink.dto.WebhookResult;
import com.ledgerlink.service.BankLinkService;
import com.ledgerlink.service.CurrentUserService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/bank-links")
public class BankLinkController {
  private final BankLinkService bankLinkService;
  private final CurrentUserService currentUserService;

  public BankLinkController(BankLinkService bankLinkService, CurrentUserService currentUserService) {
    this.bankLinkService = bankLinkService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public List<BankLinkResponse> list() {
    UUID userId = currentUserService.requireUserId();
    return bankLinkService.listBankLinks(userId);
  }

  @PostMapping("/initiate/{provider}")
  public InitiateLinkResponse initiate(@PathVariable String provider,
                                       @RequestBody(required = false) InitiateLinkRequest request) {
    UUID userId = currentUserService.requireUserId();
    String redirectUri = request == null ? null : request.getRedirectUri();
    Map<String, Object> linkInput = request == null ? null : request.getLinkInput();
    return bankLinkService.initiateLinking(provider, userId, redirectUri, linkInput);
  }

  /** Unauthenticated; the provider signature is checked against the raw body. */
  @PostMapping("/webhook/{provider}")
  public WebhookResult webhook(@PathVariable String provider,
                               @RequestBody String rawBody,
                               @RequestHeader Map<String, String> headers) {
    return bankLinkService.handleWebhook(provider, rawBody, headers);
  }

  @PostMapping("/{bankLinkId}/sync")
  public List<AccountResponse> sync(@PathVariable UUID bankLinkId) {
    UUID userId = currentUserService.requireUserId();
    return bankLinkService.syncAccounts(bankLinkId, userId);
  }

  @PostMapping("/sync-all")
  public List<AccountResponse> syncAll() {
    UUID userId = currentUserService.requireUserId();
    return bankLinkService.syncAllAccounts(userId);
  }
}
