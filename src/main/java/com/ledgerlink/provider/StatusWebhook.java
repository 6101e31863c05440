package com.ledgerlink.provider;

import com.ledgerlink.model.BankLinkStatus;
import java.util.Map;

public record StatusWebhook(
    String itemId,
    String webhookCode,
    BankLinkStatus status,
    Map<String, Object> statusBody,
    boolean shouldSync) {}
