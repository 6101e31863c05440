package com.ledgerlink.provider;

public record UpdateWebhook(String itemId, String type) {}
