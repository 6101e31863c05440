package com.ledgerlink.event;

public record LinkedAccountCreatedEvent(LinkedAccountState account) {}
