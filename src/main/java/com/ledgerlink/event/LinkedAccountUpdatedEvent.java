package com.ledgerlink.event;

public record LinkedAccountUpdatedEvent(LinkedAccountState account) {}
