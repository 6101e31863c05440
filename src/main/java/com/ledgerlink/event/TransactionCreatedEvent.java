package com.ledgerlink.event;

public record TransactionCreatedEvent(TransactionState transaction) {}
