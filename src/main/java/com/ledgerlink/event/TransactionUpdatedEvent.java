package com.ledgerlink.event;

public record TransactionUpdatedEvent(TransactionState previous, TransactionState current) {}
