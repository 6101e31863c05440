package com.ledgerlink.event;

public record TransactionDeletedEvent(TransactionState transaction) {}
