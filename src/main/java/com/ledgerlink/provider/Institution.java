package com.ledgerlink.provider;

public record Institution(String id, String name) {}
