package com.ledgerlink.model;

public enum SnapshotType {
  SYNC,
  USER_UPDATE,
  FORWARD_FILL
}
