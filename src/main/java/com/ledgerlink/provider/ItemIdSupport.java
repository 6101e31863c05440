package com.ledgerlink.provider;

import java.util.Map;

/** Provider can resolve the item identifier for stored credentials. */
public interface ItemIdSupport {
  String getItemId(Map<String, Object> authentication);
}
