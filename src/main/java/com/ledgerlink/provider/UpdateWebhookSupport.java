package com.ledgerlink.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/** Provider announces new data for an existing link through webhooks. */
public interface UpdateWebhookSupport {
  Optional<UpdateWebhook> parseUpdateWebhook(JsonNode payload);
}
