package com.ledgerlink.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlink.model.User;
import com.ledgerlink.repository.UserRepository;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
public class UserService {
  private static final Logger log = LoggerFactory.getLogger(UserService.class);
  private static final TypeReference<Map<String, Map<String, Object>>> DETAILS_TYPE = new TypeReference<>() {};

  private final UserRepository userRepository;
  private final ObjectMapper objectMapper;

  public UserService(UserRepository userRepository, ObjectMapper objectMapper) {
    this.userRepository = userRepository;
    this.objectMapper = objectMapper;
  }

  /** Owner's IANA zone; unknown users and invalid zone ids fall back to UTC. */
  public ZoneId getZone(UUID userId) {
    return userRepository.findById(userId)
        .map(User::getTimezone)
        .map(this::parseZone)
        .orElse(ZoneOffset.UTC);
  }

  /** Stored details for one provider; empty when the user or the provider entry is absent. */
  public Map<String, Object> getProviderDetails(UUID userId, String providerName) {
    return userRepository.findById(userId)
        .map(user -> readDetails(user).get(providerName))
        .orElse(Map.of());
  }

  @Transactional
  public void updateProviderDetails(UUID userId, String providerName, Map<String, Object> details) {
    User user = requireUser(userId);
    Map<String, Map<String, Object>> all = new HashMap<>(readDetails(user));
    all.put(providerName, details);
    try {
      user.setProviderDetails(objectMapper.writeValueAsString(all));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize provider details", ex);
    }
    userRepository.save(user);
  }

  private User requireUser(UUID userId) {
    return userRepository.findById(userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found"));
  }

  private Map<String, Map<String, Object>> readDetails(User user) {
    if (user.getProviderDetails() == null || user.getProviderDetails().isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(user.getProviderDetails(), DETAILS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Stored provider details for user " + user.getId() + " are not valid JSON", ex);
    }
  }

  private ZoneId parseZone(String timezone) {
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException ex) {
      log.warn("Invalid timezone '{}', using UTC", timezone);
      return ZoneOffset.UTC;
    }
  }
}
