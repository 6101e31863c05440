package com.ledgerlink.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlink.model.User;
import com.ledgerlink.repository.UserRepository;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {
  private static final UUID USER_ID = UUID.randomUUID();

  @Mock
  private UserRepository userRepository;

  private UserService service;

  @BeforeEach
  void setUp() {
    service = new UserService(userRepository, new ObjectMapper());
  }

  private User user(String timezone, String providerDetails) {
    User user = new User();
    user.setId(USER_ID);
    user.setEmail("ada@example.com");
    user.setTimezone(timezone);
    user.setProviderDetails(providerDetails);
    return user;
  }

  @Test
  @DisplayName("Should use the stored zone and fall back to UTC")
  void resolvesZone() {
    when(userRepository.findById(USER_ID))
        .thenReturn(Optional.of(user("America/New_York", null)))
        .thenReturn(Optional.of(user("Mars/Olympus", null)))
        .thenReturn(Optional.empty());

    assertThat(service.getZone(USER_ID)).isEqualTo(ZoneId.of("America/New_York"));
    assertThat(service.getZone(USER_ID)).isEqualTo(ZoneOffset.UTC);
    assertThat(service.getZone(USER_ID)).isEqualTo(ZoneOffset.UTC);
  }

  @Test
  @DisplayName("Should keep other providers' details when storing one provider")
  void mergesProviderDetails() {
    // Given
    User user = user("UTC", "{\"crypto\":{\"network\":\"ethereum\"}}");
    when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user));

    // When
    service.updateProviderDetails(USER_ID, "plaid", Map.of("userToken", "user-token-1"));

    // Then
    verify(userRepository).save(user);
    assertThat(service.getProviderDetails(USER_ID, "plaid")).containsEntry("userToken", "user-token-1");
    assertThat(service.getProviderDetails(USER_ID, "crypto")).containsEntry("network", "ethereum");
    assertThat(service.getProviderDetails(USER_ID, "tatum")).isEmpty();
  }

  @Test
  @DisplayName("Should read no details for an unknown user")
  void unknownUserHasNoDetails() {
    when(userRepository.findById(USER_ID)).thenReturn(Optional.empty());

    assertThat(service.getProviderDetails(USER_ID, "plaid")).isEmpty();
  }
}
