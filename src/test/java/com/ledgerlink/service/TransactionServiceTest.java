package com.ledgerlink.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ledgerlink.dto.CreateTransactionRequest;
import com.ledgerlink.dto.TransactionResponse;
import com.ledgerlink.dto.UpdateTransactionRequest;
import com.ledgerlink.event.TransactionCreatedEvent;
import com.ledgerlink.event.TransactionDeletedEvent;
import com.ledgerlink.event.TransactionUpdatedEvent;
import com.ledgerlink.model.AccountTransaction;
import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.MoneyColumns;
import com.ledgerlink.model.MoneySign;
import com.ledgerlink.repository.AccountTransactionRepository;
import com.ledgerlink.repository.FinancialAccountRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class TransactionServiceTest {
  private static final UUID USER_ID = UUID.randomUUID();

  @Mock
  private AccountTransactionRepository transactionRepository;

  @Mock
  private FinancialAccountRepository accountRepository;

  @Mock
  private ApplicationEventPublisher eventPublisher;

  private TransactionService service;
  private FinancialAccount account;

  @BeforeEach
  void setUp() {
    service = new TransactionService(transactionRepository, accountRepository, eventPublisher);
    account = new FinancialAccount();
    account.setId(UUID.randomUUID());
    account.setUserId(USER_ID);
    account.setCurrentBalance(new MoneyColumns(100000, "USD"));
    account.setAvailableBalance(new MoneyColumns(100000, "USD"));
  }

  private AccountTransaction existingTransaction() {
    AccountTransaction transaction = new AccountTransaction();
    transaction.setId(UUID.randomUUID());
    transaction.setUserId(USER_ID);
    transaction.setAccountId(account.getId());
    transaction.setAmount(new MoneyColumns(-50000, "USD"));
    transaction.setDate(LocalDate.of(2024, 1, 10));
    return transaction;
  }

  @Test
  @DisplayName("Should store a debit in minor units and publish a created event")
  void createsTransaction() {
    // Given
    CreateTransactionRequest request = new CreateTransactionRequest();
    request.setAccountId(account.getId());
    request.setAmount(new BigDecimal("500.00"));
    request.setCurrency("usd");
    request.setSign(MoneySign.NEGATIVE);
    request.setDate(LocalDate.of(2024, 1, 10));
    when(accountRepository.findByIdAndUserId(account.getId(), USER_ID)).thenReturn(Optional.of(account));
    when(transactionRepository.save(any(AccountTransaction.class))).thenAnswer(invocation -> {
      AccountTransaction saved = invocation.getArgument(0);
      saved.setId(UUID.randomUUID());
      return saved;
    });

    // When
    TransactionResponse response = service.createTransaction(USER_ID, request);

    // Then
    assertThat(response.getAmount().signedAmount()).isEqualTo(-50000);
    ArgumentCaptor<TransactionCreatedEvent> event = ArgumentCaptor.forClass(TransactionCreatedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().transaction().amount().signedAmount()).isEqualTo(-50000);
    assertThat(event.getValue().transaction().accountId()).isEqualTo(account.getId());
  }

  @Test
  @DisplayName("Should refuse a transaction in another currency than its account")
  void rejectsCurrencyMismatch() {
    CreateTransactionRequest request = new CreateTransactionRequest();
    request.setAccountId(account.getId());
    request.setAmount(BigDecimal.TEN);
    request.setCurrency("EUR");
    request.setSign(MoneySign.POSITIVE);
    request.setDate(LocalDate.of(2024, 1, 10));
    when(accountRepository.findByIdAndUserId(account.getId(), USER_ID)).thenReturn(Optional.of(account));

    assertThatThrownBy(() -> service.createTransaction(USER_ID, request))
        .isInstanceOfSatisfying(ResponseStatusException.class,
            ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
    verify(transactionRepository, never()).save(any());
  }

  @Test
  @DisplayName("Should publish the previous and current state on update")
  void updatePublishesBothStates() {
    // Given
    AccountTransaction transaction = existingTransaction();
    when(transactionRepository.findByIdAndUserId(transaction.getId(), USER_ID)).thenReturn(Optional.of(transaction));
    when(accountRepository.findByIdAndUserId(account.getId(), USER_ID)).thenReturn(Optional.of(account));
    when(transactionRepository.save(transaction)).thenReturn(transaction);
    UpdateTransactionRequest request = new UpdateTransactionRequest();
    request.setAmount(new BigDecimal("450"));
    request.setDate(LocalDate.of(2024, 1, 12));

    // When
    service.updateTransaction(USER_ID, transaction.getId(), request);

    // Then
    ArgumentCaptor<TransactionUpdatedEvent> event = ArgumentCaptor.forClass(TransactionUpdatedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().previous().amount().signedAmount()).isEqualTo(-50000);
    assertThat(event.getValue().previous().date()).isEqualTo(LocalDate.of(2024, 1, 10));
    assertThat(event.getValue().current().amount().signedAmount()).isEqualTo(-45000);
    assertThat(event.getValue().current().date()).isEqualTo(LocalDate.of(2024, 1, 12));
  }

  @Test
  @DisplayName("Should publish the deleted state")
  void deletePublishesState() {
    AccountTransaction transaction = existingTransaction();
    when(transactionRepository.findByIdAndUserId(transaction.getId(), USER_ID)).thenReturn(Optional.of(transaction));

    service.deleteTransaction(USER_ID, transaction.getId());

    verify(transactionRepository).delete(transaction);
    ArgumentCaptor<TransactionDeletedEvent> event = ArgumentCaptor.forClass(TransactionDeletedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().transaction().transactionId()).isEqualTo(transaction.getId());
  }

  @Test
  @DisplayName("Should answer NOT_FOUND for another user's transaction")
  void unknownTransaction() {
    UUID transactionId = UUID.randomUUID();
    when(transactionRepository.findByIdAndUserId(transactionId, USER_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deleteTransaction(USER_ID, transactionId))
        .isInstanceOfSatisfying(ResponseStatusException.class,
            ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
  }
}
