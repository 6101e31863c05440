package com.ledgerlink.service;

import com.ledgerlink.dto.CreateTransactionRequest;
import com.ledgerlink.dto.TransactionResponse;
import com.ledgerlink.dto.UpdateTransactionRequest;
import com.ledgerlink.event.TransactionCreatedEvent;
import com.ledgerlink.event.TransactionDeletedEvent;
import com.ledgerlink.event.TransactionState;
import com.ledgerlink.event.TransactionUpdatedEvent;
import com.ledgerlink.model.AccountTransaction;
import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.MoneyColumns;
import com.ledgerlink.model.MoneySign;
import com.ledgerlink.model.MoneyWithSign;
import com.ledgerlink.repository.AccountTransactionRepository;
import com.ledgerlink.repository.FinancialAccountRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
public class TransactionService {
  private final AccountTransactionRepository transactionRepository;
  private final FinancialAccountRepository accountRepository;
  private final ApplicationEventPublisher eventPublisher;

  public TransactionService(AccountTransactionRepository transactionRepository,
                            FinancialAccountRepository accountRepository,
                            ApplicationEventPublisher eventPublisher) {
    this.transactionRepository = transactionRepository;
    this.accountRepository = accountRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public List<TransactionResponse> listTransactions(UUID userId, UUID accountId) {
    List<AccountTransaction> transactions = accountId == null
        ? transactionRepository.findByUserIdOrderByDateDesc(userId)
        : transactionRepository.findByUserIdAndAccountIdOrderByDateDesc(userId, accountId);
    return transactions.stream().map(TransactionResponse::from).toList();
  }

  @Transactional
  public TransactionResponse createTransaction(UUID userId, CreateTransactionRequest request) {
    FinancialAccount account = requireAccount(userId, request.getAccountId());
    AccountTransaction transaction = new AccountTransaction();
    transaction.setUserId(userId);
    transaction.setAccountId(account.getId());
    transaction.setAmount(MoneyColumns.of(toMoney(account, request.getAmount(), request.getCurrency(), request.getSign())));
    transaction.setDate(request.getDate());
    transaction.setMerchantName(request.getMerchantName());
    transaction.setDescription(request.getDescription());
    transaction.setPending(request.isPending());
    AccountTransaction saved = transactionRepository.save(transaction);
    eventPublisher.publishEvent(new TransactionCreatedEvent(TransactionState.of(saved)));
    return TransactionResponse.from(saved);
  }

  @Transactional
  public TransactionResponse updateTransaction(UUID userId, UUID transactionId, UpdateTransactionRequest request) {
    AccountTransaction transaction = requireTransaction(userId, transactionId);
    TransactionState previous = TransactionState.of(transaction);

    FinancialAccount account = requireAccount(userId,
        request.getAccountId() == null ? transaction.getAccountId() : request.getAccountId());
    MoneyWithSign currentAmount = transaction.getAmount().toMoney();
    if (request.getAmount() != null || request.getSign() != null || request.getAccountId() != null) {
      BigDecimal amount = request.getAmount() == null ? currentAmount.toDecimal().abs() : request.getAmount();
      MoneySign sign = request.getSign() == null ? currentAmount.sign() : request.getSign();
      transaction.setAmount(MoneyColumns.of(toMoney(account, amount, currentAmount.currency(), sign)));
    }
    transaction.setAccountId(account.getId());
    if (request.getDate() != null) {
      transaction.setDate(request.getDate());
    }
    if (request.getMerchantName() != null) {
      transaction.setMerchantName(request.getMerchantName());
    }
    if (request.getDescription() != null) {
      transaction.setDescription(request.getDescription());
    }
    if (request.getPending() != null) {
      transaction.setPending(request.getPending());
    }
    AccountTransaction saved = transactionRepository.save(transaction);
    eventPublisher.publishEvent(new TransactionUpdatedEvent(previous, TransactionState.of(saved)));
    return TransactionResponse.from(saved);
  }

  @Transactional
  public void deleteTransaction(UUID userId, UUID transactionId) {
    AccountTransaction transaction = requireTransaction(userId, transactionId);
    TransactionState state = TransactionState.of(transaction);
    transactionRepository.delete(transaction);
    eventPublisher.publishEvent(new TransactionDeletedEvent(state));
  }

  private MoneyWithSign toMoney(FinancialAccount account, BigDecimal amount, String currency, MoneySign sign) {
    String accountCurrency = account.getCurrentBalance().getCurrency();
    if (!accountCurrency.equalsIgnoreCase(currency)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
          "Transaction currency " + currency.toUpperCase(Locale.ROOT) + " does not match account currency " + accountCurrency);
    }
    MoneyWithSign magnitude = MoneyWithSign.fromDecimal(amount.abs(), accountCurrency);
    return new MoneyWithSign(magnitude.amount(), accountCurrency, sign);
  }

  private FinancialAccount requireAccount(UUID userId, UUID accountId) {
    return accountRepository.findByIdAndUserId(accountId, userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Account not found"));
  }

  private AccountTransaction requireTransaction(UUID userId, UUID transactionId) {
    return transactionRepository.findByIdAndUserId(transactionId, userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Transaction not found"));
  }
}
