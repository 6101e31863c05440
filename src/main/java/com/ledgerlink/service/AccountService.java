package com.ledgerlink.service;

import com.ledgerlink.dto.AccountResponse;
import com.ledgerlink.dto.CreateAccountRequest;
import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.MoneyColumns;
import com.ledgerlink.model.MoneyWithSign;
import com.ledgerlink.repository.FinancialAccountRepository;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {
  private final FinancialAccountRepository accountRepository;

  public AccountService(FinancialAccountRepository accountRepository) {
    this.accountRepository = accountRepository;
  }

  @Transactional(readOnly = true)
  public List<AccountResponse> listAccounts(UUID userId) {
    return accountRepository.findByUserId(userId).stream().map(AccountResponse::from).toList();
  }

  /** Manual account: no bank link and no external id, balances move only through transactions. */
  @Transactional
  public AccountResponse createManualAccount(UUID userId, CreateAccountRequest request) {
    MoneyWithSign opening = MoneyWithSign.fromDecimal(request.getOpeningBalance(), request.getCurrency());
    FinancialAccount account = new FinancialAccount();
    account.setUserId(userId);
    account.setName(request.getName());
    account.setType(request.getType() == null ? "manual" : request.getType());
    account.setCurrentBalance(MoneyColumns.of(opening));
    account.setAvailableBalance(MoneyColumns.of(opening));
    return AccountResponse.from(accountRepository.save(account));
  }
}
