package com.ledgerlink.repository;

import com.ledgerlink.model.AccountTransaction;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountTransactionRepository extends JpaRepository<AccountTransaction, UUID> {
  List<AccountTransaction> findByUserIdAndAccountIdOrderByDateDesc(UUID userId, UUID accountId);
  List<AccountTransaction> findByUserIdOrderByDateDesc(UUID userId);
  Optional<AccountTransaction> findByIdAndUserId(UUID id, UUID userId);
}
