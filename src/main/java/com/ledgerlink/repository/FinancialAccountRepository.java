package com.ledgerlink.repository;

import com.ledgerlink.model.FinancialAccount;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FinancialAccountRepository extends JpaRepository<FinancialAccount, UUID> {
  List<FinancialAccount> findByUserId(UUID userId);
  Optional<FinancialAccount> findByIdAndUserId(UUID id, UUID userId);
  List<FinancialAccount> findByUserIdAndExternalAccountIdIn(UUID userId, Collection<String> externalAccountIds);

  /**
   * Shifts both balances by {@code delta} minor units in a single statement, so concurrent
   * adjustments to the same account serialize on the row lock instead of overwriting each other.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update FinancialAccount a " +
      "set a.currentBalance.amount = a.currentBalance.amount + :delta, " +
      "a.availableBalance.amount = a.availableBalance.amount + :delta " +
      "where a.id = :accountId")
  int applyBalanceDelta(@Param("accountId") UUID accountId, @Param("delta") long delta);
}
