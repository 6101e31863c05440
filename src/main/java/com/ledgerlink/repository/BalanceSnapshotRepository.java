package com.ledgerlink.repository;

import com.ledgerlink.model.BalanceSnapshot;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BalanceSnapshotRepository extends JpaRepository<BalanceSnapshot, UUID> {
  Optional<BalanceSnapshot> findByAccountIdAndSnapshotDate(UUID accountId, LocalDate snapshotDate);

  Optional<BalanceSnapshot> findFirstByAccountIdAndSnapshotDateBeforeOrderBySnapshotDateDesc(
      UUID accountId, LocalDate snapshotDate);

  List<BalanceSnapshot> findByAccountIdAndUserIdOrderBySnapshotDateAsc(UUID accountId, UUID userId);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update BalanceSnapshot s " +
      "set s.currentBalance.amount = s.currentBalance.amount + :delta, " +
      "s.availableBalance.amount = s.availableBalance.amount + :delta " +
      "where s.accountId = :accountId " +
      "and s.snapshotDate >= :fromDate and s.snapshotDate <= :toDate")
  int shiftRange(@Param("accountId") UUID accountId,
                 @Param("fromDate") LocalDate fromDate,
                 @Param("toDate") LocalDate toDate,
                 @Param("delta") long delta);
}
