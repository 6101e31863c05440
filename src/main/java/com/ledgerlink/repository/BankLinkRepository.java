package com.ledgerlink.repository;

import com.ledgerlink.model.BankLink;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BankLinkRepository extends JpaRepository<BankLink, UUID> {
  List<BankLink> findByUserId(UUID userId);
  Optional<BankLink> findByIdAndUserId(UUID id, UUID userId);
  Optional<BankLink> findFirstByProviderNameAndExternalItemId(String providerName, String externalItemId);
  List<BankLink> findByProviderNameIn(Collection<String> providerNames);
  List<BankLink> findByProviderNameAndExternalItemIdIsNull(String providerName);
}
