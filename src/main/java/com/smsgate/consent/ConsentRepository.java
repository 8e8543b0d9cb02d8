package com.smsgate.consent;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConsentRepository extends JpaRepository<ConsentRecord, UUID> {

    List<ConsentRecord> findByTenantIdAndPhoneNumber(String tenantId, String phoneNumber);

    Optional<ConsentRecord> findByTenantIdAndPhoneNumberAndType(String tenantId, String phoneNumber, ConsentType type);
}
