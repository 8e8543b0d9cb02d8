package com.smsgate.message;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MessageRepository extends JpaRepository<Message, UUID> {

    Optional<Message> findByTenantIdAndExternalId(String tenantId, String externalId);

    Optional<Message> findByIdAndTenantId(UUID id, String tenantId);

    long countByTenantIdAndStatus(String tenantId, MessageStatus status);
}
