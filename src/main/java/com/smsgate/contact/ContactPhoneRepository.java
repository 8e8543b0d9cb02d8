package com.smsgate.contact;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContactPhoneRepository extends JpaRepository<ContactPhone, UUID> {

    Optional<ContactPhone> findByPhoneNumber(String phoneNumber);
}
