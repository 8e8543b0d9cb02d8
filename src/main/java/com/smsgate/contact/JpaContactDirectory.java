package com.smsgate.contact;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
public class JpaContactDirectory implements ContactDirectory {

    private final ContactPhoneRepository contactPhoneRepository;

    public JpaContactDirectory(ContactPhoneRepository contactPhoneRepository) {
        this.contactPhoneRepository = contactPhoneRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Contact> findContactByPhone(String normalizedPhone) {
        return contactPhoneRepository.findByPhoneNumber(normalizedPhone)
                .map(p -> new Contact(p.getContactId(), p.getDisplayName()));
    }
}
