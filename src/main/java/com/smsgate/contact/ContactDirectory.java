package com.smsgate.contact;

import java.util.Optional;

/**
 * Looks up the tenant-independent contact owning a phone number. Contact management
 * itself lives outside this service.
 */
public interface ContactDirectory {

    Optional<Contact> findContactByPhone(String normalizedPhone);
}
