package com.example.messenger.service;

import com.example.messenger.domain.Contact;
import java.util.Optional;

public interface ContactRepository {

    Optional<Contact> findById(String contactId);

    Optional<Contact> findByExternalId(String externalId);

    Contact create(Contact contact);

    void updateName(String contactId, String name);
}
