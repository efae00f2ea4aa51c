package com.example.messenger.persistence;

import com.example.messenger.domain.Contact;
import com.example.messenger.service.ContactRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaContactRepository implements ContactRepository {

    private final ContactJpaRepository contactJpaRepository;
    private final MessengerEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Contact> findById(String contactId) {
        return contactJpaRepository.findById(contactId).map(mapper::toContact);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Contact> findByExternalId(String externalId) {
        return contactJpaRepository.findByExternalId(externalId).map(mapper::toContact);
    }

    @Override
    @Transactional
    public Contact create(Contact contact) {
        return mapper.toContact(contactJpaRepository.saveAndFlush(mapper.toEntity(contact)));
    }

    @Override
    @Transactional
    public void updateName(String contactId, String name) {
        contactJpaRepository.updateName(contactId, name);
    }
}
