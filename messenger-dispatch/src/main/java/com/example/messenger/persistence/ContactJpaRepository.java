package com.example.messenger.persistence;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContactJpaRepository extends JpaRepository<ContactEntity, String> {

    Optional<ContactEntity> findByExternalId(String externalId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ContactEntity c set c.name = :name where c.id = :id")
    int updateName(@Param("id") String id, @Param("name") String name);
}
