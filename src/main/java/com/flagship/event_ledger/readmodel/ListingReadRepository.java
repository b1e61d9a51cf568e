package com.flagship.event_ledger.readmodel;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ListingReadRepository extends JpaRepository<ListingReadEntity, UUID> {

    @Query("""
        SELECT r FROM ListingReadEntity r
        WHERE r.status = 'PUBLISHED' AND r.deleted = false
        ORDER BY r.registeredCount DESC, r.id ASC
        """)
    List<ListingReadEntity> findTopPublished(Pageable page);
}
