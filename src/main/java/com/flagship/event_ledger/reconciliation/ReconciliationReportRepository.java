package com.flagship.event_ledger.reconciliation;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReconciliationReportRepository extends JpaRepository<ReconciliationReportEntity, UUID> {

    Page<ReconciliationReportEntity> findAllByOrderByStartedAtDesc(Pageable page);

    Optional<ReconciliationReportEntity> findFirstByReportTypeInAndStatusInOrderByCompletedAtDesc(
            Collection<ReportType> types, Collection<ReportStatus> statuses);
}
