package com.flagship.event_ledger.reconciliation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "reconciliation_inconsistencies")
@Getter
@NoArgsConstructor
public class InconsistencyEntity {

    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "report_id", nullable = false)
    private ReconciliationReportEntity report;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private InconsistencyKind kind;

    @Column(name = "entity_id", nullable = false, length = 128)
    private String entityId;

    /** JSON object. */
    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "item_position", nullable = false)
    private int position;

    static InconsistencyEntity of(ReconciliationReportEntity report, Inconsistency inconsistency,
                                  String details, int position) {
        InconsistencyEntity entity = new InconsistencyEntity();
        entity.id = UUID.randomUUID();
        entity.report = report;
        entity.kind = inconsistency.getKind();
        entity.entityId = inconsistency.getEntityId();
        entity.details = details;
        entity.detectedAt = inconsistency.getDetectedAt();
        entity.position = position;
        return entity;
    }
}
