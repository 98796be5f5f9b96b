package com.deliveryroute.tracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Key-value record backing the tracking store.
 *
 * One row per key, JSON payload, last write wins. No relational mapping of the
 * tracking state on purpose: the record is read and written whole.
 */
@Entity
@Table(
    name = "tracking_records",
    indexes = @Index(name = "idx_tracking_record_type", columnList = "record_type")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingRecord {

    @Id
    @Column(name = "record_key", length = 255)
    private String recordKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", nullable = false)
    private TrackingRecordType recordType;

    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        if (this.updatedAt == null) {
            this.updatedAt = LocalDateTime.now();
        }
    }
}
