package com.deliveryroute.tracking.repository;

import com.deliveryroute.tracking.entity.TrackingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TrackingRecordRepository extends JpaRepository<TrackingRecord, String> {
}
