package com.gocomet.tripsafety.sos.repository;

import com.gocomet.tripsafety.sos.model.SosLocationPoint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface SosLocationPointRepository extends JpaRepository<SosLocationPoint, UUID> {

    List<SosLocationPoint> findByAlertIdOrderByCapturedAtDesc(UUID alertId, Pageable pageable);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("delete from SosLocationPoint p where p.alertId = :alertId and p.capturedAt < :cutoff")
    int deleteOlderThan(@Param("alertId") UUID alertId, @Param("cutoff") Instant cutoff);
}
