package com.gocomet.tripsafety.sos.repository;

import com.gocomet.tripsafety.sos.model.SosAlert;
import com.gocomet.tripsafety.sos.model.SosState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * State changes are conditional updates guarded by the states they may start
 * from. A return value of 0 means the alert was not in one of them.
 */
@Repository
public interface SosAlertRepository extends JpaRepository<SosAlert, UUID> {

    Optional<SosAlert> findFirstByTripIdAndStateInOrderByTriggeredAtDesc(UUID tripId, Collection<SosState> states);

    List<SosAlert> findByStateOrderByTriggeredAtDesc(SosState state, Pageable pageable);

    List<SosAlert> findAllByOrderByTriggeredAtDesc(Pageable pageable);

    long countByState(SosState state);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SosAlert a set a.state = :to where a.id = :id and a.state in :from")
    int transition(@Param("id") UUID id,
                   @Param("from") Collection<SosState> from,
                   @Param("to") SosState to);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SosAlert a set a.state = :to, a.escalatedAt = :now where a.id = :id and a.state in :from")
    int escalate(@Param("id") UUID id,
                 @Param("from") Collection<SosState> from,
                 @Param("to") SosState to,
                 @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SosAlert a set a.state = :to, a.acknowledgedBy = :operatorId, a.acknowledgedAt = :now " +
            "where a.id = :id and a.state in :from")
    int acknowledge(@Param("id") UUID id,
                    @Param("from") Collection<SosState> from,
                    @Param("to") SosState to,
                    @Param("operatorId") String operatorId,
                    @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SosAlert a set a.state = :to, a.resolvedBy = :resolvedBy, a.resolvedAt = :now, " +
            "a.resolution = :resolution, a.activeTripId = null where a.id = :id and a.state in :from")
    int resolve(@Param("id") UUID id,
                @Param("from") Collection<SosState> from,
                @Param("to") SosState to,
                @Param("resolvedBy") String resolvedBy,
                @Param("resolution") String resolution,
                @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SosAlert a set a.lastLat = :lat, a.lastLng = :lng, a.lastLocationAt = :capturedAt " +
            "where a.id = :id and a.state in :open " +
            "and (a.lastLocationAt is null or a.lastLocationAt < :capturedAt)")
    int updateLastLocation(@Param("id") UUID id,
                           @Param("open") Collection<SosState> open,
                           @Param("lat") double lat,
                           @Param("lng") double lng,
                           @Param("capturedAt") Instant capturedAt);

    /**
     * {@link #resolve} plus the operator's actions, committed together. Actions are
     * only added when this call performed the transition.
     */
    @Transactional
    default int resolveWithActions(UUID id, Collection<SosState> from, SosState to, String resolvedBy,
                                   String resolution, Instant now, List<String> actionsTaken) {
        int updated = resolve(id, from, to, resolvedBy, resolution, now);
        if (updated == 1 && actionsTaken != null && !actionsTaken.isEmpty()) {
            findById(id).ifPresent(alert -> {
                alert.getActionsTaken().addAll(actionsTaken);
                save(alert);
            });
        }
        return updated;
    }
}
