package com.gocomet.tripsafety.sos.repository;

import com.gocomet.tripsafety.notification.model.ChannelType;
import com.gocomet.tripsafety.sos.model.SosChannelResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SosChannelResultRepository extends JpaRepository<SosChannelResult, UUID> {
    Optional<SosChannelResult> findByAlertIdAndChannel(UUID alertId, ChannelType channel);
    List<SosChannelResult> findByAlertIdOrderByChannelAsc(UUID alertId);
}
