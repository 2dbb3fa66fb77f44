package com.sandy.aiot.pump.incidents.repository;

import com.sandy.aiot.pump.incidents.entity.ConditionType;
import com.sandy.aiot.pump.incidents.entity.Incident;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IncidentRepository extends JpaRepository<Incident, Long>, JpaSpecificationExecutor<Incident> {

    /**
     * Open incidents for a key, row-locked until the surrounding transaction ends.
     * Newest first; more than one row means the single-open invariant was broken.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from Incident i where i.device = :device and i.conditionType = :type and i.active = true order by i.timestamp desc")
    List<Incident> findOpenForUpdate(@Param("device") String device, @Param("type") ConditionType type);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from Incident i where i.id = :id")
    Optional<Incident> findByIdForUpdate(@Param("id") Long id);

    List<Incident> findByDeviceAndConditionTypeAndActiveTrue(String device, ConditionType conditionType);

    long countByActiveTrue();
}
