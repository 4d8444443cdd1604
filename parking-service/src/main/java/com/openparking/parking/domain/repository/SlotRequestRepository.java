package com.openparking.parking.domain.repository;

import com.openparking.parking.domain.model.SlotRequest;
import com.openparking.parking.domain.model.SlotRequest.RequestStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SlotRequestRepository extends JpaRepository<SlotRequest, Long>, JpaSpecificationExecutor<SlotRequest> {

    /**
     * SELECT ... FOR UPDATE on the request row. Every lifecycle transition reads through this
     * so two concurrent transitions of the same request serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM SlotRequest r WHERE r.id = :id")
    Optional<SlotRequest> findByIdWithLock(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM SlotRequest r WHERE r.userId = :userId")
    List<SlotRequest> findAllByUserIdWithLock(@Param("userId") Long userId);

    Optional<SlotRequest> findFirstByVehicleIdAndRequestStatusIn(Long vehicleId, Collection<RequestStatus> statuses);

    Optional<SlotRequest> findFirstByVehicleIdAndRequestStatusInAndIdNot(
            Long vehicleId, Collection<RequestStatus> statuses, Long excludedId);

    long countByVehicleIdAndRequestStatusIn(Long vehicleId, Collection<RequestStatus> statuses);

    boolean existsBySlotIdAndRequestStatus(Long slotId, RequestStatus status);

    List<SlotRequest> findByUserId(Long userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM SlotRequest r WHERE r.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);
}
