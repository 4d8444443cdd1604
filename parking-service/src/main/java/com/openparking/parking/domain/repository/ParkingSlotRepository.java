package com.openparking.parking.domain.repository;

import com.openparking.parking.domain.model.ParkingSlot;
import com.openparking.parking.domain.model.ParkingSlot.SlotStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ParkingSlot.
 * Holds the compatibility queries used by the slot matcher and the guarded
 * status UPDATE used to claim a slot.
 */
public interface ParkingSlotRepository extends JpaRepository<ParkingSlot, Long> {

    boolean existsBySlotNumber(String slotNumber);

    /**
     * All slots in {@code status} that fit a vehicle of the given size and type, oldest first.
     * Ties on creation time are broken by id so the order is stable.
     */
    @Query("""
           SELECT s FROM ParkingSlot s
           WHERE s.status = :status
             AND s.size = :size
             AND (s.vehicleType = :vehicleType OR LOWER(s.vehicleType) = :wildcard)
           ORDER BY s.createdAt ASC, s.id ASC
           """)
    List<ParkingSlot> findCompatible(@Param("status") SlotStatus status,
                                     @Param("size") String size,
                                     @Param("vehicleType") String vehicleType,
                                     @Param("wildcard") String wildcard);

    /**
     * The given slot, only if it fits the vehicle under the same predicate as {@link #findCompatible}.
     */
    @Query("""
           SELECT s FROM ParkingSlot s
           WHERE s.id = :id
             AND s.status = :status
             AND s.size = :size
             AND (s.vehicleType = :vehicleType OR LOWER(s.vehicleType) = :wildcard)
           """)
    Optional<ParkingSlot> findCompatibleById(@Param("id") Long id,
                                             @Param("status") SlotStatus status,
                                             @Param("size") String size,
                                             @Param("vehicleType") String vehicleType,
                                             @Param("wildcard") String wildcard);

    default List<ParkingSlot> findAvailableFor(String size, String vehicleType) {
        return findCompatible(SlotStatus.AVAILABLE, size, vehicleType, ParkingSlot.ANY_VEHICLE_TYPE);
    }

    default Optional<ParkingSlot> findAvailableByIdFor(Long id, String size, String vehicleType) {
        return findCompatibleById(id, SlotStatus.AVAILABLE, size, vehicleType, ParkingSlot.ANY_VEHICLE_TYPE);
    }

    /**
     * Moves a slot from one status to another in a single UPDATE guarded by the expected
     * current status (compare-and-swap).
     *
     * Returns the number of rows affected:
     * - 1: the slot was in {@code expected} and now is in {@code target}
     * - 0: the slot does not exist or someone else changed it first
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE ParkingSlot s
           SET s.status = :target, s.updatedAt = :now
           WHERE s.id = :id
             AND s.status = :expected
           """)
    int compareAndSetStatus(@Param("id") Long id,
                            @Param("expected") SlotStatus expected,
                            @Param("target") SlotStatus target,
                            @Param("now") LocalDateTime now);

    default boolean claimIfAvailable(Long id) {
        return compareAndSetStatus(id, SlotStatus.AVAILABLE, SlotStatus.UNAVAILABLE, LocalDateTime.now()) == 1;
    }

    /**
     * AVAILABLE to MAINTENANCE, guarded like {@link #claimIfAvailable}; takes the slot out of matching.
     */
    default boolean takeOutOfService(Long id) {
        return compareAndSetStatus(id, SlotStatus.AVAILABLE, SlotStatus.MAINTENANCE, LocalDateTime.now()) == 1;
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE ParkingSlot s
           SET s.status = :available, s.updatedAt = :now
           WHERE s.id IN :ids
             AND s.status = :unavailable
           """)
    int release(@Param("ids") Collection<Long> ids,
                @Param("available") SlotStatus available,
                @Param("unavailable") SlotStatus unavailable,
                @Param("now") LocalDateTime now);

    default int releaseAll(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return release(ids, SlotStatus.AVAILABLE, SlotStatus.UNAVAILABLE, LocalDateTime.now());
    }

    @Query("""
           SELECT s FROM ParkingSlot s
           WHERE LOWER(s.slotNumber) LIKE CONCAT('%', :search, '%') ESCAPE '!'
              OR LOWER(s.vehicleType) LIKE CONCAT('%', :search, '%') ESCAPE '!'
              OR LOWER(s.size) LIKE CONCAT('%', :search, '%') ESCAPE '!'
              OR LOWER(s.location) LIKE CONCAT('%', :search, '%') ESCAPE '!'
           """)
    Page<ParkingSlot> search(@Param("search") String search, Pageable pageable);

    @Query("""
           SELECT s FROM ParkingSlot s
           WHERE s.status = :status
             AND (LOWER(s.slotNumber) LIKE CONCAT('%', :search, '%') ESCAPE '!'
                  OR LOWER(s.vehicleType) LIKE CONCAT('%', :search, '%') ESCAPE '!'
                  OR LOWER(s.size) LIKE CONCAT('%', :search, '%') ESCAPE '!'
                  OR LOWER(s.location) LIKE CONCAT('%', :search, '%') ESCAPE '!')
           """)
    Page<ParkingSlot> searchByStatus(@Param("status") SlotStatus status,
                                     @Param("search") String search,
                                     Pageable pageable);
}
