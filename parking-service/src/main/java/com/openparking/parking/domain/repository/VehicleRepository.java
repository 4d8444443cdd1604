package com.openparking.parking.domain.repository;

import com.openparking.parking.domain.model.Vehicle;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    boolean existsByPlateNumber(String plateNumber);

    List<Vehicle> findByUserId(Long userId);

    /**
     * SELECT ... FOR UPDATE on the vehicle row. Serializes the one-active-request check
     * for a vehicle across concurrent create/update calls.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Vehicle v WHERE v.id = :id")
    Optional<Vehicle> findByIdWithLock(@Param("id") Long id);

    /**
     * Owner's vehicles whose plate or type contains {@code search} (already lower-cased).
     */
    @Query("""
           SELECT v FROM Vehicle v
           WHERE v.userId = :userId
             AND (LOWER(v.plateNumber) LIKE CONCAT('%', :search, '%') ESCAPE '!'
                  OR LOWER(v.vehicleType) LIKE CONCAT('%', :search, '%') ESCAPE '!')
           """)
    Page<Vehicle> searchOwned(@Param("userId") Long userId, @Param("search") String search, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Vehicle v WHERE v.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);
}
