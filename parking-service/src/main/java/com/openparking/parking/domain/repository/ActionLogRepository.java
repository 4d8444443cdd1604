package com.openparking.parking.domain.repository;

import com.openparking.parking.domain.model.ActionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ActionLogRepository extends JpaRepository<ActionLog, Long> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ActionLog a WHERE a.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);
}
