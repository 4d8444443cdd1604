package com.openparking.parking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Append-only audit record. Rows are only ever deleted by the user-deletion cascade.
 */
@Entity
@Table(name = "action_logs", indexes = {
        @Index(name = "idx_action_logs_user_id", columnList = "user_id"),
        @Index(name = "idx_action_logs_logged_at", columnList = "logged_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "action", nullable = false, length = 100)
    private String action;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "logged_at", nullable = false)
    private LocalDateTime timestamp;
}
