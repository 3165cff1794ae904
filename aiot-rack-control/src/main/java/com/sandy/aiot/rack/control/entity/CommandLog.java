package com.sandy.aiot.rack.control.entity;

import com.sandy.aiot.rack.control.model.Actuator;
import com.sandy.aiot.rack.control.model.CommandOutcome;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Audit row for one resolved command. Written once when the command reaches its terminal
 * state and never updated afterwards.
 */
@Entity
@Table(name = "command_log", indexes = @Index(name = "idx_command_log_rack", columnList = "rackId,resolvedAt"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 36, nullable = false, unique = true)
    private String commandId;

    @Column(length = 64, nullable = false)
    private String rackId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private Actuator actuator;

    private int desiredValue;
    /** Value reported by the device, null when the command expired. */
    private Integer achievedValue;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private CommandOutcome outcome;

    private Instant issuedAt;
    private Instant resolvedAt;
    private long latencyMs;
}
