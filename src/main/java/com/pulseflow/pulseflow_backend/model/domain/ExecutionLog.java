package com.pulseflow.pulseflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "execution_logs")
@Data
public class ExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "execution_id", nullable = false)
    private UUID executionId;

    @Column(name = "node_id", nullable = false)
    private String nodeId;

    @Column(name = "node_type")
    private String nodeType;

    private int iteration;

    @Enumerated(EnumType.STRING)
    private NodeStatus status = NodeStatus.RUNNING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "output_snapshot")
    private Map<String, Object> outputSnapshot;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
