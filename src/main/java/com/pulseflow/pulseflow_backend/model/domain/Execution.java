package com.pulseflow.pulseflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pulseflow.pulseflow_backend.model.error.ErrorCategory;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "executions")
@Data
public class Execution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Bumped by every status transition so a stale copy cannot overwrite a stop or a timeout
    @Version
    @JsonIgnore
    private Long version;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Enumerated(EnumType.STRING)
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    @Column(name = "triggered_by")
    private String triggeredBy; // MANUAL, SCHEDULED

    // User-facing message of the classified failure
    private String error;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_category")
    private ErrorCategory errorCategory;

    @Column(name = "error_retryable")
    private Boolean errorRetryable;

    @Column(name = "error_detail", length = 4000)
    private String errorDetail;

    @Column(name = "failed_node_id")
    private String failedNodeId;

    @Column(name = "failed_node_type")
    private String failedNodeType;

    // Ordered node results and final context, saved when the run ends
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result_snapshot")
    private Map<String, Object> resultSnapshot;

    @Column(name = "started_at")
    private Instant startedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;
}
