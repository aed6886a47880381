package com.pulseflow.pulseflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "workflow_nodes",
       uniqueConstraints = @UniqueConstraint(columnNames = {"workflow_id", "node_id"}))
@Data
public class WorkflowNode {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    // Editor-assigned id, unique within the workflow (e.g. "swap-1712345678")
    @Column(name = "node_id", nullable = false)
    private String nodeId;

    // Wire names, aliases included; unknown tags load as null
    @Convert(converter = NodeTypeConverter.class)
    @Column(name = "node_type", nullable = false)
    private NodeType nodeType;

    private String label;

    // Node-specific configuration as written by the editor; amount fields hold AmountDescriptor JSON
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> config;

    // Canvas position, not used by the engine
    @Column(name = "position_x")
    private Double positionX;

    @Column(name = "position_y")
    private Double positionY;
}
