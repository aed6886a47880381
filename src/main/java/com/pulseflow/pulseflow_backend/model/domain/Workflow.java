package com.pulseflow.pulseflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * A user-authored automation. Each workflow owns a dedicated wallet whose key is stored encrypted.
 */
@Entity
@Table(name = "workflows")
@Data
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "wallet_address", nullable = false)
    private String walletAddress;

    // hex(salt | iv | authTag | ciphertext), see WalletKeyService
    @JsonIgnore
    @Column(name = "wallet_enc_key", nullable = false, length = 512)
    private String walletEncKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_mode", nullable = false)
    private TriggerMode triggerMode = TriggerMode.MANUAL;

    // Five-field cron (minute hour day-of-month month day-of-week), evaluated in UTC
    @Column(name = "cron_expression")
    private String cronExpression;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
