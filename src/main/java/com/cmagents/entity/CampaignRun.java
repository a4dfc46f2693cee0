package com.cmagents.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "campaign_run")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false, unique = true, length = 64)
    private String runId;

    @Column(name = "brand_id", nullable = false, length = 100)
    private String brandId;

    @Column(name = "campaign_id", length = 100)
    private String campaignId;

    @Column(name = "objective", nullable = false, columnDefinition = "TEXT")
    private String objective;

    @Column(name = "plan_mode", length = 20)
    private String planMode;

    @Column(name = "worker_sequence", length = 200)
    private String workerSequence;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "artifact_path", columnDefinition = "TEXT")
    private String artifactPath;

    @Column(name = "cost_usd")
    private Double costUsd;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "generated_count")
    private Long generatedCount;

    @Column(name = "error_count")
    private Long errorCount;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
