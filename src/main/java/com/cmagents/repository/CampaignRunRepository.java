package com.cmagents.repository;

import com.cmagents.entity.CampaignRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link CampaignRun} entities.
 */
public interface CampaignRunRepository extends JpaRepository<CampaignRun, UUID> {

    Optional<CampaignRun> findByRunId(String runId);

    List<CampaignRun> findTop20ByBrandIdOrderByCreatedAtDesc(String brandId);
}
