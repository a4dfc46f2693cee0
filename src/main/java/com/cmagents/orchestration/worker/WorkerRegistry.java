package com.cmagents.orchestration.worker;

import com.cmagents.orchestration.model.WorkerName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class WorkerRegistry {

    private final Map<WorkerName, CampaignWorker> workers = new EnumMap<>(WorkerName.class);

    public WorkerRegistry(List<CampaignWorker> candidates) {
        for (CampaignWorker worker : candidates) {
            CampaignWorker previous = workers.putIfAbsent(worker.name(), worker);
            if (previous != null) {
                throw new IllegalStateException("Two workers registered for step " + worker.name().key() + ": "
                        + previous.getClass().getSimpleName() + " and " + worker.getClass().getSimpleName());
            }
        }
        List<String> missing = Arrays.stream(WorkerName.values())
                .filter(name -> !workers.containsKey(name))
                .map(WorkerName::key)
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No worker registered for steps " + missing);
        }
        workers.forEach((name, worker) -> log.info("Worker {} -> {}", name.key(), worker.getClass().getSimpleName()));
    }

    public CampaignWorker get(WorkerName name) {
        return workers.get(name);
    }
}
