package com.di.epistream.pipeline;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
@ConditionalOnProperty(name = "epistream.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRunStore implements RunStore {

    private final List<RunRecord> runs = new CopyOnWriteArrayList<>();

    @Override
    public void save(RunRecord run) {
        if (run == null || run.getRunId() == null) return;
        runs.add(run);
    }

    @Override
    public List<RunRecord> findRecent(int limit) {
        List<RunRecord> copy = new ArrayList<>(runs);
        Collections.reverse(copy);
        return copy.subList(0, Math.min(Math.max(1, limit), copy.size()));
    }
}
