package com.di.epistream.reconcile;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentSkipListMap;

@Component
@ConditionalOnProperty(name = "epistream.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryReliabilityStore implements ReliabilityStore {

    private final ConcurrentSkipListMap<Long, ReliabilityState> versions = new ConcurrentSkipListMap<>();

    @Override
    public ReliabilityState loadLatest() {
        var last = versions.lastEntry();
        return last == null ? ReliabilityState.initial() : last.getValue();
    }

    @Override
    public void save(ReliabilityState state) {
        if (state == null) return;
        versions.put(state.getVersion(), state);
    }
}
