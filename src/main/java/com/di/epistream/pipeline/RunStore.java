package com.di.epistream.pipeline;

import java.util.List;

/**
 * Run history ({@code pipeline_runs}).
 */
public interface RunStore {

    void save(RunRecord run);

    /** Most recent first. */
    List<RunRecord> findRecent(int limit);
}
