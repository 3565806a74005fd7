package com.di.epistream.pipeline;

import java.nio.file.Path;

/**
 * @param csvUpload  CSV file to ingest instead of the configured JSON snapshots, or null
 * @param fullReload rewrite every recomputed row
 */
public record RunRequest(Path csvUpload, boolean fullReload) {

    public static RunRequest incremental() {
        return new RunRequest(null, false);
    }

    public RunMode mode() {
        return fullReload ? RunMode.FULL_RELOAD : RunMode.INCREMENTAL;
    }
}
