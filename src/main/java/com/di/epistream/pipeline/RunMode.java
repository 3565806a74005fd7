package com.di.epistream.pipeline;

public enum RunMode {
    /** Write only rows whose content hash changed. */
    INCREMENTAL,
    /** Rewrite every recomputed row regardless of its stored hash. Nothing is deleted. */
    FULL_RELOAD
}
