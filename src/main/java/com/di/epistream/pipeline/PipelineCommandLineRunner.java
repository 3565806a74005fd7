package com.di.epistream.pipeline;

import com.di.epistream.config.EpiStreamProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry: {@code [--csv=<path>] [--full-reload]}.
 * Exit code 0 on success, 2 when some partitions failed, 1 when the run failed.
 */
@Slf4j
@Component
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String CSV_OPTION = "csv";
    static final String FULL_RELOAD_OPTION = "full-reload";

    private final PipelineRunner pipelineRunner;
    private final EpiStreamProperties properties;

    private int exitCode = 0;

    public PipelineCommandLineRunner(PipelineRunner pipelineRunner, EpiStreamProperties properties) {
        this.pipelineRunner = pipelineRunner;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getPipeline().isRunOnStartup()) {
            log.info("[PIPELINE] epistream.pipeline.run-on-startup=false; not running");
            return;
        }
        RunRequest request;
        try {
            request = parse(args);
        } catch (IllegalArgumentException e) {
            log.error("[PIPELINE] {}", e.getMessage());
            exitCode = RunOutcome.FAILED.exitCode();
            return;
        }
        exitCode = pipelineRunner.run(request).exitCode();
    }

    static RunRequest parse(ApplicationArguments args) {
        Path csv = null;
        List<String> csvValues = args.getOptionValues(CSV_OPTION);
        if (csvValues != null) {
            if (csvValues.size() != 1 || csvValues.get(0).isBlank()) {
                throw new IllegalArgumentException("Usage: --csv=<path> takes exactly one file");
            }
            csv = Paths.get(csvValues.get(0));
            if (!Files.isRegularFile(csv)) {
                throw new IllegalArgumentException("CSV upload not found: " + csv);
            }
        }
        return new RunRequest(csv, args.containsOption(FULL_RELOAD_OPTION));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
