package com.oracle.optmcts.core.impl;

import com.oracle.optmcts.config.SandboxConfig;
import com.oracle.optmcts.core.ExecutionReport;
import com.oracle.optmcts.core.ExecutionSandbox;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Runs each program in its own temporary directory with the configured interpreter.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubprocessExecutionSandbox implements ExecutionSandbox {

    private static final String STDOUT_FILE = "stdout.txt";
    private static final String STDERR_FILE = "stderr.txt";

    private final SandboxConfig sandboxConfig;

    @Override
    public ExecutionReport execute(String code) {
        long start = System.currentTimeMillis();
        Path workDir = null;
        Process process = null;
        try {
            workDir = Files.createTempDirectory(sandboxConfig.getWorkDirPrefix());
            Path scriptPath = workDir.resolve("solution" + sandboxConfig.getScriptSuffix());
            Files.writeString(scriptPath, code == null ? "" : code, StandardCharsets.UTF_8);

            Path stdout = workDir.resolve(STDOUT_FILE);
            Path stderr = workDir.resolve(STDERR_FILE);
            ProcessBuilder pb = new ProcessBuilder(sandboxConfig.getInterpreter(), scriptPath.toAbsolutePath().toString());
            pb.directory(workDir.toFile());
            pb.redirectOutput(stdout.toFile());
            pb.redirectError(stderr.toFile());

            process = pb.start();
            boolean finished = process.waitFor(sandboxConfig.getMaxExecutionTimeSeconds(), TimeUnit.SECONDS);

            if (!finished) {
                terminate(process);
                log.warn("Execution timed out after {}s", sandboxConfig.getMaxExecutionTimeSeconds());
                return ExecutionReport.builder()
                    .success(false)
                    .timedOut(true)
                    .output(readCapped(stdout))
                    .error("Execution timeout (" + sandboxConfig.getMaxExecutionTimeSeconds() + "s)")
                    .executionTimeMs(System.currentTimeMillis() - start)
                    .build();
            }

            return ExecutionReport.builder()
                .success(process.exitValue() == 0)
                .output(readCapped(stdout))
                .error(readCapped(stderr))
                .executionTimeMs(System.currentTimeMillis() - start)
                .build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Execution interrupted, terminating the program");
            return ExecutionReport.builder()
                .success(false)
                .output("")
                .error("Execution interrupted")
                .executionTimeMs(System.currentTimeMillis() - start)
                .build();
        } catch (IOException e) {
            log.error("Execution failed to start", e);
            return ExecutionReport.builder()
                .success(false)
                .output("")
                .error(e.getMessage())
                .executionTimeMs(System.currentTimeMillis() - start)
                .build();
        } finally {
            terminate(process);
            cleanUp(workDir);
        }
    }

    /**
     * Kill a program that is still running, including anything it spawned, and wait briefly for it to exit.
     */
    private void terminate(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        boolean interrupted = Thread.interrupted();
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private String readCapped(Path file) throws IOException {
        if (!Files.exists(file)) {
            return "";
        }
        return StringUtils.left(Files.readString(file, StandardCharsets.UTF_8), sandboxConfig.getMaxOutputChars());
    }

    private void cleanUp(Path workDir) {
        if (workDir == null || sandboxConfig.isKeepWorkDirs()) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            log.warn("Failed to remove work directory {}: {}", workDir, e.getMessage());
        }
    }
}
