package me.golemcore.proxy.adapter.outbound.processor;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.ProcessorInput;
import me.golemcore.proxy.domain.model.ProcessorOutput;
import me.golemcore.proxy.domain.model.ProcessorType;
import me.golemcore.proxy.domain.processor.ProcessorExecutionException;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.ProcessorPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@code cli} processors as external programs.
 *
 * <p>
 * The processor input is serialized to JSON and written to the program's
 * stdin, which is then closed. The program must print exactly one
 * {@link ProcessorOutput} document on stdout before exiting. The command is
 * spawned directly from {@code config.command} and {@code config.args}, without
 * a shell, with the user's home directory as working directory.
 *
 * <p>
 * Every failure of the program itself is reported as a 500 output carrying the
 * original payload:
 * <ul>
 * <li>deadline elapsed - the process and its descendants are killed</li>
 * <li>spawn failure or non-zero exit - stderr text is appended</li>
 * <li>output is not a JSON object - raw stdout is appended</li>
 * <li>status outside [100, 600)</li>
 * </ul>
 * A missing payload defaults to the input payload, and a rejection without an
 * error message gets a generic one.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class CommandProcessorAdapter implements ProcessorPort {

    private static final long STREAM_DRAIN_TIMEOUT_MS = 2000;

    private final ObjectMapper objectMapper;
    private final Path workingDir;
    private final ExecutorService streamExecutor;

    public CommandProcessorAdapter(ProxyProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.workingDir = ProxyProperties.resolvePath(properties.getProcessors().getWorkingDir());
        AtomicInteger counter = new AtomicInteger();
        this.streamExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "processor-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        streamExecutor.shutdownNow();
        try {
            if (!streamExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Processor] Stream executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ProcessorType getType() {
        return ProcessorType.CLI;
    }

    @Override
    public ProcessorOutput run(ProcessorConfig config, ProcessorInput input) throws ProcessorExecutionException {
        String name = config.getName();
        List<String> commandLine = buildCommandLine(config);

        byte[] inputBytes;
        try {
            inputBytes = objectMapper.writeValueAsBytes(input);
        } catch (JsonProcessingException e) {
            throw new ProcessorExecutionException(
                    String.format("processor '%s' input could not be serialized: %s", name, e.getMessage()), e);
        }

        int timeoutSeconds = config.getEffectiveTimeoutSeconds();
        log.debug("[Processor:{}] Running {} (timeout {}s)", name, commandLine, timeoutSeconds);

        ProcessBuilder pb = new ProcessBuilder(commandLine);
        pb.directory(workingDir.toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("[Processor:{}] Failed to start: {}", name, e.getMessage());
            return ProcessorOutput.failure(input.getPayload(),
                    String.format("processor '%s' execution failed: %s", name, e.getMessage()));
        }

        Future<?> stdinFuture = streamExecutor.submit(() -> writeInput(process, inputBytes, name));
        Future<byte[]> stdoutFuture = streamExecutor.submit(() -> readFully(process.getInputStream()));
        Future<byte[]> stderrFuture = streamExecutor.submit(() -> readFully(process.getErrorStream()));

        try {
            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                kill(process, name);
                stdinFuture.cancel(true);
                stdoutFuture.cancel(true);
                stderrFuture.cancel(true);
                log.warn("[Processor:{}] Timed out after {}s, killed", name, timeoutSeconds);
                return ProcessorOutput.failure(input.getPayload(),
                        String.format("processor '%s' timed out after %d seconds", name, timeoutSeconds));
            }
        } catch (InterruptedException e) {
            kill(process, name);
            Thread.currentThread().interrupt();
            throw new ProcessorExecutionException(String.format("processor '%s' was interrupted", name), e);
        }

        String stdout = new String(collect(stdoutFuture, name, "stdout"), StandardCharsets.UTF_8).trim();
        String stderr = new String(collect(stderrFuture, name, "stderr"), StandardCharsets.UTF_8).trim();

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            log.warn("[Processor:{}] Exited with code {}", name, exitCode);
            StringBuilder error = new StringBuilder(
                    String.format("processor '%s' execution failed: exit code %d", name, exitCode));
            if (!stderr.isEmpty()) {
                error.append("\nstderr: ").append(stderr);
            }
            return ProcessorOutput.failure(input.getPayload(), error.toString());
        }
        if (!stderr.isEmpty()) {
            log.debug("[Processor:{}] stderr: {}", name, stderr);
        }

        return parseOutput(name, stdout, input);
    }

    private ProcessorOutput parseOutput(String name, String stdout, ProcessorInput input) {
        ProcessorOutput output;
        try {
            output = objectMapper.readValue(stdout, ProcessorOutput.class);
        } catch (JsonProcessingException e) {
            return invalidJson(name, e.getOriginalMessage(), stdout, input);
        }
        if (output == null) {
            return invalidJson(name, "output is not a JSON object", stdout, input);
        }

        if (output.getStatus() < 100 || output.getStatus() >= 600) {
            log.warn("[Processor:{}] Returned invalid status code {}", name, output.getStatus());
            return ProcessorOutput.failure(input.getPayload(),
                    String.format("processor '%s' returned invalid status code: %d", name, output.getStatus()));
        }

        JsonNode payload = output.getPayload();
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            output.setPayload(input.getPayload());
        } else if (!payload.isObject()) {
            return ProcessorOutput.failure(input.getPayload(),
                    String.format("processor '%s' returned a non-object payload", name));
        }

        if (output.isRejected() && (output.getError() == null || output.getError().isEmpty())) {
            output.setError(String.format("status %d requires error message", output.getStatus()));
        }
        if (output.getMetadata() != null && output.getMetadata().isNull()) {
            output.setMetadata(null);
        }
        return output;
    }

    private ProcessorOutput invalidJson(String name, String reason, String stdout, ProcessorInput input) {
        log.warn("[Processor:{}] Returned invalid JSON: {}", name, reason);
        StringBuilder error = new StringBuilder(
                String.format("processor '%s' returned invalid JSON: %s", name, reason));
        if (!stdout.isEmpty()) {
            error.append("\nstdout: ").append(stdout);
        }
        return ProcessorOutput.failure(input.getPayload(), error.toString());
    }

    private List<String> buildCommandLine(ProcessorConfig config) throws ProcessorExecutionException {
        Map<String, Object> settings = config.getConfig();
        Object command = settings != null ? settings.get("command") : null;
        if (!(command instanceof String executable) || executable.isBlank()) {
            throw new ProcessorExecutionException(
                    String.format("processor '%s' config.command must be a non-empty string", config.getName()));
        }

        List<String> commandLine = new ArrayList<>();
        commandLine.add(executable);

        Object args = settings.get("args");
        if (args == null) {
            return commandLine;
        }
        if (!(args instanceof List<?> argList)) {
            throw new ProcessorExecutionException(
                    String.format("processor '%s' config.args must be an array of strings", config.getName()));
        }
        for (Object arg : argList) {
            if (!(arg instanceof String value)) {
                throw new ProcessorExecutionException(
                        String.format("processor '%s' config.args must be an array of strings", config.getName()));
            }
            commandLine.add(value);
        }
        return commandLine;
    }

    private void writeInput(Process process, byte[] inputBytes, String name) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(inputBytes);
            stdin.flush();
        } catch (IOException e) {
            // A processor may exit without consuming its input
            log.debug("[Processor:{}] Could not write input: {}", name, e.getMessage());
        }
    }

    // Descendants first: once the child is gone they are reparented and out of reach
    private static void kill(Process process, String name) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.getInputStream().close();
            process.getErrorStream().close();
        } catch (IOException e) {
            log.debug("[Processor:{}] Error closing process streams: {}", name, e.getMessage());
        }
    }

    private static byte[] readFully(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            return in.readAllBytes();
        }
    }

    private byte[] collect(Future<byte[]> future, String name, String streamName) {
        try {
            return future.get(STREAM_DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // A grandchild process may still hold the pipe open
            future.cancel(true);
            log.warn("[Processor:{}] Timed out reading {}", name, streamName);
            return new byte[0];
        } catch (ExecutionException e) {
            log.warn("[Processor:{}] Failed to read {}: {}", name, streamName, e.getCause().getMessage());
            return new byte[0];
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new byte[0];
        }
    }
}
