package com.beapvault.reconstruction;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import com.beapvault.tools.BundledTool;

/**
 * Runs each tool invocation as a separate OS process.
 *
 * <p>The child gets an emptied environment, a closed stdin and a wall-clock timeout;
 * a process still running at the deadline is killed together with its descendants.
 * The memory ceiling is applied with {@code -Xmx} for jar tools and with
 * {@code prlimit --as} for native tools; it is also exported as
 * {@code BEAP_TOOL_MEMORY_LIMIT_MB}. {@code prlimit} is looked up on the server's
 * {@code PATH} and in the standard system directories. Without it native tools are
 * not started at all.
 *
 * <p>Command line: {@code <tool> --mime <type> --input <ref> [--format <fmt>]}.
 * Output beyond {@link #MAX_OUTPUT_BYTES} is truncated.
 */
@Component
public class ProcessToolExecutor implements ToolExecutor, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolExecutor.class);

    static final int MAX_OUTPUT_BYTES = 16 * 1024 * 1024;
    private static final List<String> SYSTEM_BIN_DIRS = List.of("/usr/bin", "/bin", "/usr/local/bin", "/usr/sbin");

    private final ExecutorService streamReaders = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "tool-output-reader");
        thread.setDaemon(true);
        return thread;
    });

    private final Path memoryLimiter;

    public ProcessToolExecutor() {
        this(locateMemoryLimiter(System.getenv("PATH")));
    }

    /**
     * @param memoryLimiter {@code prlimit}-compatible launcher, or {@code null} when none
     *                      is installed
     */
    ProcessToolExecutor(Path memoryLimiter) {
        this.memoryLimiter = memoryLimiter;
        if (memoryLimiter == null) {
            log.warn("prlimit not found; native tools will be refused");
        }
    }

    @Override
    public ToolExecutionResult execute(ToolExecutionRequest request) {
        long start = System.nanoTime();
        if (!isJar(request.tool()) && memoryLimiter == null) {
            log.warn("Refusing to run tool {} without a memory limit for request {}",
                    request.tool().id(), request.requestId());
            return ToolExecutionResult.failed(null, "", "No memory limit mechanism available for native tool",
                    elapsedMs(start));
        }
        List<String> command = buildCommand(request);

        ProcessBuilder builder = new ProcessBuilder(command);
        Map<String, String> env = builder.environment();
        env.clear();
        env.put("PATH", "/usr/local/bin:/usr/bin:/bin");
        env.put("BEAP_TOOL_MEMORY_LIMIT_MB", String.valueOf(request.memoryLimitMb()));
        Path toolDir = Paths.get(request.tool().installPath()).toAbsolutePath().getParent();
        if (toolDir != null && Files.isDirectory(toolDir)) {
            builder.directory(toolDir.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Could not start tool {}: {}", request.tool().id(), e.getMessage());
            return ToolExecutionResult.failed(null, "", "Could not start tool: " + e.getMessage(), elapsedMs(start));
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), streamReaders);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), streamReaders);
        try {
            process.getOutputStream().close();

            boolean finished = process.waitFor(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                kill(process);
                log.warn("Tool {} timed out after {} ms for request {}",
                        request.tool().id(), request.timeout().toMillis(), request.requestId());
                return ToolExecutionResult.timedOut(elapsedMs(start));
            }

            String out = stdout.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            String err = stderr.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                return ToolExecutionResult.failed(exitCode, err, "Tool exited with code " + exitCode, elapsedMs(start));
            }
            return ToolExecutionResult.succeeded(out, err, elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            return ToolExecutionResult.failed(null, "", "Interrupted while waiting for tool", elapsedMs(start));
        } catch (Exception e) {
            kill(process);
            log.warn("Tool {} failed for request {}: {}", request.tool().id(), request.requestId(), e.toString());
            return ToolExecutionResult.failed(null, "", "Tool execution failed: " + e.getMessage(), elapsedMs(start));
        }
    }

    List<String> buildCommand(ToolExecutionRequest request) {
        BundledTool tool = request.tool();
        List<String> command = new ArrayList<>();
        if (isJar(tool)) {
            command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
            command.add("-Xmx" + request.memoryLimitMb() + "m");
            command.add("-jar");
            command.add(tool.installPath());
        } else {
            if (memoryLimiter == null) {
                throw new IllegalStateException("No memory limit mechanism for native tool " + tool.id());
            }
            command.add(memoryLimiter.toString());
            command.add("--as=" + (long) request.memoryLimitMb() * 1024 * 1024);
            command.add(tool.installPath());
        }
        command.add("--mime");
        command.add(request.inputMimeType());
        command.add("--input");
        command.add(request.inputRef());
        if (tool.outputFormat() != null) {
            command.add("--format");
            command.add(tool.outputFormat().name().toLowerCase(Locale.ROOT));
        }
        return command;
    }

    private static boolean isJar(BundledTool tool) {
        return tool.installPath().endsWith(".jar");
    }

    static Path locateMemoryLimiter(String searchPath) {
        List<String> dirs = new ArrayList<>();
        if (searchPath != null && !searchPath.isBlank()) {
            dirs.addAll(List.of(searchPath.split(File.pathSeparator)));
        }
        dirs.addAll(SYSTEM_BIN_DIRS);
        for (String dir : dirs) {
            if (dir.isBlank()) continue;
            Path candidate = Paths.get(dir, "prlimit");
            if (Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            byte[] bytes = in.readNBytes(MAX_OUTPUT_BYTES);
            // keep the pipe empty so the child cannot block on a full buffer
            in.transferTo(OutputStream.nullOutputStream());
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolExecutionException("Failed to read tool output", e);
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public void destroy() {
        streamReaders.shutdownNow();
    }
}
