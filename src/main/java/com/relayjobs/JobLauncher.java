package com.relayjobs;

import com.relayjobs.Models.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Spawns job commands. The command runs under {@code shell -lc} inside a small wrapper that writes
 * the exit status next to the output log, so a relay that restarts can still learn how a job that
 * finished in its absence ended.
 */
public class JobLauncher {
    private static final Logger log = LoggerFactory.getLogger(JobLauncher.class);

    static final String WRAPPER = "\"$3\" -lc \"$1\"; status=$?; printf '%s\\n' \"$status\" > \"$2\"; exit $status";
    private static final List<String> SETSID_LOCATIONS = List.of("/usr/bin/setsid", "/bin/setsid");

    private final String shell;
    private final boolean detach;
    private final Path logDir;

    public JobLauncher(String shell, boolean detach, Path logDir) {
        this.shell = shell;
        this.detach = detach;
        this.logDir = logDir;
    }

    public static final class Launched {
        public final Process process;
        public final long pid;
        public final Path logFile;
        public final Path exitFile;

        Launched(Process process, Path logFile, Path exitFile) {
            this.process = process;
            this.pid = process.pid();
            this.logFile = logFile;
            this.exitFile = exitFile;
        }
    }

    /** The argv the job process runs with; this is the line {@code pgrep -f} will see. */
    public List<String> commandLine(Job job) {
        List<String> argv = new ArrayList<>();
        if (detach) setsid().ifPresent(argv::add);
        argv.add(shell);
        argv.add("-c");
        argv.add(WRAPPER);
        argv.add("relayjobs");
        argv.add(job.command);
        argv.add(exitFile(job.id).toString());
        argv.add(shell);
        return argv;
    }

    public Launched launch(Job job) throws IOException {
        requireExecutable(shell);
        Files.createDirectories(logDir);
        Path logFile = logFile(job.id);
        Path exitFile = exitFile(job.id);
        Files.deleteIfExists(exitFile);
        ProcessBuilder pb = new ProcessBuilder(commandLine(job));
        if (job.workdir != null) pb.directory(new File(job.workdir));
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        pb.environment().put("RELAY_JOB_ID", job.id);
        Process process = pb.start();
        log.info("Spawned job {} as pid {} (log {})", job.id, process.pid(), logFile);
        return new Launched(process, logFile, exitFile);
    }

    public Path logFile(String jobId) {
        return logDir.resolve(safeName(jobId) + ".log").toAbsolutePath();
    }

    public Path exitFile(String jobId) {
        return logDir.resolve(safeName(jobId) + ".exit").toAbsolutePath();
    }

    public static Integer readExitStatus(Path exitFile) {
        try {
            String raw = Files.readString(exitFile, StandardCharsets.UTF_8).trim();
            return raw.isEmpty() ? null : Integer.valueOf(raw);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException | NumberFormatException e) {
            log.warn("Unreadable exit status file {}: {}", exitFile, e.getMessage());
            return null;
        }
    }

    /**
     * Sends SIGTERM to the process tree, then SIGKILL to whatever is still alive after
     * {@code graceSec}. Returns true if everything is gone afterwards.
     */
    public static boolean terminate(ProcessHandle root, int graceSec) {
        List<ProcessHandle> tree = new ArrayList<>();
        root.descendants().forEach(tree::add);
        tree.add(root);
        for (ProcessHandle h : tree) h.destroy();
        CompletableFuture<?>[] exits = tree.stream().map(ProcessHandle::onExit).toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(exits).get(graceSec, TimeUnit.SECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Process {} still alive after {}s, killing", root.pid(), graceSec);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Waiting for process {} failed: {}", root.pid(), e.getMessage());
        }
        for (ProcessHandle h : tree) {
            if (h.isAlive()) h.destroyForcibly();
        }
        try {
            CompletableFuture.allOf(exits).get(2, TimeUnit.SECONDS);
        } catch (TimeoutException | ExecutionException e) {
            log.warn("Process {} did not exit after SIGKILL", root.pid());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return tree.stream().noneMatch(ProcessHandle::isAlive);
    }

    private static Optional<String> setsid() {
        for (String candidate : SETSID_LOCATIONS) {
            if (Files.isExecutable(Path.of(candidate))) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    static void requireExecutable(String program) throws IOException {
        if (program.contains("/")) {
            Path p = Path.of(program);
            if (!Files.exists(p)) throw new IOException("Cannot run program \"" + program + "\": No such file or directory");
            if (!Files.isExecutable(p)) throw new IOException("Cannot run program \"" + program + "\": Permission denied");
            return;
        }
        String path = System.getenv().getOrDefault("PATH", "/usr/bin:/bin");
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            if (Files.isExecutable(Path.of(dir, program))) return;
        }
        throw new IOException("Cannot run program \"" + program + "\": not found on PATH");
    }

    private static String safeName(String jobId) {
        return jobId.replaceAll("[^a-zA-Z0-9_.-]", "_");
    }
}
