package com.relayjobs;

import com.relayjobs.Models.PreflightCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

public class PreflightValidator {
    private static final Logger log = LoggerFactory.getLogger(PreflightValidator.class);

    public static final String PATH_EXISTS = "path_exists";
    public static final String CMD_EXIT_ZERO = "cmd_exit_zero";
    public static final String MIN_FREE_DISK_GB = "min_free_disk_gb";
    public static final Set<String> TYPES = Set.of(PATH_EXISTS, CMD_EXIT_ZERO, MIN_FREE_DISK_GB);

    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    private final String shell;
    private final int defaultTimeoutSec;
    private final Path workdir;

    public PreflightValidator(String shell, int defaultTimeoutSec, Path workdir) {
        this.shell = shell;
        this.defaultTimeoutSec = defaultTimeoutSec;
        this.workdir = workdir;
    }

    public static final class Outcome {
        public final PreflightCheck check;
        public final boolean passed;
        public final String reason;

        Outcome(PreflightCheck check, boolean passed, String reason) {
            this.check = check;
            this.passed = passed;
            this.reason = reason;
        }
    }

    public static final class Result {
        public final List<Outcome> outcomes = new ArrayList<>();
        public Outcome rejection;

        public boolean rejected() {
            return rejection != null;
        }

        public List<Outcome> warnings() {
            List<Outcome> out = new ArrayList<>();
            for (Outcome o : outcomes) if (!o.passed && !o.check.rejectOnFail()) out.add(o);
            return out;
        }
    }

    public Result run(List<PreflightCheck> checks) {
        Result result = new Result();
        for (PreflightCheck c : checks) {
            Outcome o = check(c);
            result.outcomes.add(o);
            if (o.passed) continue;
            if (c.rejectOnFail()) {
                result.rejection = o;
                break;
            }
            log.warn("Preflight check {} failed (continuing): {}", c.type, o.reason);
        }
        return result;
    }

    Outcome check(PreflightCheck c) {
        return switch (c.type) {
            case PATH_EXISTS -> pathExists(c);
            case CMD_EXIT_ZERO -> cmdExitZero(c);
            case MIN_FREE_DISK_GB -> minFreeDisk(c);
            default -> new Outcome(c, false, "unknown preflight check type: " + c.type);
        };
    }

    private Outcome pathExists(PreflightCheck c) {
        String raw = c.params.path("path").asText("");
        try {
            Path p = resolve(raw);
            if (Files.exists(p)) return new Outcome(c, true, "path exists: " + p);
            return new Outcome(c, false, "path does not exist: " + p);
        } catch (InvalidPathException e) {
            return new Outcome(c, false, "invalid path: " + raw);
        }
    }

    private Outcome cmdExitZero(PreflightCheck c) {
        String cmd = c.params.path("cmd").asText("");
        int timeoutSec = c.params.path("timeoutSec").asInt(defaultTimeoutSec);
        if (timeoutSec <= 0) timeoutSec = defaultTimeoutSec;
        ProcessBuilder pb = new ProcessBuilder(shell, "-lc", cmd);
        pb.directory(workdir.toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return new Outcome(c, false, "could not run `" + cmd + "`: " + e.getMessage());
        }
        try {
            // waitFor measures against System.nanoTime, so clock changes do not shorten the bound
            if (!process.waitFor(timeoutSec, TimeUnit.SECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                return new Outcome(c, false, "`" + cmd + "` did not finish within " + timeoutSec + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new Outcome(c, false, "interrupted while running `" + cmd + "`");
        }
        int exit = process.exitValue();
        if (exit == 0) return new Outcome(c, true, "`" + cmd + "` exited 0");
        return new Outcome(c, false, "`" + cmd + "` exited with code " + exit);
    }

    private Outcome minFreeDisk(PreflightCheck c) {
        String raw = c.params.path("path").asText("");
        double wantGb = c.params.path("gb").asDouble(0);
        try {
            Path p = resolve(raw);
            Path existing = p;
            while (existing != null && !Files.exists(existing)) existing = existing.getParent();
            if (existing == null) return new Outcome(c, false, "no existing ancestor for " + p);
            FileStore store = Files.getFileStore(existing);
            double freeGb = store.getUsableSpace() / BYTES_PER_GB;
            String have = String.format("%.2f", freeGb);
            if (freeGb >= wantGb) return new Outcome(c, true, have + " GB free at " + existing);
            return new Outcome(c, false, "only " + have + " GB free at " + existing + ", need " + wantGb + " GB");
        } catch (InvalidPathException e) {
            return new Outcome(c, false, "invalid path: " + raw);
        } catch (IOException e) {
            return new Outcome(c, false, "could not read free space for " + raw + ": " + e.getMessage());
        }
    }

    private Path resolve(String raw) {
        Path p = Path.of(raw);
        return p.isAbsolute() ? p : workdir.resolve(p).normalize();
    }
}
