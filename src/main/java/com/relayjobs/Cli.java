package com.relayjobs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayjobs.Models.Job;
import com.relayjobs.Models.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Command(name = "relayjobs", mixinStandardHelpOptions = true, description = "Watched background jobs with gated follow-up tasks", subcommands = {
        Cli.Run.class,
        Cli.Start.class,
        Cli.Status.class,
        Cli.ListCmd.class,
        Cli.Stop.class,
        Cli.Recover.class,
        Cli.Logs.class,
        Cli.TasksCmd.class,
        Cli.ConfigCmd.class
})
public class Cli implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Cli.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public void run() { new CommandLine(this).usage(System.out); }

    public static void main(String[] args) { System.exit(new CommandLine(new Cli()).execute(args)); }

    static class ConfigOption {
        @Option(names = "--config", defaultValue = "config.json", description = "Configuration file (default: ${DEFAULT-VALUE})")
        File file;

        ObjectNode load() { return Config.load(file); }
    }

    static final class Relay implements AutoCloseable {
        final ObjectNode cfg;
        final LifecycleStore store;
        final StoredTaskQueue tasks;
        final JobService service;

        Relay(ObjectNode cfg) {
            this.cfg = cfg;
            Path db = Path.of(cfg.path("state_db").asText("relayjobs.db"));
            this.store = new LifecycleStore(db);
            this.tasks = new StoredTaskQueue(db);
            this.service = new JobService(cfg, store, tasks, new LoggingEventSink(),
                conversation -> log.info("Tasks pending for conversation {}; claim them with `relayjobs tasks claim`", conversation));
        }

        @Override
        public void close() { service.close(); }
    }

    @Command(name = "run", description = "Start a job and watch it in the foreground until it settles")
    static class Run implements Runnable {
        @Mixin ConfigOption config;
        @Parameters(index = "0", paramLabel = "JOB_JSON", description = "Job JSON e.g. {\"command\":\"make\",\"watch\":{\"everySec\":5}}")
        String jobJson;
        @Option(names = "--conversation", defaultValue = "cli", description = "Conversation key the follow-up task is queued for")
        String conversation;
        @Option(names = "--id", description = "Job id (generated when absent)")
        String id;

        public void run() {
            ObjectNode cfg = config.load();
            try (Relay relay = new Relay(cfg)) {
                Job job = relay.service.start(conversation, id, JobStartAction.parse(jobJson, cfg));
                System.out.println("Started job " + job.id + " (pid " + job.pid + ")");
                Job settled = relay.service.awaitSettled(job.id, Duration.ofDays(365));
                printJson(settled);
                if (!JobService.settled(settled) || settled.isTerminal() && settled.state != JobState.COMPLETED) {
                    System.exit(1);
                }
            } catch (JobRejectedException e) {
                System.err.println("Job " + e.getJob().id + " " + e.getJob().state + " [" + e.getCode().wire() + "]: " + e.getMessage());
                System.exit(1);
            } catch (RelayException e) {
                System.err.println(e.getMessage());
                System.exit(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                System.err.println("Interrupted; the job keeps running, resume watching it with `relayjobs recover`");
                System.exit(1);
            }
        }
    }

    @Command(name = "start", description = "Start a job watched by a background relay process")
    static class Start implements Runnable {
        @Mixin ConfigOption config;
        @Parameters(index = "0", paramLabel = "JOB_JSON") String jobJson;
        @Option(names = "--conversation", defaultValue = "cli") String conversation;
        @Option(names = "--id") String id;

        public void run() {
            ObjectNode cfg = config.load();
            try {
                JobStartAction.parse(jobJson, cfg);
            } catch (InvalidJobRequestException e) {
                System.err.println(e.getMessage());
                System.exit(1);
            }
            String jobId = id != null ? id : JobService.newId();
            Path logDir = Path.of(cfg.path("log_directory").asText("job_logs"));
            String java = System.getProperty("java.home") + File.separator + "bin" + File.separator + "java";
            String cp = System.getProperty("java.class.path");
            try {
                Files.createDirectories(logDir);
                File out = logDir.resolve("relay-" + jobId + ".out").toFile();
                new ProcessBuilder(java, "-cp", cp, Cli.class.getName(), "run",
                        "--config", config.file.getAbsolutePath(), "--conversation", conversation, "--id", jobId, jobJson)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(out))
                    .start();
                System.out.println("Started relay for job " + jobId + " (output " + out + ")");
            } catch (IOException e) {
                System.err.println("Failed to start relay: " + e.getMessage());
                System.exit(1);
            }
        }
    }

    @Command(name = "status", description = "Show a job with its history")
    static class Status implements Runnable {
        @Mixin ConfigOption config;
        @Parameters(index = "0") String jobId;

        public void run() {
            LifecycleStore store = new LifecycleStore(Path.of(config.load().path("state_db").asText("relayjobs.db")));
            Optional<Job> job = store.find(jobId);
            if (job.isEmpty()) {
                System.err.println("No such job: " + jobId);
                System.exit(1);
            }
            printJson(job.get());
        }
    }

    @Command(name = "list", description = "List jobs")
    static class ListCmd implements Runnable {
        @Mixin ConfigOption config;
        @Option(names = "--state", required = false) String state;
        @Option(names = "--archived", description = "List finished jobs instead of live ones") boolean archived;

        public void run() {
            LifecycleStore store = new LifecycleStore(Path.of(config.load().path("state_db").asText("relayjobs.db")));
            JobState filter = null;
            if (state != null) {
                try {
                    filter = JobState.fromWire(state);
                } catch (IllegalArgumentException e) {
                    System.err.println(e.getMessage());
                    System.exit(1);
                }
            }
            List<Job> jobs = archived ? store.listArchived(filter) : store.list(filter);
            printJson(jobs);
        }
    }

    @Command(name = "stop", description = "Stop a job (SIGTERM, then SIGKILL after stop_grace_sec)")
    static class Stop implements Runnable {
        @Mixin ConfigOption config;
        @Parameters(index = "0") String jobId;

        public void run() {
            try (Relay relay = new Relay(config.load())) {
                printJson(relay.service.stop(jobId));
            } catch (RelayException e) {
                System.err.println(e.getMessage());
                System.exit(1);
            }
        }
    }

    @Command(name = "recover", description = "Resume unfinished jobs after a restart and watch them until they settle")
    static class Recover implements Runnable {
        @Mixin ConfigOption config;
        @Option(names = "--no-wait", description = "Run one recovery pass and exit") boolean noWait;

        public void run() {
            try (Relay relay = new Relay(config.load())) {
                List<Job> touched = relay.service.recover();
                List<Job> out = new ArrayList<>();
                for (Job j : touched) {
                    out.add(noWait ? j : relay.service.awaitSettled(j.id, Duration.ofDays(365)));
                }
                printJson(out);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                System.exit(1);
            }
        }
    }

    @Command(name = "logs", description = "Show the captured output of a job")
    static class Logs implements Runnable {
        @Mixin ConfigOption config;
        @Parameters(index = "0") String jobId;
        @Option(names = "--lines", defaultValue = "40") int lines;

        public void run() {
            LifecycleStore store = new LifecycleStore(Path.of(config.load().path("state_db").asText("relayjobs.db")));
            Optional<Job> job = store.find(jobId);
            if (job.isEmpty() || job.get().logPath == null) {
                System.err.println("No log available for job " + jobId);
                System.exit(1);
            }
            try {
                TailBuffer.readFrom(Path.of(job.get().logPath), Math.max(1, lines)).snapshot().forEach(System.out::println);
            } catch (IOException e) {
                System.err.println("Could not read log: " + e.getMessage());
                System.exit(1);
            }
        }
    }

    @Command(name = "tasks", description = "Follow-up task queue", subcommands = {TasksCmd.ListTasks.class, TasksCmd.Claim.class, TasksCmd.Done.class})
    static class TasksCmd implements Runnable {
        public void run() { CommandLine.usage(this, System.out); }

        @Command(name = "list", description = "List queued tasks")
        static class ListTasks implements Runnable {
            @Mixin ConfigOption config;
            @Option(names = "--conversation") String conversation;

            public void run() {
                StoredTaskQueue tasks = new StoredTaskQueue(Path.of(config.load().path("state_db").asText("relayjobs.db")));
                printJson(tasks.list(conversation));
            }
        }

        @Command(name = "claim", description = "Claim the next pending task of a conversation")
        static class Claim implements Runnable {
            @Mixin ConfigOption config;
            @Option(names = "--conversation", defaultValue = "cli") String conversation;

            public void run() {
                try (Relay relay = new Relay(config.load())) {
                    Optional<Task> task = relay.tasks.claimNext(conversation);
                    if (task.isEmpty()) {
                        System.err.println("No pending task for conversation " + conversation);
                        System.exit(1);
                    }
                    if (task.get().sourceJobId != null) relay.service.callbackStarted(task.get().sourceJobId);
                    printJson(task.get());
                }
            }
        }

        @Command(name = "done", description = "Report a claimed task as finished")
        static class Done implements Runnable {
            @Mixin ConfigOption config;
            @Parameters(index = "0") String taskId;
            @Option(names = "--conversation", defaultValue = "cli") String conversation;
            @Option(names = "--failed", description = "Mark the task as failed") boolean failed;
            @Option(names = "--error") String error;

            public void run() {
                try (Relay relay = new Relay(config.load())) {
                    Optional<Task> task = relay.tasks.finish(conversation, taskId, failed ? "failed" : "done", error);
                    if (task.isEmpty()) {
                        System.err.println("Task " + taskId + " is not pending or running in conversation " + conversation);
                        System.exit(1);
                    }
                    if (task.get().sourceJobId != null) relay.service.callbackFinished(task.get().sourceJobId, !failed, error);
                    printJson(task.get());
                }
            }
        }
    }

    @Command(name = "config", description = "Manage configuration", subcommands = {ConfigCmd.Get.class, ConfigCmd.Set.class})
    static class ConfigCmd implements Runnable {
        public void run() { CommandLine.usage(this, System.out); }

        @Command(name = "get", description = "Show current config")
        static class Get implements Runnable {
            @Mixin ConfigOption config;
            public void run() { System.out.println(config.load().toPrettyString()); }
        }

        @Command(name = "set", description = "Set a config key")
        static class Set implements Runnable {
            @Mixin ConfigOption config;
            @Parameters(index = "0") String key;
            @Parameters(index = "1") String value;

            public void run() {
                try {
                    System.out.println(Config.set(config.file, key, value).toPrettyString());
                } catch (IllegalArgumentException e) {
                    System.err.println(e.getMessage());
                    System.exit(1);
                }
            }
        }
    }

    private static void printJson(Object value) {
        try {
            System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
