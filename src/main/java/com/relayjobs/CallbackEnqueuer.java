package com.relayjobs;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayjobs.Models.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Hands a job's follow-up task to the {@link TaskQueue} at most once. The {@code callbackEnqueued}
 * check, the enqueue call and the transition to {@code callback_queued} share one critical section
 * on the job, so a duplicate watcher tick or a recovery re-scan finds the flag set and does nothing.
 */
public class CallbackEnqueuer {
    private static final Logger log = LoggerFactory.getLogger(CallbackEnqueuer.class);

    private final LifecycleStore store;
    private final TaskQueue queue;
    private final TaskQueue.Trigger trigger;
    private final JobEvents events;

    CallbackEnqueuer(LifecycleStore store, TaskQueue queue, TaskQueue.Trigger trigger, JobEvents events) {
        this.store = store;
        this.queue = queue;
        this.trigger = trigger;
        this.events = events;
    }

    public Optional<Job> enqueue(String jobId, JobState from, String text) {
        Optional<Job> result = store.withLock(jobId, () -> {
            Optional<Job> current = store.findLive(jobId);
            if (current.isEmpty()) return Optional.<Job>empty();
            Job job = current.get();
            if (job.callbackEnqueued) {
                log.info("Then task for job {} already queued as {}, skipping", jobId, job.callbackTaskId);
                return Optional.<Job>empty();
            }
            if (job.state != from) return Optional.<Job>empty();

            String taskId;
            try {
                taskId = queue.enqueue(job.conversationKey, text, job.id);
            } catch (RuntimeException e) {
                log.error("Could not enqueue then task for job {}: {}", jobId, e.toString());
                ObjectNode d = JobEvents.details();
                d.put("errorCode", ErrorCode.CALLBACK_ENQUEUE_FAILED.wire());
                d.put("error", String.valueOf(e.getMessage()));
                Optional<Job> failed = store.transition(jobId, from, JobState.FAILED,
                    "could not enqueue then task: " + e.getMessage(), d,
                    j -> j.errorCode = ErrorCode.CALLBACK_ENQUEUE_FAILED.wire());
                failed.ifPresent(f -> events.emit("job.failed", f, d));
                return failed;
            }

            String queuedAs = taskId;
            ObjectNode d = JobEvents.details();
            d.put("taskId", queuedAs);
            d.put("text", text);
            Optional<Job> queued = store.transition(jobId, from, JobState.CALLBACK_QUEUED,
                "then task queued as " + queuedAs, d,
                j -> {
                    j.callbackEnqueued = true;
                    j.callbackTaskId = queuedAs;
                });
            queued.ifPresent(q -> events.emit("job.then_task.queued", q, d));
            return queued;
        });

        result.filter(j -> j.state == JobState.CALLBACK_QUEUED && j.watch.runTasks && trigger != null)
            .ifPresent(j -> {
                try {
                    trigger.kick(j.conversationKey);
                } catch (RuntimeException e) {
                    log.warn("Task runner trigger failed for conversation {}: {}", j.conversationKey, e.toString());
                }
            });
        return result;
    }
}
