package com.relayjobs;

/** Queue that runs follow-up tasks for a conversation. */
public interface TaskQueue {
    /**
     * Adds {@code text} as a task for {@code conversationKey}.
     *
     * @return the id of the created task
     */
    String enqueue(String conversationKey, String text, String sourceJobId);

    /** Asks the conversation's task runner to start working through its queue. */
    @FunctionalInterface
    interface Trigger {
        void kick(String conversationKey);
    }
}
