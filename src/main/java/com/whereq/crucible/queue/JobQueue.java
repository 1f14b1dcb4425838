package com.whereq.crucible.queue;

import com.whereq.crucible.model.Job;

import java.util.Iterator;
import java.util.List;

/**
 * Pending job queue in admission order. Not thread-safe, callers synchronize.
 */
public interface JobQueue extends Iterable<Job> {

    /**
     * Add a job to the queue
     *
     * @param job job in PENDING state
     */
    void enqueue(Job job);

    /**
     * Remove a specific job
     *
     * @return true if the job was queued
     */
    boolean remove(Job job);

    /**
     * Iterate jobs in admission order. Supports {@link Iterator#remove()}.
     */
    @Override
    Iterator<Job> iterator();

    int size();

    boolean isEmpty();

    /**
     * Remove and return all queued jobs in admission order
     */
    List<Job> drain();
}
