package com.whereq.crucible.queue;

import com.whereq.crucible.model.Job;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/**
 * In-memory queue ordered by priority tier, FIFO within a tier
 */
public class PriorityJobQueue implements JobQueue {

    private final TreeSet<Job> jobs = new TreeSet<>(Job.ADMISSION_ORDER);

    @Override
    public void enqueue(Job job) {
        if (!jobs.add(job)) {
            throw new IllegalStateException("Job already queued: " + job.getJobId());
        }
    }

    @Override
    public boolean remove(Job job) {
        return jobs.remove(job);
    }

    @Override
    public Iterator<Job> iterator() {
        return jobs.iterator();
    }

    @Override
    public int size() {
        return jobs.size();
    }

    @Override
    public boolean isEmpty() {
        return jobs.isEmpty();
    }

    @Override
    public List<Job> drain() {
        List<Job> drained = new ArrayList<>(jobs);
        jobs.clear();
        return drained;
    }
}
