package electoral.analytics.ingest.service;

import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.dto.QueueStatusDto;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.repository.ImportJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide FIFO scheduler for import jobs.
 *
 * Holds the waiting queue and the active slots (ingest.max-active-jobs, default 1).
 * Only a PENDING job at the head of the queue is ever admitted; a restarted job is
 * submitted again and therefore waits at the back. Queue entries are not persisted,
 * see StartupRecoveryService for how pending jobs come back after a restart.
 */
@Service
public class ImportQueueService {

    private static final Logger logger = LoggerFactory.getLogger(ImportQueueService.class);

    @Autowired
    private ImportConfig importConfig;

    @Autowired
    private ImportJobRepository importJobRepository;

    @Autowired
    private ImportJobRunner importJobRunner;

    @Autowired
    @Qualifier("importJobExecutor")
    private Executor importJobExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Long> waiting = new ArrayDeque<>();
    private final Set<Long> active = new LinkedHashSet<>();

    /**
     * Append a PENDING job to the back of the queue and try to admit work.
     */
    public void submit(Long jobId) {
        lock.lock();
        try {
            if (waiting.contains(jobId)) {
                logger.debug("Import job {} is already queued", jobId);
            } else {
                waiting.addLast(jobId);
                logger.info("Import job {} queued at position {}", jobId, waiting.size());
            }
        } finally {
            lock.unlock();
        }
        tryAdmit();
    }

    /**
     * Remove a waiting job from the queue.
     *
     * @return true if the job was waiting
     */
    public boolean remove(Long jobId) {
        lock.lock();
        try {
            boolean removed = waiting.remove(jobId);
            if (removed) {
                logger.info("Import job {} removed from queue", jobId);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Safety-net admission pass; normally admission happens on submit and on job completion.
     */
    @Scheduled(fixedDelayString = "${ingest.scheduler.tick-interval-ms:5000}")
    public void tick() {
        tryAdmit();
    }

    /**
     * Promote queue heads into free active slots, strictly in queue order.
     */
    public void tryAdmit() {
        List<Long> admitted = new ArrayList<>();

        lock.lock();
        try {
            while (active.size() < slots() && !waiting.isEmpty()) {
                Long head = waiting.peekFirst();
                if (active.contains(head)) {
                    // previous run of a restarted job is still unwinding; keep FIFO order
                    break;
                }

                Optional<ImportJob> job = importJobRepository.findById(head);
                if (job.isEmpty() || job.get().getStatus() != ImportJob.Status.PENDING) {
                    waiting.pollFirst();
                    logger.warn("Dropping import job {} from queue, status is {}", head,
                            job.map(j -> j.getStatus().name()).orElse("DELETED"));
                    continue;
                }

                waiting.pollFirst();
                active.add(head);
                admitted.add(head);
            }
        } finally {
            lock.unlock();
        }

        for (Long jobId : admitted) {
            logger.info("Admitting import job {} into active processing", jobId);
            try {
                importJobExecutor.execute(() -> runAndRelease(jobId));
            } catch (RejectedExecutionException e) {
                logger.error("Executor rejected import job {}, returning it to the head of the queue", jobId, e);
                lock.lock();
                try {
                    active.remove(jobId);
                    waiting.addFirst(jobId);
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    private void runAndRelease(Long jobId) {
        try {
            importJobRunner.run(jobId);
        } finally {
            release(jobId);
        }
    }

    /**
     * Free the active slot held by a job and admit the next one.
     */
    void release(Long jobId) {
        lock.lock();
        try {
            active.remove(jobId);
        } finally {
            lock.unlock();
        }
        tryAdmit();
    }

    public boolean isActive(Long jobId) {
        lock.lock();
        try {
            return active.contains(jobId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isQueued(Long jobId) {
        lock.lock();
        try {
            return waiting.contains(jobId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 0 while active, 1-based position while waiting, null otherwise.
     */
    public Integer positionOf(Long jobId) {
        lock.lock();
        try {
            if (active.contains(jobId)) {
                return 0;
            }
            int position = 1;
            for (Long queued : waiting) {
                if (queued.equals(jobId)) {
                    return position;
                }
                position++;
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot for observers. Active jobs are listed first at position 0.
     */
    public QueueStatusDto status() {
        lock.lock();
        try {
            List<QueueStatusDto.Entry> entries = new ArrayList<>();
            for (Long jobId : active) {
                entries.add(new QueueStatusDto.Entry(0, jobId, true));
            }
            int position = 1;
            for (Long jobId : waiting) {
                entries.add(new QueueStatusDto.Entry(position++, jobId, false));
            }
            Long current = active.isEmpty() ? null : active.iterator().next();
            return new QueueStatusDto(!active.isEmpty(), current, waiting.size(), entries);
        } finally {
            lock.unlock();
        }
    }

    private int slots() {
        return Math.max(1, importConfig.getMaxActiveJobs());
    }
}
