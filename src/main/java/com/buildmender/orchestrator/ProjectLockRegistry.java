package com.buildmender.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per project directory. Repairs of the same directory run one
 * after another; different directories do not contend.
 *
 * Locks are never evicted. The set of directories is bounded by the workspace.
 */
@Component
public class ProjectLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProjectLockRegistry.class);

    private final ConcurrentMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Blocks until the directory's lock is held by the calling thread.
     *
     * @return a handle that releases the lock on close
     */
    public Guard acquire(Path projectDir) throws InterruptedException {
        Path key = projectDir.toAbsolutePath().normalize();
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock(true));

        if (!lock.tryLock()) {
            log.info("[Lock] {} is busy; waiting ({} queued)", key, lock.getQueueLength());
            lock.lockInterruptibly();
        }
        log.debug("[Lock] Acquired {}", key);
        return new Guard(key, lock);
    }

    boolean isLocked(Path projectDir) {
        ReentrantLock lock = locks.get(projectDir.toAbsolutePath().normalize());
        return lock != null && lock.isLocked();
    }

    public static final class Guard implements AutoCloseable {
        private final Path path;
        private final ReentrantLock lock;

        private Guard(Path path, ReentrantLock lock) {
            this.path = path;
            this.lock = lock;
        }

        public Path getPath() {
            return path;
        }

        @Override
        public void close() {
            lock.unlock();
            log.debug("[Lock] Released {}", path);
        }
    }
}
