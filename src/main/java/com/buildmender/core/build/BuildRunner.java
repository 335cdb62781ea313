package com.buildmender.core.build;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs the project's build once and reports what happened.
 *
 * Implementations block until the build exits or the timeout elapses. A build
 * that outlives the timeout is killed and reported as a timed-out failure, not
 * as an exception.
 */
public interface BuildRunner {

    /**
     * @param projectRoot directory the build tool runs in
     * @param timeout     upper bound on the wall-clock time of the build
     * @return the outcome, never null
     * @throws BuildInvocationException no build entry point exists or it could not be started
     * @throws InterruptedException     the caller was interrupted; the build was killed
     */
    BuildResult run(Path projectRoot, Duration timeout)
            throws BuildInvocationException, InterruptedException;
}
