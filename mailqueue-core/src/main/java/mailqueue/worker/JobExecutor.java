package mailqueue.worker;

import mailqueue.model.Job;

import java.util.Map;

/**
 * Runs one claimed job.
 *
 * @see EmailJobExecutor
 */
@FunctionalInterface
public interface JobExecutor {

    /**
     * @return the result stored on the completed job
     * @throws Exception any failure; the worker records it with {@code failJob}
     */
    Map<String, String> execute(Job job) throws Exception;
}
