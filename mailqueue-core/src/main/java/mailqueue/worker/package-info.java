/**
 * Worker runtime: polling, bounded concurrent execution, job routing and queue maintenance.
 *
 * @see mailqueue.worker.JobWorker
 * @see mailqueue.worker.EmailJobExecutor
 * @see mailqueue.worker.JobMaintenanceScheduler
 */
package mailqueue.worker;
