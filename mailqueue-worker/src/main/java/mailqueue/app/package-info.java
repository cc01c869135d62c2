/**
 * Standalone worker process. Entry point: {@link mailqueue.app.EmailWorkerApplication}.
 */
package mailqueue.app;
