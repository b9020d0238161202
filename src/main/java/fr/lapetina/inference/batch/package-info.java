/**
 * Static mini-batch scheduling over a fixed pool of worker threads.
 *
 * <pre>
 * BatchRunner ─▶ BatchPartitioner ─▶ WorkerPool ─┬─▶ BatchWorker (own device, own model)
 *                                                ├─▶ BatchWorker
 *                                                └─▶ BatchWorker ─▶ ResultAggregator
 * </pre>
 *
 * <p>Workers share nothing but the {@link fr.lapetina.inference.batch.ResultAggregator}.
 * Each compiles its model once, on its first chunk, and loads it onto a device
 * of its own.
 */
package fr.lapetina.inference.batch;
