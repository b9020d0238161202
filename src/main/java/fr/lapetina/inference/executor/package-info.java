/**
 * Single-consumer task queue built on the LMAX Disruptor.
 *
 * <p>{@link fr.lapetina.inference.executor.SerialExecutor} accepts
 * {@link fr.lapetina.inference.executor.Task}s from any number of threads and
 * runs them one at a time on a dedicated thread, in queue order:
 *
 * <ul>
 *   <li><b>Non-blocking submit</b> - {@code tryNext()} claims a slot or rejects at once</li>
 *   <li><b>Run once</b> - the slot is cleared after its task runs</li>
 *   <li><b>Isolated failures</b> - a throwing task is logged and counted, the queue moves on</li>
 *   <li><b>Draining stop</b> - tasks accepted before {@code stop} still run</li>
 * </ul>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.executor.SerialExecutor} - Queue lifecycle and submission</li>
 *   <li>{@link fr.lapetina.inference.executor.handler.TaskHandler} - The single consumer</li>
 *   <li>{@link fr.lapetina.inference.executor.exception.RejectedTaskException} - Submission refused</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.inference.executor;
