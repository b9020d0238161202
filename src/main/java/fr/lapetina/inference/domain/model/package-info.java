/**
 * Value types shared by the device and batch layers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.domain.model.Tensor} - Float-backed tensor with a {@link fr.lapetina.inference.domain.model.TensorType}</li>
 *   <li>{@link fr.lapetina.inference.domain.model.ExecutionContext} - Placeholder bindings handed to and back from a device</li>
 *   <li>{@link fr.lapetina.inference.domain.model.RunIdentifier} - Correlation token for an asynchronous run</li>
 *   <li>{@link fr.lapetina.inference.domain.model.RunResult} and {@link fr.lapetina.inference.domain.model.NetworkResult} - Callback outcomes</li>
 *   <li>{@link fr.lapetina.inference.domain.model.BatchRange} - Contiguous slice of the job list given to one worker</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records are immutable. {@code Tensor} and {@code ExecutionContext} are
 * mutable and owned by one thread at a time; ownership moves through the
 * device queue.
 */
package fr.lapetina.inference.domain.model;
