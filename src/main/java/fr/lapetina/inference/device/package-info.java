/**
 * Asynchronous device facade over stateful compute backends.
 *
 * <p>A {@link fr.lapetina.inference.device.DeviceManager} accepts add, evict
 * and run requests from any thread and returns immediately. The work runs on
 * the device's own {@link fr.lapetina.inference.executor.SerialExecutor}, one
 * operation at a time, so backend state needs no locking:
 *
 * <pre>
 * caller ──submit──▶ ring buffer ──▶ device thread ──▶ backend ──▶ callback
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.device.QueueBackedDeviceManager} - Wraps backend operations as queued tasks</li>
 *   <li>{@link fr.lapetina.inference.device.InProcessDeviceManager} - The {@code cpu} device</li>
 *   <li>{@link fr.lapetina.inference.device.DeviceFactory} - Creates devices by kind name</li>
 * </ul>
 *
 * <h2>Eviction and queued runs</h2>
 * <p>Operations take effect in queue order. A run queued after an eviction of
 * its function fails with {@code NETWORK_EVICTED}, even when the run was
 * submitted before the caller learned of the eviction.
 */
package fr.lapetina.inference.device;
