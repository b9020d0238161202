/**
 * Batch image classification runner.
 *
 * <p>Two parts carry the concurrency:
 * <ul>
 *   <li>{@link fr.lapetina.inference.device} - devices that serialize all backend work on a
 *       {@link fr.lapetina.inference.executor.SerialExecutor} and report through callbacks</li>
 *   <li>{@link fr.lapetina.inference.batch} - static partitioning of the inputs over worker
 *       threads, each with its own device and compiled model</li>
 * </ul>
 *
 * <p>{@link fr.lapetina.inference.InferenceRunnerApplication} is the command line entry point;
 * {@link fr.lapetina.inference.RunnerFactory} wires everything from YAML configuration.
 */
package fr.lapetina.inference;
