/**
 * YAML configuration for the inference runner.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.infrastructure.config.RunnerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.inference.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code executor} - Device queue ring buffer, wait strategy and drain timeout</li>
 *   <li>{@code device} - Device kind and network capacity</li>
 *   <li>{@code model} - Model file and placeholder names</li>
 *   <li>{@code preprocessing} - Image normalization, channel order and layout</li>
 *   <li>{@code batch} - Threads, mini-batch, streaming, profiling, bundles and reporting</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.inference.infrastructure.config;
