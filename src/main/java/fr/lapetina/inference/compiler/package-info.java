/**
 * Model compilation behind a narrow interface.
 *
 * <p>{@link fr.lapetina.inference.compiler.ModelCompiler} turns a model and an
 * input type into a {@link fr.lapetina.inference.compiler.CompiledModel}.
 * {@link fr.lapetina.inference.compiler.DenseModelCompiler} reads a single
 * dense layer from JSON. {@link fr.lapetina.inference.compiler.QuantizationProfile}
 * collects value ranges during profiled runs.
 */
package fr.lapetina.inference.compiler;
