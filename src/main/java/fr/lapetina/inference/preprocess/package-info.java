/**
 * Input loading and normalization.
 *
 * <p>All options live in an immutable
 * {@link fr.lapetina.inference.preprocess.PreprocessingConfig}, validated once
 * and passed to {@link fr.lapetina.inference.preprocess.ImagePreprocessor}.
 */
package fr.lapetina.inference.preprocess;
