package fr.lapetina.inference.preprocess;

import fr.lapetina.inference.domain.model.Tensor;

import java.io.IOException;
import java.util.List;

/**
 * Turns a chunk of input files into one batched input tensor.
 */
public interface InputPreprocessor {

    /**
     * @param files input files, one per batch entry
     * @return a tensor whose first dimension is {@code files.size()}
     * @throws IOException if a file cannot be read or decoded
     */
    Tensor loadAndPreprocess(List<String> files) throws IOException;
}
