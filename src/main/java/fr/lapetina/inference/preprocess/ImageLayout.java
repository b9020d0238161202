package fr.lapetina.inference.preprocess;

/**
 * Memory layout of the input tensor.
 */
public enum ImageLayout {
    /** [batch, channels, height, width] */
    NCHW,

    /** [batch, height, width, channels] */
    NHWC
}
