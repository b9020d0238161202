package fr.lapetina.inference.preprocess;

/**
 * Order of color channels in the input tensor.
 */
public enum ImageChannelOrder {
    BGR,
    RGB;

    /**
     * Source color (0 = red, 1 = green, 2 = blue) stored at a tensor channel.
     */
    public int colorAt(int channel) {
        return this == RGB ? channel : 2 - channel;
    }
}
