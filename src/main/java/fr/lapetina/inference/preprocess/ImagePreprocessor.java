package fr.lapetina.inference.preprocess;

import fr.lapetina.inference.domain.model.ElemKind;
import fr.lapetina.inference.domain.model.Tensor;
import fr.lapetina.inference.domain.model.TensorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Reads images with {@link ImageIO} and normalizes them into a
 * three-channel batch tensor. Grayscale images are expanded to three equal
 * channels. Stateless, safe to share between workers.
 */
public final class ImagePreprocessor implements InputPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(ImagePreprocessor.class);

    private final PreprocessingConfig config;

    public ImagePreprocessor(PreprocessingConfig config) {
        this.config = Objects.requireNonNull(config, "Preprocessing config is required");
    }

    @Override
    public Tensor loadAndPreprocess(List<String> files) throws IOException {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No input files");
        }

        int batch = files.size();
        int height = -1;
        int width = -1;
        Tensor tensor = null;

        for (int n = 0; n < batch; n++) {
            String file = files.get(n);
            BufferedImage image = ImageIO.read(new File(file));
            if (image == null) {
                throw new IOException("Unsupported or unreadable image: " + file);
            }
            if (tensor == null) {
                height = image.getHeight();
                width = image.getWidth();
                tensor = new Tensor(tensorType(batch, height, width));
            } else if (image.getHeight() != height || image.getWidth() != width) {
                throw new IOException("Image " + file + " is " + image.getWidth() + "x" + image.getHeight()
                        + ", expected " + width + "x" + height + " like the rest of the batch");
            }
            fill(tensor, n, image);
            log.trace("Image loaded: file={}, width={}, height={}", file, width, height);
        }
        return tensor;
    }

    private TensorType tensorType(int batch, int height, int width) {
        ElemKind kind = config.convertToFloat16() ? ElemKind.FLOAT16 : ElemKind.FLOAT;
        int channels = PreprocessingConfig.CHANNELS;
        return config.layout() == ImageLayout.NCHW
                ? TensorType.of(kind, batch, channels, height, width)
                : TensorType.of(kind, batch, height, width, channels);
    }

    private void fill(Tensor tensor, int n, BufferedImage image) {
        int height = image.getHeight();
        int width = image.getWidth();
        int channels = PreprocessingConfig.CHANNELS;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int[] colors = {(rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff};
                for (int c = 0; c < channels; c++) {
                    int pixel = colors[config.channelOrder().colorAt(c)];
                    int index = config.layout() == ImageLayout.NCHW
                            ? ((n * channels + c) * height + y) * width + x
                            : ((n * height + y) * width + x) * channels + c;
                    tensor.set(index, config.normalize(pixel, c));
                }
            }
        }
    }

    public PreprocessingConfig getConfig() {
        return config;
    }
}
