package at.totenbilder.search.testutils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Random;

/**
 * Small generated images and deterministic stand-in embeddings
 */
public final class TestImages {

    public static final int DIMENSION = 512;

    private TestImages() {
    }

    /**
     * A 4x4 PNG filled with a colour derived from the seed
     */
    public static byte[] png(int seed) {
        BufferedImage image = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        int rgb = new Random(seed).nextInt(0xFFFFFF);
        for (int x = 0; x < 4; x++) {
            for (int y = 0; y < 4; y++) {
                image.setRGB(x, y, rgb);
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Embedding derived from the content bytes, equal content gives an equal vector
     */
    public static float[] embeddingOf(byte[] content) {
        return vector(Arrays.hashCode(content));
    }

    public static float[] vector(long seed) {
        Random random = new Random(seed);
        float[] vector = new float[DIMENSION];
        for (int i = 0; i < DIMENSION; i++) {
            vector[i] = (float) random.nextGaussian();
        }
        return vector;
    }
}
