// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.layout;

import org.img2book.error.ImageInsertException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Reads the intrinsic pixel size of an image from its header, without decoding the pixels.
 * Any format with an ImageIO reader is supported (WebP through the TwelveMonkeys plugin).
 */
public class ImageDimensionReader {

    /**
     * @param imageFile The image to inspect
     * @return Width and height in pixels
     * @throws ImageInsertException if the file is missing, unreadable or not a recognised image
     */
    public ImageDimensions read(Path imageFile) {
        if (!Files.isRegularFile(imageFile)) {
            throw new ImageInsertException(imageFile, "file not found");
        }

        try (ImageInputStream input = ImageIO.createImageInputStream(imageFile.toFile())) {
            if (input == null) {
                throw new ImageInsertException(imageFile, "cannot open image stream");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new ImageInsertException(imageFile, "unsupported image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new ImageInsertException(imageFile, "invalid dimensions " + width + "x" + height);
                }
                return new ImageDimensions(width, height);
            } finally {
                reader.dispose();
            }
        } catch (ImageInsertException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ImageInsertException(imageFile, e);
        }
    }
}
