package net.upcscan.service.image;

import net.upcscan.exception.ImageDecodeException;
import net.upcscan.util.image.ImageOps;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes encoded image bytes (JPEG, PNG, ...) into a BGR pixel grid.
 */
@Component
public class ImageDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ImageDecoder.class);

    /**
     * @param imageBytes encoded image
     * @return colour image owned by the caller
     * @throws ImageDecodeException when the bytes are missing or not a supported image
     */
    public Mat decode(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageDecodeException("Image bytes are null or empty");
        }

        MatOfByte buffer = new MatOfByte(imageBytes);
        try {
            Mat image = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR);
            if (!ImageOps.isUsable(image)) {
                logger.warn("Could not decode {} bytes into an image. Format might be unsupported or corrupt.", imageBytes.length);
                throw new ImageDecodeException("Could not decode image (" + imageBytes.length + " bytes)");
            }
            logger.debug("Decoded {} bytes into {}x{} image", imageBytes.length, image.cols(), image.rows());
            return image;
        } catch (CvException e) {
            throw new ImageDecodeException("Image codec failed: " + e.getMessage(), e);
        } finally {
            buffer.release();
        }
    }
}
