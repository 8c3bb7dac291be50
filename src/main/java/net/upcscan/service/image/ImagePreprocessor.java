package net.upcscan.service.image;

import net.upcscan.model.scan.ScanInputs;
import net.upcscan.util.image.ImageOps;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

/**
 * Produces the plain and the contrast-enhanced grayscale views of a decoded image.
 *
 * <p>Enhancement is contrast-limited adaptive histogram equalization, which lifts
 * bars out of uneven lighting without blowing out the whole frame.</p>
 */
@Component
public class ImagePreprocessor {

    static final double CLAHE_CLIP_LIMIT = 2.0;
    static final Size CLAHE_TILE_GRID = new Size(8, 8);

    /**
     * @param image 1, 3 or 4 channel image; not modified
     * @return inputs owned by the caller, who must close them
     */
    public ScanInputs prepare(Mat image) {
        Mat original = ImageOps.toGray(image);
        Mat enhanced = new Mat();
        CLAHE clahe = Imgproc.createCLAHE(CLAHE_CLIP_LIMIT, CLAHE_TILE_GRID);
        clahe.apply(original, enhanced);
        return new ScanInputs(original, enhanced);
    }
}
