package Guidance;

import java.nio.file.Path;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.objdetect.Objdetect;

import nu.pattern.OpenCV;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class MainTest {

    private static boolean nativeLoaded;

    @TempDir
    Path folder;

    @BeforeAll
    static void loadOpenCV() {
        try {
            OpenCV.loadLocally();
            nativeLoaded = true;
        } catch (Throwable e) {
            nativeLoaded = false;
        }
    }

    /**
     * One AprilTag in the middle of a 600x600 image, gray levels kept away from clipping
     */
    private void writeMarkerImage(String name, int id) {
        Mat marker = new Mat();
        Objdetect.generateImageMarker(Objdetect.getPredefinedDictionary(Objdetect.DICT_APRILTAG_36h11), id, 160, marker);
        Mat softened = new Mat();
        marker.convertTo(softened, -1, 130. / 255., 60.);
        Mat image = new Mat();
        Core.copyMakeBorder(softened, image, 220, 220, 220, 220, Core.BORDER_CONSTANT, new Scalar(190));
        Imgcodecs.imwrite(folder.resolve(name).toString(), image);
        marker.release();
        softened.release();
        image.release();
    }

    @Test
    @DisplayName("Auto capture counts each good replayed frame")
    void run_AutoCapture_FramesCounted() throws ParseException {
        assumeTrue(nativeLoaded, "OpenCV native library not available");
        writeMarkerImage("01.png", 5);
        writeMarkerImage("02.png", 5);
        writeMarkerImage("03.png", 5);

        ReplayOptions options = ReplayOptions.parse(new String[] {"-a", "-R", "10", folder.toString()});
        Main main = new Main(options);
        main.run(new ImageFolderSource(folder));

        assertThat(main.goodCaptures()).isEqualTo(3);
    }

    @Test
    @DisplayName("Nothing is counted in a calibration session of frames without markers")
    void run_CalibrationNoMarkers_NothingCounted() throws ParseException {
        assumeTrue(nativeLoaded, "OpenCV native library not available");
        Mat blank = new Mat(300, 300, org.opencv.core.CvType.CV_8UC1, new Scalar(128));
        Imgcodecs.imwrite(folder.resolve("blank.png").toString(), blank);
        blank.release();

        ReplayOptions options = ReplayOptions.parse(new String[] {"-a", "-m", "calibration", folder.toString()});
        Main main = new Main(options);
        main.run(new ImageFolderSource(folder));

        assertThat(main.goodCaptures()).isZero();
    }
}
