package capture;

import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.objdetect.Objdetect;

import nu.pattern.OpenCV;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class OpenCvAprilTagEngineTest {

    private static boolean nativeLoaded;

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
     * White bordered image of one marker
     */
    private static byte[] markerImage(int id, int side, int border) {
        Mat marker = new Mat();
        Objdetect.generateImageMarker(Objdetect.getPredefinedDictionary(Objdetect.DICT_APRILTAG_36h11), id, side, marker);
        Mat bordered = new Mat();
        Core.copyMakeBorder(marker, bordered, border, border, border, border, Core.BORDER_CONSTANT, new Scalar(255));
        byte[] gray = new byte[bordered.rows() * bordered.cols()];
        bordered.get(0, 0, gray);
        marker.release();
        bordered.release();
        return gray;
    }

    @Test
    @DisplayName("A generated AprilTag is found with its id and center")
    void detect_GeneratedMarker_Found() {
        assumeTrue(nativeLoaded, "OpenCV native library not available");
        OpenCvAprilTagEngine engine = new OpenCvAprilTagEngine("APRILTAG_36h11");
        byte[] gray = markerImage(17, 200, 50);

        List<TagDetection> detections = engine.detect(gray, 300, 300);

        assertThat(detections).hasSize(1);
        TagDetection d = detections.get(0);
        assertThat(d.id()).isEqualTo(17L);
        assertThat(d.centerX()).isCloseTo(150., within(2.));
        assertThat(d.centerY()).isCloseTo(150., within(2.));
        assertThat(d.cornerCount()).isEqualTo(4);
        assertThat(engine.dictionaryName()).isEqualTo("APRILTAG_36h11");

        // the Mats are reused; a blank frame of another size finds nothing
        assertThat(engine.detect(new byte[120 * 90], 120, 90)).isEmpty();
    }

    @Test
    @DisplayName("Dictionary names map to OpenCV dictionaries")
    void dictionaryId_Names() {
        assertThat(OpenCvAprilTagEngine.dictionaryId("APRILTAG_36h11")).isEqualTo(Objdetect.DICT_APRILTAG_36h11);
        assertThat(OpenCvAprilTagEngine.dictionaryId("4X4_50")).isEqualTo(Objdetect.DICT_4X4_50);
        assertThatThrownBy(() -> OpenCvAprilTagEngine.dictionaryId("QR"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("QR");
    }
}
