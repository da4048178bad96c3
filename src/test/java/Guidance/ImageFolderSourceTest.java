package Guidance;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;

import capture.RawFrame;
import nu.pattern.OpenCV;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class ImageFolderSourceTest {

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

    @Test
    @DisplayName("Only image files are listed, in name order")
    void listImages_MixedFolder_ImagesSorted() throws IOException {
        Files.createFile(folder.resolve("b.PNG"));
        Files.createFile(folder.resolve("a.jpg"));
        Files.createFile(folder.resolve("notes.txt"));
        Files.createDirectory(folder.resolve("c.png"));

        assertThat(ImageFolderSource.listImages(folder)).extracting(p -> p.getFileName().toString())
            .containsExactly("a.jpg", "b.PNG");
    }

    @Test
    @DisplayName("A missing folder cannot be listed")
    void listImages_MissingFolder_Throws() {
        assertThatThrownBy(() -> ImageFolderSource.listImages(folder.resolve("missing")))
            .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    @DisplayName("Images are read as gray frames; undecodable files are skipped")
    void read_Files_GrayOrNull() throws IOException {
        assumeTrue(nativeLoaded, "OpenCV native library not available");
        Mat image = new Mat(30, 40, CvType.CV_8UC3, new Scalar(100, 100, 100));
        Imgcodecs.imwrite(folder.resolve("gray.png").toString(), image);
        image.release();
        Files.write(folder.resolve("broken.jpg"), new byte[] {1, 2, 3});
        ImageFolderSource source = new ImageFolderSource(folder);

        RawFrame frame = source.read(folder.resolve("gray.png"), 7L);
        assertThat(frame.width()).isEqualTo(40);
        assertThat(frame.height()).isEqualTo(30);
        assertThat(frame.luma(20, 15)).isEqualTo(100);
        assertThat(frame.timestampNs()).isEqualTo(7L);

        assertThat(source.read(folder.resolve("broken.jpg"), 8L)).isNull();
        assertThat(source.images()).hasSize(2);
    }
}
