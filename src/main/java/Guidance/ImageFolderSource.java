package Guidance;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.stream.Stream;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import capture.RawFrame;

/**
 * Frames from the image files of a folder in file name order, decoded to 8 bit gray
 */
class ImageFolderSource
{
    private static final Logger LOGGER = Logger.getLogger(ImageFolderSource.class.getName());

    private static final List<String> EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".bmp", ".tif", ".tiff");

    private final List<Path> images;

    ImageFolderSource(Path folder)
    {
        this.images = listImages(folder);
        LOGGER.config(images.size() + " images in " + folder);
    }

    List<Path> images()
    {
        return images;
    }

    static List<Path> listImages(Path folder)
    {
        List<Path> list = new ArrayList<>();
        try (Stream<Path> files = Files.list(folder))
        {
            files.filter(Files::isRegularFile)
                .filter(ImageFolderSource::isImage)
                .forEach(list::add);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("cannot list images in " + folder, e);
        }
        Collections.sort(list);
        return list;
    }

    static boolean isImage(Path path)
    {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String extension : EXTENSIONS)
        {
            if (name.endsWith(extension)) return true;
        }
        return false;
    }

    /**
     * @return gray frame, or null if the file cannot be decoded
     */
    RawFrame read(Path image, long timestampNs)
    {
        Mat gray = Imgcodecs.imread(image.toString(), Imgcodecs.IMREAD_GRAYSCALE);
        try
        {
            if (gray.empty() || gray.type() != CvType.CV_8UC1)
            {
                LOGGER.warning("skipping unreadable image " + image);
                return null;
            }
            byte[] luma = new byte[gray.rows() * gray.cols()];
            gray.get(0, 0, luma);
            return RawFrame.gray(gray.cols(), gray.rows(), luma, timestampNs);
        }
        finally
        {
            gray.release();
        }
    }
}
