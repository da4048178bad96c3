package capture;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.objdetect.ArucoDetector;
import org.opencv.objdetect.DetectorParameters;
import org.opencv.objdetect.Dictionary;
import org.opencv.objdetect.Objdetect;
import org.opencv.objdetect.RefineParameters;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     OpenCvAprilTagEngine class                                  */
/*                                     OpenCvAprilTagEngine class                                  */
/*                                     OpenCvAprilTagEngine class                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * {@link TagDetectorEngine} backed by the OpenCV ArUco detector with an AprilTag dictionary.
 *
 * The OpenCV native library must be loaded before construction. Not thread safe; the Mats are
 * reused frame to frame by the single frame processing thread.
 */
public class OpenCvAprilTagEngine implements TagDetectorEngine
{
    private static final Logger LOGGER = Logger.getLogger(OpenCvAprilTagEngine.class.getName());
    static {
        LOGGER.finer("Loading");
    }

    private final String dictionaryName;
    private final ArucoDetector detector;

    // per frame data
    private Mat gray = new Mat();
    private final List<Mat> corners = new ArrayList<>();
    private final Mat ids = new Mat();

    public OpenCvAprilTagEngine(String dictionaryName)
    {
        this.dictionaryName = dictionaryName;
        final Dictionary dictionary = Objdetect.getPredefinedDictionary(dictionaryId(dictionaryName));
        final DetectorParameters detectParams = new DetectorParameters();
        detectParams.set_cornerRefinementMethod(Objdetect.CORNER_REFINE_SUBPIX);
        this.detector = new ArucoDetector(dictionary, detectParams, new RefineParameters());
        LOGGER.config("OpenCV marker dictionary " + dictionaryName);
    }

    public OpenCvAprilTagEngine()
    {
        this(Cfg.dictionaryName);
    }

    public String dictionaryName()
    {
        return dictionaryName;
    }

    /**
     * @return OpenCV predefined dictionary constant for the name used in summaries
     */
    static int dictionaryId(String name)
    {
        switch (name)
        {
            case "APRILTAG_16h5":
                return Objdetect.DICT_APRILTAG_16h5;
            case "APRILTAG_25h9":
                return Objdetect.DICT_APRILTAG_25h9;
            case "APRILTAG_36h10":
                return Objdetect.DICT_APRILTAG_36h10;
            case "APRILTAG_36h11":
                return Objdetect.DICT_APRILTAG_36h11;
            case "ARUCO_ORIGINAL":
                return Objdetect.DICT_ARUCO_ORIGINAL;
            case "4X4_50":
                return Objdetect.DICT_4X4_50;
            default:
                throw new IllegalArgumentException("unknown marker dictionary " + name);
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     detect                                                      */
/*                                     detect                                                      */
/*                                     detect                                                      */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    @Override
    public List<TagDetection> detect(byte[] buffer, int width, int height)
    {
        if (gray.rows() != height || gray.cols() != width)
        {
            gray.release();
            gray = new Mat(height, width, CvType.CV_8UC1);
        }
        gray.put(0, 0, buffer);

        for (Mat c : corners)
        {
            c.release();
        }
        corners.clear();
        detector.detectMarkers(gray, corners, ids);

        List<TagDetection> detections = new ArrayList<>(corners.size());
        final float[] xy = new float[8];
        for (int i = 0; i < corners.size(); i++)
        {
            // each marker is 1x4 CV_32FC2 in detector order
            corners.get(i).get(0, 0, xy);
            double[] flat = new double[8];
            double sx = 0.;
            double sy = 0.;
            for (int k = 0; k < 4; k++)
            {
                flat[2 * k] = xy[2 * k];
                flat[2 * k + 1] = xy[2 * k + 1];
                sx += xy[2 * k];
                sy += xy[2 * k + 1];
            }
            long id = (long)ids.get(i, 0)[0];
            detections.add(new TagDetection(id, sx / 4., sy / 4., flat, null));
        }
        return detections;
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End OpenCvAprilTagEngine class                              */
/*                                     End OpenCvAprilTagEngine class                              */
/*                                     End OpenCvAprilTagEngine class                              */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
