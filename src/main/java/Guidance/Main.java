// Replay a folder of images through frame quality analysis, marker detection and capture guidance

package Guidance;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.logging.Logger;

import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.tuple.Pair;

import capture.CalibrationGuidanceTracker;
import capture.CaptureGuidanceTracker;
import capture.CaptureLiveGuidance;
import capture.FiducialMarkerDetector;
import capture.FrameAnalysisPipeline;
import capture.FrozenMarkerSnapshot;
import capture.FrozenQualitySnapshot;
import capture.LensMetadataStore;
import capture.MarkerDetector;
import capture.MarkerMode;
import capture.MarkerSettings;
import capture.MarkerStatusFormatter;
import capture.OpenCvAprilTagEngine;
import capture.QualityAnalyzer;
import capture.QualitySettings;
import capture.RawFrame;
import capture.SummaryJson;
import nu.pattern.OpenCV;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     Main class                                                  */
/*                                     Main class                                                  */
/*                                     Main class                                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*
 * The camera, screen and file writing of a capture app are outside this program. Frames come
 * from image files instead and the guidance, capture decisions and summaries go to the log.
 */
public class Main {
    private static final String VERSION = "1.0.0";

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private final ReplayOptions options;
    private final MarkerDetector markerDetector;
    private final FrameAnalysisPipeline pipeline;
    private final CaptureGuidanceTracker captureTracker; // null in calibration sessions
    private final CalibrationGuidanceTracker calibrationTracker; // null in capture sessions
    private String lastMessage = "";
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     main                                                        */
/*                                     main                                                        */
/*                                     main                                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    public static void main(String[] args)
    {
        ReplayOptions options;
        try {
            options = ReplayOptions.parse(args);
        } catch (ParseException e) {
            LOGGER.severe("Failed to parse command-line options! " + e.getMessage());
            System.exit(1);
            return;
        }
        if (options == null) {
            return; // help shown
        }

        LoggerSetup.setupLogger(options.logLevel);
        LOGGER.config("Capture guidance replay version " + VERSION);
        LOGGER.config("Command Line Args " + Arrays.toString(args));
        LOGGER.config(options.toString());

        OpenCV.loadLocally();

        Main replay = new Main(options);
        replay.run(new ImageFolderSource(options.imageFolder));
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     Main constructor                                            */
/*                                     Main constructor                                            */
/*                                     Main constructor                                            */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    Main(ReplayOptions options)
    {
        this.options = options;

        // the replayed images have no lens metadata; a fixed focus distance may be given instead
        LensMetadataStore lens = new LensMetadataStore();
        lens.onFrameMetadata(null, null, options.diopters);
        LOGGER.config(MarkerStatusFormatter.formatFocusDistance(options.diopters));

        MarkerSettings markerSettings = new MarkerSettings();
        markerDetector = new FiducialMarkerDetector(new OpenCvAprilTagEngine(markerSettings.dictionaryName),
            markerSettings, options.markerMode);
        markerDetector.setRequiredIdentities(options.requiredIds);

        // every replayed frame is analyzed on this thread, in order
        pipeline = new FrameAnalysisPipeline(new QualityAnalyzer(new QualitySettings(), lens, null),
            markerDetector, Runnable::run);

        if (options.mode == ReplayOptions.SessionMode.CAPTURE) {
            captureTracker = new CaptureGuidanceTracker(options.captureSettings());
            captureTracker.onRequiredIdentitiesChanged(options.requiredIds);
            calibrationTracker = null;
        }
        else {
            captureTracker = null;
            calibrationTracker = new CalibrationGuidanceTracker(options.calibrationSettings());
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     run                                                         */
/*                                     run                                                         */
/*                                     run                                                         */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    void run(ImageFolderSource source)
    {
        Keystroke keystroke = null;
        if ( ! options.autoCapture) {
            keystroke = new Keystroke();
            Thread keyboardThread = new Thread(keystroke, "keys");
            keyboardThread.setDaemon(true);
            keyboardThread.start();
        }

        long timestampNs = 0L;
        frameLoop:
        for (Path image : source.images()) {
            RawFrame frame = source.read(image, timestampNs);
            timestampNs += options.frameIntervalNs();
            if (frame == null) {
                continue;
            }
            pipeline.submit(frame);
            showGuidance();

            int key = keystroke == null ? Keystroke.keyCapture : keystroke.getKey();
            switch (key)
            {
                case Keystroke.keyNone:
                    break;
                case Keystroke.keyTerminate:
                    LOGGER.info("Replay CANCELLED");
                    break frameLoop;
                case Keystroke.keyReset:
                    resetSession();
                    break;
                case Keystroke.keyCapture:
                    capture(image);
                    break;
                default:
                    break;
            }
        }

        finish();
    }

    private void showGuidance()
    {
        String message;
        if (captureTracker != null) {
            message = captureTracker.buildLiveGuidance(markerDetector.latest(),
                pipeline.qualityAnalyzer().latest(), markerDetector.sessionSummary()).toString();
        }
        else {
            message = calibrationTracker.buildLiveGuidance(markerDetector.latest(),
                pipeline.qualityAnalyzer().latest()).toString();
        }
        if ( ! message.equals(lastMessage)) {
            LOGGER.info(message);
            lastMessage = message;
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     capture                                                     */
/*                                     capture                                                     */
/*                                     capture                                                     */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Count a capture of the latest analyzed frame as a capture app would after saving it
     */
    boolean capture(Path image)
    {
        Pair<FrozenMarkerSnapshot, FrozenQualitySnapshot> snapshot = pipeline.captureSnapshot();
        FrozenMarkerSnapshot marker = snapshot.getLeft();
        FrozenQualitySnapshot quality = snapshot.getRight();

        if (captureTracker != null) {
            if (marker.mode() == MarkerMode.BLOCK) {
                CaptureLiveGuidance guidance = captureTracker.buildLiveGuidance(markerDetector.latest(),
                    pipeline.qualityAnalyzer().latest(), markerDetector.sessionSummary());
                if (guidance.isBlocked()) {
                    LOGGER.info("capture of " + image.getFileName() + " blocked: " + guidance.blockReason());
                    return false;
                }
            }
            boolean counted = captureTracker.onCaptureSaved(marker, quality, markerDetector.sessionSummary());
            LOGGER.fine(image.getFileName() + " sidecar " + SummaryJson.toJson(
                captureTracker.buildSidecarMarkerSummary(marker, quality, markerDetector.sessionSummary())));
            return counted;
        }

        boolean counted = calibrationTracker.onCaptureSaved(marker, quality);
        LOGGER.fine(image.getFileName() + " sidecar " + SummaryJson.toJson(
            calibrationTracker.buildSidecarMarkerSummary(marker, quality)));
        return counted;
    }

    void resetSession()
    {
        markerDetector.reset();
        if (captureTracker != null) {
            captureTracker.resetForNewSession();
            captureTracker.onRequiredIdentitiesChanged(options.requiredIds);
        }
        else {
            calibrationTracker.resetForNewSession();
        }
    }

    int goodCaptures()
    {
        return captureTracker != null ? captureTracker.goodCaptures() : calibrationTracker.goodCaptures();
    }

    private void finish()
    {
        pipeline.shutdown();
        LOGGER.info(markerDetector.sessionSummary().toString());
        if (captureTracker != null) {
            LOGGER.info(captureTracker.sufficiency(markerDetector.sessionSummary()).toString());
            LOGGER.info("manifest\n" + SummaryJson.toJson(captureTracker.buildManifestSummary(markerDetector.sessionSummary())));
        }
        else {
            LOGGER.info(calibrationTracker.sufficiency().toString());
            LOGGER.info("manifest\n" + SummaryJson.toJson(calibrationTracker.buildManifestSummary()));
        }
        LOGGER.finest("End of running main");
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End Main class                                              */
/*                                     End Main class                                              */
/*                                     End Main class                                              */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
