package Guidance;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import capture.CalibrationGuidanceSettings;
import capture.CaptureGuidanceSettings;
import capture.MarkerMode;

/**
 * Command line of the replay tool
 */
class ReplayOptions
{
    private static final Logger LOGGER = Logger.getLogger(ReplayOptions.class.getName());

    enum SessionMode {CAPTURE, CALIBRATION}

    Path imageFolder;
    SessionMode mode;
    List<Long> requiredIds;
    MarkerMode markerMode;
    Integer goodCaptures; // null keeps the session type's default
    Integer gridFilled;
    Integer perTag;
    int fps;
    Float diopters;
    boolean autoCapture;
    Level logLevel;

    static Options options()
    {
        Options options = new Options();

        options.addOption("h", "help", false, "Show this help text and exit");
        options.addOption("i", "images", true, "folder of images to replay (.)");
        options.addOption("m", "mode", true, "session type (capture) [capture, calibration]");
        options.addOption("r", "required", true, "required marker ids, comma separated (none)");
        options.addOption("k", "markerMode", true, "marker mode (WARN) " + Arrays.toString(MarkerMode.values()));
        options.addOption("g", "goodCaptures", true, "good captures target (60 capture, 25 calibration)");
        options.addOption("G", "gridFilled", true, "filled grid cells target (7 capture, 8 calibration)");
        options.addOption("t", "perTag", true, "captures per tracked tag target (10)");
        options.addOption("R", "fps", true, "replay frames per second (30)");
        options.addOption("d", "diopters", true, "lens focus distance in diopters for distance estimates (unknown)");
        options.addOption("a", "autoCapture", false, "capture every replayed frame instead of reading c/r/q commands");
        options.addOption("l", "logLevel", true, "minimum log level (INFO)");
        return options;
    }

    /**
     * @return options, or null if help was asked for
     * @throws ParseException unknown option or a value that is not a number
     */
    static ReplayOptions parse(String[] args) throws ParseException
    {
        Options options = options();
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);

        if (cmd.hasOption("h")) {
            // make a string to hold the help and log it
            StringWriter sw = new StringWriter(1000);
            PrintWriter pw = new PrintWriter(sw);
            new HelpFormatter().printHelp(pw, 100, "java -jar capture-guidance.jar [options] [image folder]",
                null, options, 1, 3, null);
            pw.flush();
            LOGGER.info("\n\n" + sw.toString());
            return null;
        }

        ReplayOptions replay = new ReplayOptions();
        try {
            String folder = cmd.getOptionValue("images", cmd.getArgs().length > 0 ? cmd.getArgs()[0] : ".");
            replay.imageFolder = Paths.get(folder);
            replay.mode = SessionMode.valueOf(cmd.getOptionValue("mode", "capture").toUpperCase());
            replay.requiredIds = parseIds(cmd.getOptionValue("required", ""));
            replay.markerMode = MarkerMode.valueOf(cmd.getOptionValue("markerMode", "WARN").toUpperCase());
            replay.goodCaptures = cmd.hasOption("goodCaptures") ? Integer.valueOf(cmd.getOptionValue("goodCaptures")) : null;
            replay.gridFilled = cmd.hasOption("gridFilled") ? Integer.valueOf(cmd.getOptionValue("gridFilled")) : null;
            replay.perTag = cmd.hasOption("perTag") ? Integer.valueOf(cmd.getOptionValue("perTag")) : null;
            replay.fps = Integer.parseInt(cmd.getOptionValue("fps", "30"));
            replay.diopters = cmd.hasOption("diopters") ? Float.valueOf(cmd.getOptionValue("diopters")) : null;
            replay.logLevel = Level.parse(cmd.getOptionValue("logLevel", "INFO").toUpperCase());
        } catch (IllegalArgumentException e) { // includes NumberFormatException
            throw new ParseException("bad option value: " + e.getMessage());
        }
        replay.autoCapture = cmd.hasOption("autoCapture");

        if (replay.fps <= 0) {
            throw new ParseException("fps must be positive " + replay.fps);
        }
        if (cmd.getArgs().length > 1) {
            LOGGER.warning("Arguments Not Recognized: " + Arrays.toString(cmd.getArgs()));
        }
        return replay;
    }

    /**
     * @param text comma separated ids, blank for none
     */
    static List<Long> parseIds(String text)
    {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        List<Long> ids = new ArrayList<>();
        for (String id : text.split(",")) {
            if ( ! id.isBlank()) {
                ids.add(Long.valueOf(id.trim()));
            }
        }
        return ids;
    }

    CaptureGuidanceSettings captureSettings()
    {
        CaptureGuidanceSettings settings = new CaptureGuidanceSettings();
        if (goodCaptures != null) settings.goodCapturesTarget = goodCaptures;
        if (gridFilled != null) settings.gridTargetFilled = gridFilled;
        if (perTag != null) settings.perTagTarget = perTag;
        return settings;
    }

    CalibrationGuidanceSettings calibrationSettings()
    {
        CalibrationGuidanceSettings settings = new CalibrationGuidanceSettings();
        if (goodCaptures != null) settings.goodCapturesTarget = goodCaptures;
        if (gridFilled != null) settings.gridTargetFilled = gridFilled;
        return settings;
    }

    /**
     * @return nanoseconds between replayed frames
     */
    long frameIntervalNs()
    {
        return 1_000_000_000L / fps;
    }

    @Override
    public String toString()
    {
        return mode + " " + imageFolder + " required " + requiredIds + " markers " + markerMode + " fps " + fps
            + (diopters == null ? "" : " diopters " + diopters) + (autoCapture ? " auto capture" : "");
    }
}
