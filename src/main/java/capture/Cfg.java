package capture;

import java.util.logging.Level;

public class Cfg
{
    // frame quality analyzer
    static final int targetFps = 12; // ~10-15 fps; frames arriving sooner are dropped, not queued
    static final double qualityRoiFrac = 0.40; // center ROI size as fraction of width and height
    static final int qualityRoiMinSide = 64;
    static final int laplacianStep = 2; // sample every 2nd pixel for speed
    static final int exposureStep = 2;
    static final double blurThreshold = 150.; // Laplacian variance below this is blurred; tune per device
    static final int clipHigh = 245; // highlight clipping level [0, 255]
    static final int clipLow = 10; // shadow clipping level [0, 255]
    static final double overThresh = 0.02; // fraction of clipped highlights that is too much
    static final double underThresh = 0.02; // fraction of clipped shadows that is too much
    static final int specularMaxClusters = 5; // a few small bright dots are tolerable
    static final int specularMaxClusterSize = 100; // sampled pixels

    // marker detection adapter
    static final double markerRoiFrac = 0.60;
    static final int markerRoiMinSide = 160;
    static final int downsampleStep = 2; // integer row/column subsampling into the detector buffer
    static final String dictionaryName = "APRILTAG_36h11";

    // shared guidance gates
    static final double distanceMinCm = 20.;
    static final double distanceMaxCm = 30.;
    static final double edgeMarginFrac = 0.10; // detections must stay this far from every frame edge
    static final int stableIdsN = 8; // number of most frequently seen ids tracked when none are required

    // capture session sufficiency
    static final int captureGoodCapturesTarget = 60;
    static final int captureGridTargetFilled = 7; // of 9
    static final int perTagTarget = 10;
    static final boolean crossArchRequired = true;

    // capture session phase completion
    static final int anchorMidMin = 2; // center, left and right mid-height each
    static final int anchorHighLowMin = 2; // high any and low any each
    static final int sweepMidMin = 5;
    static final int sweepHighLowMin = 3;
    static final int crossArchTotalMin = 6;
    static final int crossArchHighLowMin = 2;
    static final double crossArchSpreadMin = 0.65; // fraction of frame width, independent of distance

    // calibration session sufficiency
    static final double calibrationDistanceTargetCm = 25.;
    static final int calibrationGoodCapturesTarget = 25;
    static final int calibrationGridTargetFilled = 8; // of 9

    // manifest and sidecar summaries
    static final int summaryVersion = 1;

    // per frame tracing; raise to see every analyzed frame
    static final Level frameTraceLevel = Level.FINEST;

    private Cfg(){}
}
