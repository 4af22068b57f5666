package com.ssau.aips.pipeline.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    private static final String PREFIX = "pipeline.";

    public static final Map<String, String> DEFAULT_FORBIDDEN_CLASSES;
    // COCO ids, used when a detector reports no class name
    public static final Map<Integer, String> DEFAULT_FORBIDDEN_CLASS_IDS;

    static {
        Map<String, String> classes = new LinkedHashMap<>();
        classes.put("cell phone", "phone");
        classes.put("phone", "phone");
        classes.put("book", "book");
        classes.put("laptop", "laptop");
        DEFAULT_FORBIDDEN_CLASSES = Collections.unmodifiableMap(classes);

        Map<Integer, String> ids = new LinkedHashMap<>();
        ids.put(67, "phone");
        ids.put(73, "book");
        ids.put(63, "laptop");
        DEFAULT_FORBIDDEN_CLASS_IDS = Collections.unmodifiableMap(ids);
    }

    // preprocessing
    @Builder.Default
    boolean enablePreprocessing = true;
    @Builder.Default
    boolean enableLightingNormalization = true;
    @Builder.Default
    boolean enableDenoise = true;
    @Builder.Default
    double claheClipLimit = 2.0;
    @Builder.Default
    int claheTileGrid = 8;
    @Builder.Default
    int bilateralDiameter = 5;
    @Builder.Default
    double bilateralSigmaColor = 50.0;
    @Builder.Default
    double bilateralSigmaSpace = 50.0;
    // off by default: detections below the cropped line are silently lost
    @Builder.Default
    boolean enableRoi = false;
    @Builder.Default
    double roiRatio = 0.7;

    // admission control
    @Builder.Default
    boolean enableAdaptiveSampling = true;
    @Builder.Default
    double motionThreshold = 10.0;
    @Builder.Default
    double minFps = 2.0;
    @Builder.Default
    double maxFps = 10.0;
    @Builder.Default
    int motionBlurKernel = 21;

    // head pose
    @Builder.Default
    double yawThreshold = 45.0;
    @Builder.Default
    double pitchThreshold = 30.0;
    @Builder.Default
    double decayFactor = 0.9;

    // objects
    @Builder.Default
    double forbiddenConfidence = 0.5;
    @Builder.Default
    double personConfidence = 0.4;
    @Builder.Default
    String personClass = "person";
    @Builder.Default
    int personClassId = 0;
    @Builder.Default
    Map<String, String> forbiddenClasses = DEFAULT_FORBIDDEN_CLASSES;
    @Builder.Default
    Map<Integer, String> forbiddenClassIds = DEFAULT_FORBIDDEN_CLASS_IDS;

    // detection fan-out
    @Builder.Default
    long timeoutMs = 150;

    // behavior window
    @Builder.Default
    int windowSize = 30;

    @Builder.Default
    ScoringConfig scoring = ScoringConfig.defaults();

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }

    public double minInterval() {
        return 1.0 / maxFps;
    }

    public double maxInterval() {
        return 1.0 / minFps;
    }

    public PipelineConfig validate() {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got " + windowSize);
        }
        if (!(minFps > 0) || maxFps < minFps) {
            throw new IllegalArgumentException(String.format(
                "Sampling rates must satisfy 0 < minFps <= maxFps, got %.2f/%.2f", minFps, maxFps));
        }
        if (motionThreshold < 0) {
            throw new IllegalArgumentException("motionThreshold must be >= 0, got " + motionThreshold);
        }
        if (motionBlurKernel < 1 || motionBlurKernel % 2 == 0) {
            throw new IllegalArgumentException("motionBlurKernel must be a positive odd number, got " + motionBlurKernel);
        }
        if (!(decayFactor > 0 && decayFactor < 1)) {
            throw new IllegalArgumentException("decayFactor must be in (0,1), got " + decayFactor);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0, got " + timeoutMs);
        }
        if (!(roiRatio > 0 && roiRatio <= 1)) {
            throw new IllegalArgumentException("roiRatio must be in (0,1], got " + roiRatio);
        }
        requireProbability("forbiddenConfidence", forbiddenConfidence);
        requireProbability("personConfidence", personConfidence);
        if (yawThreshold < 0 || pitchThreshold < 0) {
            throw new IllegalArgumentException("Deviation thresholds must be >= 0");
        }
        if (forbiddenClasses == null || forbiddenClassIds == null || personClass == null) {
            throw new IllegalArgumentException("Class mappings must be set");
        }
        scoring.validate();
        return this;
    }

    public static PipelineConfig fromProperties(Properties props) {
        PipelineConfig d = defaults();
        PipelineConfigBuilder builder = PipelineConfig.builder()
            .enablePreprocessing(boolProp(props, "preprocessing.enabled", d.enablePreprocessing))
            .enableLightingNormalization(boolProp(props, "preprocessing.lighting.enabled", d.enableLightingNormalization))
            .enableDenoise(boolProp(props, "preprocessing.denoise.enabled", d.enableDenoise))
            .claheClipLimit(doubleProp(props, "preprocessing.clahe.clip.limit", d.claheClipLimit))
            .claheTileGrid(intProp(props, "preprocessing.clahe.tile.grid", d.claheTileGrid))
            .bilateralDiameter(intProp(props, "preprocessing.bilateral.diameter", d.bilateralDiameter))
            .bilateralSigmaColor(doubleProp(props, "preprocessing.bilateral.sigma.color", d.bilateralSigmaColor))
            .bilateralSigmaSpace(doubleProp(props, "preprocessing.bilateral.sigma.space", d.bilateralSigmaSpace))
            .enableRoi(boolProp(props, "roi.enabled", d.enableRoi))
            .roiRatio(doubleProp(props, "roi.ratio", d.roiRatio))
            .enableAdaptiveSampling(boolProp(props, "sampling.adaptive.enabled", d.enableAdaptiveSampling))
            .motionThreshold(doubleProp(props, "motion.threshold", d.motionThreshold))
            .minFps(doubleProp(props, "sampling.min.fps", d.minFps))
            .maxFps(doubleProp(props, "sampling.max.fps", d.maxFps))
            .motionBlurKernel(intProp(props, "motion.blur.kernel", d.motionBlurKernel))
            .yawThreshold(doubleProp(props, "pose.yaw.threshold", d.yawThreshold))
            .pitchThreshold(doubleProp(props, "pose.pitch.threshold", d.pitchThreshold))
            .decayFactor(doubleProp(props, "pose.decay.factor", d.decayFactor))
            .forbiddenConfidence(doubleProp(props, "objects.forbidden.confidence", d.forbiddenConfidence))
            .personConfidence(doubleProp(props, "objects.person.confidence", d.personConfidence))
            .personClass(props.getProperty(PREFIX + "objects.person.class", d.personClass).trim())
            .personClassId(intProp(props, "objects.person.class.id", d.personClassId))
            .timeoutMs(Long.parseLong(props.getProperty(PREFIX + "detection.timeout.ms", String.valueOf(d.timeoutMs)).trim()))
            .windowSize(intProp(props, "window.size", d.windowSize))
            .scoring(ScoringConfig.fromProperties(props));

        String classes = props.getProperty(PREFIX + "objects.forbidden.classes");
        if (classes != null && !classes.isBlank()) {
            builder.forbiddenClasses(parseClassMapping(classes));
        }
        String classIds = props.getProperty(PREFIX + "objects.forbidden.class.ids");
        if (classIds != null && !classIds.isBlank()) {
            builder.forbiddenClassIds(parseClassIdMapping(classIds));
        }
        return builder.build().validate();
    }

    public static Map<String, String> parseClassMapping(String value) {
        Map<String, String> mapping = new LinkedHashMap<>();
        Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(entry -> !entry.isEmpty())
            .forEach(entry -> {
                int eq = entry.indexOf('=');
                if (eq < 0) {
                    mapping.put(entry, entry);
                } else {
                    mapping.put(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
                }
            });
        return Collections.unmodifiableMap(mapping);
    }

    public static Map<Integer, String> parseClassIdMapping(String value) {
        Map<Integer, String> mapping = new LinkedHashMap<>();
        parseClassMapping(value).forEach((id, label) -> {
            try {
                mapping.put(Integer.parseInt(id), label);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Forbidden class id is not a number: " + id, e);
            }
        });
        return Collections.unmodifiableMap(mapping);
    }

    private static void requireProbability(String name, double value) {
        if (value < 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be in [0,1], got " + value);
        }
    }

    private static boolean boolProp(Properties props, String key, boolean fallback) {
        return Boolean.parseBoolean(props.getProperty(PREFIX + key, String.valueOf(fallback)).trim());
    }

    private static int intProp(Properties props, String key, int fallback) {
        return Integer.parseInt(props.getProperty(PREFIX + key, String.valueOf(fallback)).trim());
    }

    private static double doubleProp(Properties props, String key, double fallback) {
        return Double.parseDouble(props.getProperty(PREFIX + key, String.valueOf(fallback)).trim());
    }
}
