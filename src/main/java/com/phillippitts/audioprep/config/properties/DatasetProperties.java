package com.phillippitts.audioprep.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Dataset layout, split ratios, segmentation and label remapping settings.
 *
 * <p>Example application.properties:
 * <pre>
 * dataset.data-path=data
 * dataset.train-fraction=0.70
 * dataset.validate-fraction=0.20
 * dataset.remove-classes=Noise
 * dataset.other-classes=Dolphin,Seal
 * </pre>
 *
 * <p>Note: Bean created via {@link com.phillippitts.audioprep.AudioPrepApplication}.
 */
@ConfigurationProperties(prefix = "dataset")
@Validated
public class DatasetProperties {

    /** Root directory that is indexed and that receives the split feature artifacts. */
    @NotBlank(message = "Data path must not be blank")
    private String dataPath = "data";

    /** Directory receiving label encoding artifacts. */
    @NotBlank(message = "Output path must not be blank")
    private String outputPath = "output";

    /** File extensions recognized as audio (case-insensitive). */
    @NotEmpty(message = "At least one audio extension is required")
    private List<String> audioExtensions = new ArrayList<>(List.of(".wav"));

    @DecimalMin(value = "0.0", message = "Train fraction must be >= 0")
    @DecimalMax(value = "1.0", message = "Train fraction must be <= 1")
    private double trainFraction = 0.70;

    @DecimalMin(value = "0.0", message = "Validate fraction must be >= 0")
    @DecimalMax(value = "1.0", message = "Validate fraction must be <= 1")
    private double validateFraction = 0.20;

    /** Labels with fewer files than this are left out of every split. */
    @Positive(message = "Minimum files per label must be positive")
    private int minFilesPerLabel = 10;

    private long shuffleSeed = 251L;

    @Positive(message = "Segment length must be positive")
    private double segmentSeconds = 5.0;

    @Positive(message = "Maximum length must be positive")
    private double maxSeconds = 60.0;

    /** Labels dropped when features are loaded. */
    @NotNull
    private Set<String> removeClasses = new LinkedHashSet<>();

    /** Labels folded into {@link #otherClass} when features are loaded. */
    @NotNull
    private Set<String> otherClasses = new LinkedHashSet<>();

    @NotBlank(message = "Catch-all class name must not be blank")
    private String otherClass = "Other";

    private boolean prepareOnStartup = false;

    public String getDataPath() {
        return dataPath;
    }

    public void setDataPath(String dataPath) {
        this.dataPath = dataPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public List<String> getAudioExtensions() {
        return audioExtensions;
    }

    public void setAudioExtensions(List<String> audioExtensions) {
        this.audioExtensions = audioExtensions;
    }

    public double getTrainFraction() {
        return trainFraction;
    }

    public void setTrainFraction(double trainFraction) {
        this.trainFraction = trainFraction;
    }

    public double getValidateFraction() {
        return validateFraction;
    }

    public void setValidateFraction(double validateFraction) {
        this.validateFraction = validateFraction;
    }

    public int getMinFilesPerLabel() {
        return minFilesPerLabel;
    }

    public void setMinFilesPerLabel(int minFilesPerLabel) {
        this.minFilesPerLabel = minFilesPerLabel;
    }

    public long getShuffleSeed() {
        return shuffleSeed;
    }

    public void setShuffleSeed(long shuffleSeed) {
        this.shuffleSeed = shuffleSeed;
    }

    public double getSegmentSeconds() {
        return segmentSeconds;
    }

    public void setSegmentSeconds(double segmentSeconds) {
        this.segmentSeconds = segmentSeconds;
    }

    public double getMaxSeconds() {
        return maxSeconds;
    }

    public void setMaxSeconds(double maxSeconds) {
        this.maxSeconds = maxSeconds;
    }

    public Set<String> getRemoveClasses() {
        return removeClasses;
    }

    public void setRemoveClasses(Set<String> removeClasses) {
        this.removeClasses = removeClasses;
    }

    public Set<String> getOtherClasses() {
        return otherClasses;
    }

    public void setOtherClasses(Set<String> otherClasses) {
        this.otherClasses = otherClasses;
    }

    public String getOtherClass() {
        return otherClass;
    }

    public void setOtherClass(String otherClass) {
        this.otherClass = otherClass;
    }

    public boolean isPrepareOnStartup() {
        return prepareOnStartup;
    }

    public void setPrepareOnStartup(boolean prepareOnStartup) {
        this.prepareOnStartup = prepareOnStartup;
    }
}
