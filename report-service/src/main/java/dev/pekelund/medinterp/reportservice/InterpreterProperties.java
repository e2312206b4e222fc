package dev.pekelund.medinterp.reportservice;

import dev.pekelund.medinterp.classification.ReportTypeHeuristic;
import dev.pekelund.medinterp.interpretation.AnalyteRule;
import dev.pekelund.medinterp.interpretation.DecisionBand;
import dev.pekelund.medinterp.interpretation.InterpreterTexts;
import dev.pekelund.medinterp.model.InterpretationCategory;
import dev.pekelund.medinterp.model.ReportType;
import dev.pekelund.medinterp.normalization.UnitConversion;
import dev.pekelund.medinterp.pipeline.FeedbackTemplates;
import dev.pekelund.medinterp.pipeline.PipelineConfiguration;
import dev.pekelund.medinterp.pipeline.PipelineThresholds;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pipeline settings bound from {@code interpreter.*}. Converted once into an immutable
 * {@link PipelineConfiguration}; invalid values fail at startup.
 */
@ConfigurationProperties(prefix = "interpreter")
public class InterpreterProperties {

    private Duration extractionTimeout = Duration.ofSeconds(30);
    private int extractionThreads = 4;
    private final Thresholds thresholds = new Thresholds();
    private final Persistence persistence = new Persistence();
    private List<Heuristic> heuristics = new ArrayList<>();
    private List<Conversion> conversions = new ArrayList<>();
    private Set<String> canonicalUnits = new LinkedHashSet<>();
    private Set<String> numericUnits = new LinkedHashSet<>();
    private List<Analyte> analytes = new ArrayList<>();
    private final Texts texts = new Texts();
    private Map<String, String> feedback = new LinkedHashMap<>();
    private List<String> references = new ArrayList<>();

    public PipelineConfiguration toPipelineConfiguration() {
        PipelineThresholds pipelineThresholds = new PipelineThresholds(thresholds.getQualityFloor(),
            thresholds.getTypeDetection(), thresholds.getExtractionMin(), thresholds.getNormalizationMin(),
            thresholds.getOverallAcceptMin());
        return new PipelineConfiguration(
            pipelineThresholds,
            extractionTimeout,
            heuristics.stream().map(Heuristic::toHeuristic).toList(),
            conversions.stream().map(Conversion::toConversion).toList(),
            canonicalUnits,
            numericUnits,
            analytes.stream().map(Analyte::toRule).toList(),
            texts.toTexts(),
            new FeedbackTemplates(feedback),
            references);
    }

    public Duration getExtractionTimeout() {
        return extractionTimeout;
    }

    public void setExtractionTimeout(Duration extractionTimeout) {
        this.extractionTimeout = extractionTimeout;
    }

    public int getExtractionThreads() {
        return extractionThreads;
    }

    public void setExtractionThreads(int extractionThreads) {
        this.extractionThreads = extractionThreads;
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public List<Heuristic> getHeuristics() {
        return heuristics;
    }

    public void setHeuristics(List<Heuristic> heuristics) {
        this.heuristics = heuristics;
    }

    public List<Conversion> getConversions() {
        return conversions;
    }

    public void setConversions(List<Conversion> conversions) {
        this.conversions = conversions;
    }

    public Set<String> getCanonicalUnits() {
        return canonicalUnits;
    }

    public void setCanonicalUnits(Set<String> canonicalUnits) {
        this.canonicalUnits = canonicalUnits;
    }

    public Set<String> getNumericUnits() {
        return numericUnits;
    }

    public void setNumericUnits(Set<String> numericUnits) {
        this.numericUnits = numericUnits;
    }

    public List<Analyte> getAnalytes() {
        return analytes;
    }

    public void setAnalytes(List<Analyte> analytes) {
        this.analytes = analytes;
    }

    public Texts getTexts() {
        return texts;
    }

    public Map<String, String> getFeedback() {
        return feedback;
    }

    public void setFeedback(Map<String, String> feedback) {
        this.feedback = feedback;
    }

    public List<String> getReferences() {
        return references;
    }

    public void setReferences(List<String> references) {
        this.references = references;
    }

    public static class Thresholds {

        private double qualityFloor = 0.15;
        private double typeDetection = 0.30;
        private double extractionMin = 0.50;
        private double normalizationMin = 0.30;
        private double overallAcceptMin = 0.50;

        public double getQualityFloor() {
            return qualityFloor;
        }

        public void setQualityFloor(double qualityFloor) {
            this.qualityFloor = qualityFloor;
        }

        public double getTypeDetection() {
            return typeDetection;
        }

        public void setTypeDetection(double typeDetection) {
            this.typeDetection = typeDetection;
        }

        public double getExtractionMin() {
            return extractionMin;
        }

        public void setExtractionMin(double extractionMin) {
            this.extractionMin = extractionMin;
        }

        public double getNormalizationMin() {
            return normalizationMin;
        }

        public void setNormalizationMin(double normalizationMin) {
            this.normalizationMin = normalizationMin;
        }

        public double getOverallAcceptMin() {
            return overallAcceptMin;
        }

        public void setOverallAcceptMin(double overallAcceptMin) {
            this.overallAcceptMin = overallAcceptMin;
        }
    }

    public static class Persistence {

        private boolean enabled;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Heuristic {

        private String label;
        private List<String> patterns = new ArrayList<>();
        private double weight = ReportTypeHeuristic.DEFAULT_WEIGHT;
        private List<String> exclusions = new ArrayList<>();

        ReportTypeHeuristic toHeuristic() {
            ReportType reportType = ReportType.fromLabel(label)
                .orElseThrow(() -> new IllegalArgumentException("Unknown report type label '" + label + "'"));
            return new ReportTypeHeuristic(reportType, patterns, weight, exclusions);
        }

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public List<String> getPatterns() {
            return patterns;
        }

        public void setPatterns(List<String> patterns) {
            this.patterns = patterns;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }

        public List<String> getExclusions() {
            return exclusions;
        }

        public void setExclusions(List<String> exclusions) {
            this.exclusions = exclusions;
        }
    }

    public static class Conversion {

        private String analyte;
        private String fromUnit;
        private String toUnit;
        private double factor;

        UnitConversion toConversion() {
            return new UnitConversion(analyte, fromUnit, toUnit, factor);
        }

        public String getAnalyte() {
            return analyte;
        }

        public void setAnalyte(String analyte) {
            this.analyte = analyte;
        }

        public String getFromUnit() {
            return fromUnit;
        }

        public void setFromUnit(String fromUnit) {
            this.fromUnit = fromUnit;
        }

        public String getToUnit() {
            return toUnit;
        }

        public void setToUnit(String toUnit) {
            this.toUnit = toUnit;
        }

        public double getFactor() {
            return factor;
        }

        public void setFactor(double factor) {
            this.factor = factor;
        }
    }

    public static class Analyte {

        private String name;
        private List<String> searchTerms = new ArrayList<>();
        private List<String> excludeTerms = new ArrayList<>();
        private String canonicalUnit;
        private Map<String, Double> unitFactors = new LinkedHashMap<>();
        private Set<String> suppressedBy = new LinkedHashSet<>();
        private List<Band> bands = new ArrayList<>();

        AnalyteRule toRule() {
            return new AnalyteRule(name, searchTerms, excludeTerms, canonicalUnit, unitFactors, suppressedBy,
                bands.stream().map(Band::toBand).toList());
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getSearchTerms() {
            return searchTerms;
        }

        public void setSearchTerms(List<String> searchTerms) {
            this.searchTerms = searchTerms;
        }

        public List<String> getExcludeTerms() {
            return excludeTerms;
        }

        public void setExcludeTerms(List<String> excludeTerms) {
            this.excludeTerms = excludeTerms;
        }

        public String getCanonicalUnit() {
            return canonicalUnit;
        }

        public void setCanonicalUnit(String canonicalUnit) {
            this.canonicalUnit = canonicalUnit;
        }

        public Map<String, Double> getUnitFactors() {
            return unitFactors;
        }

        public void setUnitFactors(Map<String, Double> unitFactors) {
            this.unitFactors = unitFactors;
        }

        public Set<String> getSuppressedBy() {
            return suppressedBy;
        }

        public void setSuppressedBy(Set<String> suppressedBy) {
            this.suppressedBy = suppressedBy;
        }

        public List<Band> getBands() {
            return bands;
        }

        public void setBands(List<Band> bands) {
            this.bands = bands;
        }
    }

    public static class Band {

        private String category;
        private Double min;
        private Double max;
        private String insight;
        private String action;

        DecisionBand toBand() {
            return new DecisionBand(InterpretationCategory.fromLabel(category), min, max, insight, action);
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public Double getMin() {
            return min;
        }

        public void setMin(Double min) {
            this.min = min;
        }

        public Double getMax() {
            return max;
        }

        public void setMax(Double max) {
            this.max = max;
        }

        public String getInsight() {
            return insight;
        }

        public void setInsight(String insight) {
            this.insight = insight;
        }

        public String getAction() {
            return action;
        }

        public void setAction(String action) {
            this.action = action;
        }
    }

    public static class Texts {

        private String genericInsight = InterpreterTexts.DEFAULT.genericInsight();
        private String limitedPanelCaveat = InterpreterTexts.DEFAULT.limitedPanelCaveat();
        private String defaultAction = InterpreterTexts.DEFAULT.defaultAction();
        private int limitedPanelSize = InterpreterTexts.DEFAULT.limitedPanelSize();

        InterpreterTexts toTexts() {
            return new InterpreterTexts(genericInsight, limitedPanelCaveat, defaultAction, limitedPanelSize);
        }

        public String getGenericInsight() {
            return genericInsight;
        }

        public void setGenericInsight(String genericInsight) {
            this.genericInsight = genericInsight;
        }

        public String getLimitedPanelCaveat() {
            return limitedPanelCaveat;
        }

        public void setLimitedPanelCaveat(String limitedPanelCaveat) {
            this.limitedPanelCaveat = limitedPanelCaveat;
        }

        public String getDefaultAction() {
            return defaultAction;
        }

        public void setDefaultAction(String defaultAction) {
            this.defaultAction = defaultAction;
        }

        public int getLimitedPanelSize() {
            return limitedPanelSize;
        }

        public void setLimitedPanelSize(int limitedPanelSize) {
            this.limitedPanelSize = limitedPanelSize;
        }
    }
}
