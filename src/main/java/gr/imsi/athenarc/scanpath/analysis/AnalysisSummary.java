package gr.imsi.athenarc.scanpath.analysis;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Aggregate figures over a batch of analysed scanpaths: how many showed complete
 * verification and how deep the examination went, overall and per outcome.
 */
public class AnalysisSummary {

    private final int total;
    private final int complete;
    private final int incomplete;
    private final double acceptanceRate;
    private final double meanMaxStackDepth;
    private final double maxMaxStackDepth;
    private final double p95MaxStackDepth;
    private final double meanVerificationCompletenessScore;
    private final Map<VerificationOutcome, Double> meanDepthByOutcome;

    private AnalysisSummary(int total, int complete, int incomplete, double acceptanceRate,
                            double meanMaxStackDepth, double maxMaxStackDepth, double p95MaxStackDepth,
                            double meanVerificationCompletenessScore,
                            Map<VerificationOutcome, Double> meanDepthByOutcome) {
        this.total = total;
        this.complete = complete;
        this.incomplete = incomplete;
        this.acceptanceRate = acceptanceRate;
        this.meanMaxStackDepth = meanMaxStackDepth;
        this.maxMaxStackDepth = maxMaxStackDepth;
        this.p95MaxStackDepth = p95MaxStackDepth;
        this.meanVerificationCompletenessScore = meanVerificationCompletenessScore;
        this.meanDepthByOutcome = meanDepthByOutcome;
    }

    public static AnalysisSummary of(List<ScanpathAnalysis> analyses) {
        DescriptiveStatistics depth = new DescriptiveStatistics();
        DescriptiveStatistics vcs = new DescriptiveStatistics();
        Map<VerificationOutcome, DescriptiveStatistics> depthByOutcome = new EnumMap<>(VerificationOutcome.class);
        for (VerificationOutcome outcome : VerificationOutcome.values()) {
            depthByOutcome.put(outcome, new DescriptiveStatistics());
        }

        int complete = 0;
        for (ScanpathAnalysis analysis : analyses) {
            depth.addValue(analysis.getMaxStackDepth());
            vcs.addValue(analysis.getVerificationCompletenessScore());
            depthByOutcome.get(analysis.getOutcome()).addValue(analysis.getMaxStackDepth());
            if (analysis.isAccepted()) {
                complete++;
            }
        }

        int total = analyses.size();
        Map<VerificationOutcome, Double> meanDepth = new EnumMap<>(VerificationOutcome.class);
        for (Map.Entry<VerificationOutcome, DescriptiveStatistics> entry : depthByOutcome.entrySet()) {
            meanDepth.put(entry.getKey(), orZero(entry.getValue().getMean()));
        }
        return new AnalysisSummary(
            total,
            complete,
            total - complete,
            total == 0 ? 0.0 : (double) complete / total,
            orZero(depth.getMean()),
            orZero(depth.getMax()),
            orZero(depth.getPercentile(95)),
            orZero(vcs.getMean()),
            meanDepth);
    }

    // DescriptiveStatistics reports NaN for an empty sample
    private static double orZero(double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }

    public int getTotal() {
        return total;
    }

    public int getComplete() {
        return complete;
    }

    public int getIncomplete() {
        return incomplete;
    }

    public double getAcceptanceRate() {
        return acceptanceRate;
    }

    public double getMeanMaxStackDepth() {
        return meanMaxStackDepth;
    }

    public double getMaxMaxStackDepth() {
        return maxMaxStackDepth;
    }

    public double getP95MaxStackDepth() {
        return p95MaxStackDepth;
    }

    public double getMeanVerificationCompletenessScore() {
        return meanVerificationCompletenessScore;
    }

    public Map<VerificationOutcome, Double> getMeanDepthByOutcome() {
        return meanDepthByOutcome;
    }

    @Override
    public String toString() {
        return String.format("%d scanpaths, %d complete (%.1f%%), depth mean=%.2f p95=%.1f max=%.0f, mean VCS=%.2f",
            total, complete, acceptanceRate * 100, meanMaxStackDepth, p95MaxStackDepth,
            maxMaxStackDepth, meanVerificationCompletenessScore);
    }
}
