package buaa.detect.service;

import buaa.detect.dto.SampleSummary;
import buaa.detect.dto.SignificanceTest;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.inference.TTest;
import org.springframework.stereotype.Component;

/**
 * 指标样本的置信区间与两模型显著性检验
 */
@Component
public class StatisticalAnalyzer {

    private final TTest tTest = new TTest();

    /**
     * 均值、标准误 s/sqrt(n) 及基于 Student-t（n-1 自由度）的 (1-alpha) 置信区间
     */
    public SampleSummary summarize(double[] samples, double alpha) {
        requireAlpha(alpha);
        int n = samples.length;
        SampleSummary summary = new SampleSummary();
        summary.setSampleSize(n);
        summary.setConfidenceLevel(1 - alpha);
        if (n == 0) {
            return summary;
        }

        double mean = StatUtils.mean(samples);
        summary.setMean(mean);
        if (n < 2) {
            return summary;
        }

        double std = Math.sqrt(StatUtils.variance(samples));
        double standardError = std / Math.sqrt(n);
        double critical = new TDistribution(n - 1).inverseCumulativeProbability(1 - alpha / 2);
        summary.setStandardDeviation(std);
        summary.setStandardError(standardError);
        summary.setCiLower(mean - critical * standardError);
        summary.setCiUpper(mean + critical * standardError);
        return summary;
    }

    /**
     * 两独立样本 t 检验（等方差假设，自由度 n1+n2-2）
     * 任一样本数小于2时检验无定义，t 与 p 为空且不显著
     */
    public SignificanceTest compare(double[] first, double[] second, double alpha) {
        requireAlpha(alpha);
        SignificanceTest result = new SignificanceTest();
        result.setAlpha(alpha);
        if (first.length < 2 || second.length < 2) {
            return result;
        }

        double mean1 = StatUtils.mean(first);
        double mean2 = StatUtils.mean(second);
        double var1 = StatUtils.variance(first);
        double var2 = StatUtils.variance(second);
        double diff = Math.abs(mean1 - mean2);
        result.setDegreesOfFreedom(first.length + second.length - 2);

        double spread = Math.sqrt((var1 + var2) / 2);
        if (spread > 0) {
            result.setEffectSize(diff / spread);
        } else if (diff == 0) {
            result.setEffectSize(0.0);
        }

        if (var1 == 0 && var2 == 0) {
            // 零方差时 t 无穷大（均值不同）或为0（均值相同）
            result.setTestStatistic(diff == 0 ? 0.0 : Math.copySign(Double.MAX_VALUE, mean1 - mean2));
            result.setTwoSidedPValue(diff == 0 ? 1.0 : 0.0);
        } else {
            result.setTestStatistic(tTest.homoscedasticT(first, second));
            result.setTwoSidedPValue(tTest.homoscedasticTTest(first, second));
        }
        result.setSignificant(result.getTwoSidedPValue() < alpha);
        return result;
    }

    private void requireAlpha(double alpha) {
        if (!(alpha > 0 && alpha < 1)) {
            throw new IllegalArgumentException("显著性水平必须在(0,1)之间: " + alpha);
        }
    }
}
