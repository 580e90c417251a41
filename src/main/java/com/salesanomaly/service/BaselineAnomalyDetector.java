package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.AnomalyRecord;
import com.salesanomaly.dto.DailyMetricRecord;
import com.salesanomaly.dto.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Classifies each day of one restaurant's series against the mean and population standard
 * deviation of the observations before it. Stateless: every call sees only the series it is given.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BaselineAnomalyDetector {

    private final AnalysisConfig config;

    public List<AnomalyRecord> classify(List<DailyMetricRecord> series) {
        List<DailyMetricRecord> sorted = new ArrayList<>(series);
        sorted.sort(Comparator.comparing(DailyMetricRecord::getDate));
        double[] full = sorted.stream().mapToDouble(DailyMetricRecord::getTotalSales).toArray();

        List<AnomalyRecord> out = new ArrayList<>(sorted.size());
        int window = config.getBaselineWindowDays();
        for (int i = 0; i < sorted.size(); i++) {
            int start = window > 0 ? Math.max(0, i - window) : 0;
            double[] prior = Arrays.copyOfRange(full, start, i);
            DailyMetricRecord day = sorted.get(i);
            out.add(classifyDay(day.getRestaurantId(), day.getDate(), full[i], prior, full));
        }
        if (log.isDebugEnabled()) {
            long flagged = out.stream().filter(a -> isFlagged(a.getSeverity())).count();
            log.debug("Series classified | days={} | flagged={}", out.size(), flagged);
        }
        return out;
    }

    public AnomalyRecord classifyDay(Long restaurantId, LocalDate date, double actual,
                                     double[] priorSales, double[] fullSeries) {
        AnomalyRecord.AnomalyRecordBuilder record = AnomalyRecord.builder()
            .restaurantId(restaurantId)
            .date(date)
            .actualSales(actual)
            .observations(priorSales.length);
        if (priorSales.length < config.getMinBaselineObservations()) {
            return record.severity(Severity.UNCLASSIFIED).build();
        }

        double mean = Arrays.stream(priorSales).average().orElse(0.0);
        double variance = 0.0;
        for (double v : priorSales) {
            variance += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(variance / priorSales.length);
        double deviation = mean > 0 ? (actual - mean) / mean * 100.0 : 0.0;

        Severity severity = Severity.NORMAL;
        if (std > 0 && mean > 0) {
            double sigmaPercent = std / mean * 100.0;
            if (deviation <= -config.getCriticalSigma() * sigmaPercent) {
                severity = Severity.CRITICAL;
            } else if (deviation <= -config.getBadSigma() * sigmaPercent) {
                severity = Severity.BAD;
            } else if (deviation <= -config.getWatchSigma() * sigmaPercent) {
                severity = Severity.WATCH;
            }
        }
        if (fullSeries.length > 0 && actual < percentile(fullSeries, config.getCriticalPercentile())) {
            severity = Severity.CRITICAL;
        }

        return record
            .baselineMean(mean)
            .baselineStd(std)
            .deviationPercent(deviation)
            .severity(severity)
            .build();
    }

    public boolean isFlagged(Severity severity) {
        return severity != null && severity.isAtLeast(config.getFlagMinSeverity());
    }

    /** Percentile with linear interpolation between closest ranks. */
    public static double percentile(double[] values, double percent) {
        if (values.length == 0) {
            throw new IllegalArgumentException("percentile of empty series");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percent / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }
}
