package com.salesanomaly.service;

import com.salesanomaly.dto.DailyMetricRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Date-ordered sales of one restaurant. Every query only looks at observations strictly before
 * the date it is asked about.
 */
public final class SalesHistory {

    private final List<LocalDate> dates;
    private final double[] sales;

    private SalesHistory(List<LocalDate> dates, double[] sales) {
        this.dates = dates;
        this.sales = sales;
    }

    public static SalesHistory of(List<DailyMetricRecord> records) {
        List<DailyMetricRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(DailyMetricRecord::getDate));
        List<LocalDate> dates = new ArrayList<>(sorted.size());
        double[] sales = new double[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            dates.add(sorted.get(i).getDate());
            sales[i] = sorted.get(i).getTotalSales();
        }
        return new SalesHistory(List.copyOf(dates), sales);
    }

    public int countBefore(LocalDate date) {
        int idx = Collections.binarySearch(dates, date);
        return idx >= 0 ? idx : -idx - 1;
    }

    /** Mean of the last {@code n} observations before {@code date}, or of all of them when fewer exist. */
    public double meanOfLast(LocalDate date, int n) {
        int end = countBefore(date);
        int start = Math.max(0, end - n);
        if (end == start) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = start; i < end; i++) {
            sum += sales[i];
        }
        return sum / (end - start);
    }

    public int size() {
        return sales.length;
    }
}
