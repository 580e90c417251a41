package com.salesanomaly.service;

import com.salesanomaly.dto.DailyMetricRecord;
import com.salesanomaly.dto.OperationalFlags;
import com.salesanomaly.entity.GojekDailyStat;
import com.salesanomaly.entity.GrabDailyStat;
import com.salesanomaly.entity.Platform;
import com.salesanomaly.entity.PlatformDailyStat;
import com.salesanomaly.entity.Restaurant;
import com.salesanomaly.exception.RestaurantNotFoundException;
import com.salesanomaly.repository.GojekDailyStatRepository;
import com.salesanomaly.repository.GrabDailyStatRepository;
import com.salesanomaly.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Merges the per-platform daily rows of one restaurant into one {@link DailyMetricRecord} per date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricAggregatorService {

    private final RestaurantRepository restaurantRepository;
    private final GrabDailyStatRepository grabRepository;
    private final GojekDailyStatRepository gojekRepository;

    @Transactional(readOnly = true)
    public List<DailyMetricRecord> aggregate(Long restaurantId, LocalDate from, LocalDate to) {
        Restaurant restaurant = restaurantRepository.findById(restaurantId)
            .orElseThrow(() -> new RestaurantNotFoundException(restaurantId));
        return aggregate(restaurant, from, to);
    }

    @Transactional(readOnly = true)
    public List<DailyMetricRecord> aggregate(Restaurant restaurant, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        }
        Map<LocalDate, GrabDailyStat> grab = grabRepository.findForRestaurant(restaurant.getId(), from, to).stream()
            .collect(Collectors.toMap(GrabDailyStat::getStatDate, Function.identity(), (a, b) -> b));
        Map<LocalDate, GojekDailyStat> gojek = gojekRepository.findForRestaurant(restaurant.getId(), from, to).stream()
            .collect(Collectors.toMap(GojekDailyStat::getStatDate, Function.identity(), (a, b) -> b));

        TreeSet<LocalDate> dates = new TreeSet<>(grab.keySet());
        dates.addAll(gojek.keySet());

        List<DailyMetricRecord> records = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            records.add(merge(restaurant, date, grab.get(date), gojek.get(date)));
        }
        log.debug("Aggregated | restaurant={} | from={} | to={} | grabRows={} | gojekRows={} | records={}",
            restaurant.getName(), from, to, grab.size(), gojek.size(), records.size());
        return records;
    }

    /**
     * Combines the two platform rows of one day. Either row may be null, not both; a missing
     * platform contributes zero to every sum.
     */
    public DailyMetricRecord merge(Restaurant restaurant, LocalDate date, GrabDailyStat grab, GojekDailyStat gojek) {
        if (grab == null && gojek == null) {
            throw new IllegalArgumentException("No platform data for " + date);
        }
        List<PlatformDailyStat> rows = new ArrayList<>(2);
        if (grab != null) {
            rows.add(grab);
        }
        if (gojek != null) {
            rows.add(gojek);
        }

        Map<Platform, Double> sales = new EnumMap<>(Platform.class);
        Map<Platform, Integer> orders = new EnumMap<>(Platform.class);
        for (Platform p : Platform.values()) {
            sales.put(p, 0.0);
            orders.put(p, 0);
        }
        Set<Platform> reporting = EnumSet.noneOf(Platform.class);
        OperationalFlags flags = OperationalFlags.NONE;
        double totalSales = 0.0;
        int totalOrders = 0;
        int cancelled = 0;
        double spend = 0.0;
        double attributed = 0.0;
        double ratingSum = 0.0;
        int ratingCount = 0;

        for (PlatformDailyStat row : rows) {
            Platform platform = row.platform();
            reporting.add(platform);
            sales.put(platform, row.getSales());
            orders.put(platform, row.getOrders());
            totalSales += row.getSales();
            totalOrders += row.getOrders();
            cancelled += row.getCancelledOrders();
            spend += row.getAdsSpend();
            attributed += row.getAdsSales();
            if (row.getRating() != null && row.getRating() > 0) {
                ratingSum += row.getRating();
                ratingCount++;
            }
            flags = flags.or(new OperationalFlags(row.isStoreIsClosed(), row.isOutOfStock(), row.isStoreIsBusy()));
        }

        int attempted = totalOrders + cancelled;
        return DailyMetricRecord.builder()
            .restaurantId(restaurant.getId())
            .restaurantName(restaurant.getName())
            .date(date)
            .salesByPlatform(Collections.unmodifiableMap(sales))
            .ordersByPlatform(Collections.unmodifiableMap(orders))
            .reportingPlatforms(Collections.unmodifiableSet(reporting))
            .rating(ratingCount > 0 ? ratingSum / ratingCount : null)
            .cancelledOrders(cancelled)
            .operationalFlags(flags)
            .marketingSpend(spend)
            .marketingAttributedSales(attributed)
            .prepTime(gojek != null ? gojek.getPreparationTime() : null)
            .deliveryTime(gojek != null ? gojek.getDeliveryTime() : null)
            .totalSales(totalSales)
            .totalOrders(totalOrders)
            .averageOrderValue(totalOrders > 0 ? totalSales / totalOrders : null)
            .cancellationRate(attempted > 0 ? (double) cancelled / attempted : null)
            .roas(spend > 0 ? attributed / spend : null)
            .build();
    }
}
