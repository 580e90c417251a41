package com.salesanomaly.service;

import com.salesanomaly.client.OpenMeteoWeatherClient;
import com.salesanomaly.client.OpenMeteoWeatherClient.HourlyWeather;
import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.ExternalFactorSnapshot;
import com.salesanomaly.dto.HolidayInfo;
import com.salesanomaly.dto.RestaurantLocation;
import com.salesanomaly.dto.WeatherObservation;
import com.salesanomaly.entity.Restaurant;
import com.salesanomaly.exception.PipelineCancelledException;
import com.salesanomaly.exception.RestaurantNotFoundException;
import com.salesanomaly.exception.WeatherProviderUnavailableException;
import com.salesanomaly.repository.RestaurantRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExternalFactorEnrichmentServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 5, 18);
    private static final RestaurantLocation HEALTHY_FIT = new RestaurantLocation(-8.6705, 115.2126, "Urban");

    @Mock RestaurantRepository restaurantRepository;
    @Mock RestaurantLocationService locationService;
    @Mock HolidayCalendarService holidayCalendar;
    @Mock WeatherCacheService weatherCache;
    @Mock OpenMeteoWeatherClient weatherClient;

    private final AnalysisConfig config = new AnalysisConfig();
    private final Restaurant restaurant = Restaurant.builder().id(1L).name("Healthy Fit").build();
    private AnalysisWorkerPool pool;
    private ExternalFactorEnrichmentService service;

    @BeforeEach
    void setUp() {
        config.setWorkerThreads(2);
        pool = new AnalysisWorkerPool(config);
        pool.init();
        service = new ExternalFactorEnrichmentService(restaurantRepository, locationService, holidayCalendar,
            weatherCache, weatherClient, pool, config);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    void enrich_cacheHit_makesNoProviderCall() {
        when(restaurantRepository.findById(1L)).thenReturn(Optional.of(restaurant));
        when(locationService.resolve("Healthy Fit")).thenReturn(Optional.of(HEALTHY_FIT));
        when(weatherCache.get(-8.6705, 115.2126, DAY)).thenReturn(Optional.of(new WeatherObservation(26.0, 14.0, 9.0)));
        when(holidayCalendar.lookup(DAY)).thenReturn(Optional.empty());

        ExternalFactorSnapshot s = service.enrich(1L, DAY);

        assertThat(s.getPrecipitation()).isEqualTo(14.0);
        assertThat(s.getZone()).isEqualTo("Urban");
        assertThat(s.isWeatherEstimated()).isFalse();
        assertThat(s.isLocationEstimated()).isFalse();
        verifyNoInteractions(weatherClient);
        verify(weatherCache, never()).put(anyDouble(), anyDouble(), any(), any());
    }

    @Test
    void enrich_cacheMiss_reducesHourlyAndCaches() {
        when(restaurantRepository.findById(1L)).thenReturn(Optional.of(restaurant));
        when(locationService.resolve("Healthy Fit")).thenReturn(Optional.of(HEALTHY_FIT));
        when(weatherCache.get(anyDouble(), anyDouble(), any())).thenReturn(Optional.empty());
        when(weatherClient.fetchHourly(-8.6705, 115.2126, DAY)).thenReturn(Mono.just(new HourlyWeather(
            List.of(26.0, 28.0, 30.0), List.of(0.5, 2.0, 3.5), List.of(4.0, 12.0, 7.0))));
        when(holidayCalendar.lookup(DAY)).thenReturn(Optional.empty());

        ExternalFactorSnapshot s = service.enrich(1L, DAY);

        assertThat(s.getTemperature()).isEqualTo(28.0);
        assertThat(s.getPrecipitation()).isEqualTo(6.0);
        assertThat(s.getWindSpeed()).isEqualTo(12.0);
        verify(weatherCache).put(-8.6705, 115.2126, DAY, new WeatherObservation(28.0, 6.0, 12.0));
        verify(weatherCache).flush();
    }

    @Test
    void enrich_providerTimeout_returnsNeutralWeatherWithoutCaching() {
        when(restaurantRepository.findById(1L)).thenReturn(Optional.of(restaurant));
        when(locationService.resolve("Healthy Fit")).thenReturn(Optional.of(HEALTHY_FIT));
        when(weatherCache.get(anyDouble(), anyDouble(), any())).thenReturn(Optional.empty());
        when(weatherClient.fetchHourly(anyDouble(), anyDouble(), eq(DAY)))
            .thenReturn(Mono.error(new WeatherProviderUnavailableException("timed out")));
        when(holidayCalendar.lookup(DAY)).thenReturn(Optional.empty());

        ExternalFactorSnapshot s = service.enrich(1L, DAY);

        assertThat(s.getPrecipitation()).isZero();
        assertThat(s.getTemperature()).isEqualTo(28.0);
        assertThat(s.getWindSpeed()).isZero();
        assertThat(s.isWeatherEstimated()).isTrue();
        verify(weatherCache, never()).put(anyDouble(), anyDouble(), any(), any());
    }

    @Test
    void enrich_emptyHourlyPayload_isTreatedAsUnavailable() {
        when(restaurantRepository.findById(1L)).thenReturn(Optional.of(restaurant));
        when(locationService.resolve("Healthy Fit")).thenReturn(Optional.of(HEALTHY_FIT));
        when(weatherCache.get(anyDouble(), anyDouble(), any())).thenReturn(Optional.empty());
        when(weatherClient.fetchHourly(anyDouble(), anyDouble(), any()))
            .thenReturn(Mono.just(new HourlyWeather(List.of(), List.of(), List.of())));
        when(holidayCalendar.lookup(DAY)).thenReturn(Optional.empty());

        assertThat(service.enrich(1L, DAY).isWeatherEstimated()).isTrue();
    }

    @Test
    void enrich_missingPrecipitationSeries_usesNeutralWeatherWithoutCaching() {
        when(restaurantRepository.findById(1L)).thenReturn(Optional.of(restaurant));
        when(locationService.resolve("Healthy Fit")).thenReturn(Optional.of(HEALTHY_FIT));
        when(weatherCache.get(anyDouble(), anyDouble(), any())).thenReturn(Optional.empty());
        when(weatherClient.fetchHourly(anyDouble(), anyDouble(), any())).thenReturn(Mono.just(new HourlyWeather(
            List.of(26.0, 28.0, 30.0), List.of(), List.of(4.0, 12.0, 7.0))));
        when(holidayCalendar.lookup(DAY)).thenReturn(Optional.empty());

        ExternalFactorSnapshot s = service.enrich(1L, DAY);

        assertThat(s.isWeatherEstimated()).isTrue();
        assertThat(s.getTemperature()).isEqualTo(28.0);
        assertThat(s.getWindSpeed()).isZero();
        verify(weatherCache, never()).put(anyDouble(), anyDouble(), any(), any());
    }

    @Test
    void enrich_gappedPrecipitation_usesNeutralWeatherWithoutCaching() {
        when(restaurantRepository.findById(1L)).thenReturn(Optional.of(restaurant));
        when(locationService.resolve("Healthy Fit")).thenReturn(Optional.of(HEALTHY_FIT));
        when(weatherCache.get(anyDouble(), anyDouble(), any())).thenReturn(Optional.empty());
        when(weatherClient.fetchHourly(anyDouble(), anyDouble(), any())).thenReturn(Mono.just(new HourlyWeather(
            List.of(26.0, 28.0, 30.0), List.of(3.0), List.of(4.0, 12.0, 7.0), 2)));
        when(holidayCalendar.lookup(DAY)).thenReturn(Optional.empty());

        ExternalFactorSnapshot s = service.enrich(1L, DAY);

        assertThat(s.isWeatherEstimated()).isTrue();
        assertThat(s.getPrecipitation()).isZero();
        verify(weatherCache, never()).put(anyDouble(), anyDouble(), any(), any());
    }

    @Test
    void enrich_unknownLocation_usesDefaultRegion() {
        when(restaurantRepository.findById(1L)).thenReturn(Optional.of(restaurant));
        when(locationService.resolve("Healthy Fit")).thenReturn(Optional.empty());
        when(weatherCache.get(-8.4095, 115.1889, DAY)).thenReturn(Optional.of(new WeatherObservation(25.0, 0.0, 1.0)));
        when(holidayCalendar.lookup(DAY)).thenReturn(Optional.empty());

        ExternalFactorSnapshot s = service.enrich(1L, DAY);

        assertThat(s.isLocationEstimated()).isTrue();
        assertThat(s.getZone()).isEqualTo("Central");
        assertThat(s.getLatitude()).isEqualTo(-8.4095);
    }

    @Test
    void enrich_holiday_carriesCategoryWeight() {
        when(restaurantRepository.findById(1L)).thenReturn(Optional.of(restaurant));
        when(locationService.resolve("Healthy Fit")).thenReturn(Optional.of(HEALTHY_FIT));
        when(weatherCache.get(anyDouble(), anyDouble(), any())).thenReturn(Optional.of(new WeatherObservation(28.0, 0.0, 2.0)));
        when(holidayCalendar.lookup(DAY)).thenReturn(Optional.of(new HolidayInfo("Nyepi", "Balinese", "public")));

        ExternalFactorSnapshot s = service.enrich(1L, DAY);

        assertThat(s.isHoliday()).isTrue();
        assertThat(s.getHolidayName()).isEqualTo("Nyepi");
        assertThat(s.getHolidayImpactWeight()).isEqualTo(-0.26);
    }

    @Test
    void enrich_unknownRestaurant_throws() {
        when(restaurantRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.enrich(5L, DAY)).isInstanceOf(RestaurantNotFoundException.class);
    }

    @Test
    void enrichBatch_returnsSnapshotPerDateAndFlushes() {
        when(locationService.resolve("Healthy Fit")).thenReturn(Optional.of(HEALTHY_FIT));
        when(weatherCache.get(anyDouble(), anyDouble(), any())).thenReturn(Optional.of(new WeatherObservation(28.0, 1.0, 2.0)));
        when(holidayCalendar.lookup(any())).thenReturn(Optional.empty());

        Map<LocalDate, ExternalFactorSnapshot> out = service.enrichBatch(restaurant,
            List.of(DAY, DAY.plusDays(1), DAY.plusDays(2)), () -> false);

        assertThat(out).containsOnlyKeys(DAY, DAY.plusDays(1), DAY.plusDays(2));
        verify(weatherCache).flush();
    }

    @Test
    void enrichBatch_cancelled_flushesThenThrows() {
        lenient().when(locationService.resolve("Healthy Fit")).thenReturn(Optional.of(HEALTHY_FIT));
        lenient().when(weatherCache.get(anyDouble(), anyDouble(), any())).thenReturn(Optional.of(new WeatherObservation(28.0, 1.0, 2.0)));
        lenient().when(holidayCalendar.lookup(any())).thenReturn(Optional.empty());
        AtomicInteger checks = new AtomicInteger();

        assertThatThrownBy(() -> service.enrichBatch(restaurant,
                List.of(DAY, DAY.plusDays(1), DAY.plusDays(2), DAY.plusDays(3)),
                () -> checks.incrementAndGet() > 1))
            .isInstanceOf(PipelineCancelledException.class)
            .hasMessageContaining("cancelled");
        verify(weatherCache).flush();
    }

    @Test
    void toDaily_meanSumMax() {
        WeatherObservation daily = service.toDaily(new HourlyWeather(
            List.of(24.0, 26.0), List.of(1.25, 0.75, 2.0), List.of(3.0, 9.5)));

        assertThat(daily).isEqualTo(new WeatherObservation(25.0, 4.0, 9.5));
    }
}
