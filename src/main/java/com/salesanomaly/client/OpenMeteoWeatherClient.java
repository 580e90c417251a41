package com.salesanomaly.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.salesanomaly.exception.WeatherProviderUnavailableException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Component
@RequiredArgsConstructor
public class OpenMeteoWeatherClient {

    @Value("${weather.api.base-url}")
    private String baseUrl;

    @Value("${weather.api.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${weather.api.timezone:Asia/Jakarta}")
    private String timezone;

    @Value("${weather.api.retry.max-retries:2}")
    private int maxRetries;

    @Value("${weather.api.retry.backoff-millis:300}")
    private long backoffMillis;

    private final WeatherRequestLimiter rateLimiter;

    private WebClient webClient;

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Accept", "application/json")
            .build();
        log.info("OpenMeteoWeatherClient initialised → {}", baseUrl);
    }

    /**
     * Hourly observations for one local day. Every attempt, retries included, spends one
     * rate-limit permit; after the last retry the failure surfaces as
     * {@link WeatherProviderUnavailableException}.
     */
    public Mono<HourlyWeather> fetchHourly(double latitude, double longitude, LocalDate date) {
        String day = date.format(DateTimeFormatter.ISO_DATE);
        return Mono.defer(() -> {
                rateLimiter.acquire();
                return webClient.get()
                    .uri(uri -> uri.path("/v1/archive")
                        .queryParam("latitude", latitude)
                        .queryParam("longitude", longitude)
                        .queryParam("start_date", day)
                        .queryParam("end_date", day)
                        .queryParam("hourly", "temperature_2m,precipitation,wind_speed_10m")
                        .queryParam("timezone", timezone)
                        .build())
                    .retrieve()
                    .onStatus(status -> status.value() == 429 || status.is5xxServerError(),
                        resp -> resp.createException())
                    .onStatus(HttpStatusCode::is4xxClientError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(b -> new WeatherProviderUnavailableException("Weather provider rejected request (4xx): " + b)))
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds));
            })
            .map(this::toHourlyWeather)
            .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(backoffMillis))
                .scheduler(Schedulers.boundedElastic())
                .filter(this::isRetryable)
                .doBeforeRetry(sig -> log.warn("Weather call retry | attempt={} | lat={} | lon={} | date={} | cause={}",
                    sig.totalRetries() + 2, latitude, longitude, day, sig.failure().toString()))
                .onRetryExhaustedThrow((spec, sig) -> new WeatherProviderUnavailableException(sig.failure())))
            .onErrorMap(ex -> !(ex instanceof WeatherProviderUnavailableException),
                WeatherProviderUnavailableException::new);
    }

    private boolean isRetryable(Throwable ex) {
        return ex instanceof WebClientRequestException
            || ex instanceof WebClientResponseException
            || ex instanceof TimeoutException;
    }

    private HourlyWeather toHourlyWeather(JsonNode json) {
        JsonNode hourly = json == null ? null : json.get("hourly");
        if (hourly == null || hourly.isNull()) {
            throw new WeatherProviderUnavailableException("Weather response missing 'hourly': " + json);
        }
        List<Double> precipitation = readSeries(hourly, "precipitation");
        JsonNode rawPrecipitation = hourly.get("precipitation");
        int precipitationGaps = rawPrecipitation != null && rawPrecipitation.isArray()
            ? rawPrecipitation.size() - precipitation.size()
            : 0;
        return new HourlyWeather(
            readSeries(hourly, "temperature_2m"),
            precipitation,
            readSeries(hourly, "wind_speed_10m"),
            precipitationGaps);
    }

    private List<Double> readSeries(JsonNode hourly, String key) {
        JsonNode node = hourly.get(key);
        List<Double> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode v : node) {
            if (v != null && !v.isNull()) {
                values.add(v.asDouble());
            }
        }
        return values;
    }

    /**
     * Non-null hourly values per series. {@code precipitationGaps} counts the null precipitation hours
     * that were dropped, since a daily total over a gapped series would under-count.
     */
    public record HourlyWeather(List<Double> temperature, List<Double> precipitation, List<Double> windSpeed,
                                int precipitationGaps) {

        public HourlyWeather(List<Double> temperature, List<Double> precipitation, List<Double> windSpeed) {
            this(temperature, precipitation, windSpeed, 0);
        }

        /** True when every series has values and no precipitation hour is missing. */
        public boolean isComplete() {
            return !temperature.isEmpty() && !precipitation.isEmpty() && !windSpeed.isEmpty()
                && precipitationGaps == 0;
        }
    }
}
