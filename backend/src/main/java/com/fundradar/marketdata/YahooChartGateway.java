package com.fundradar.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fundradar.common.DateWindow;
import com.fundradar.domain.PriceBar;
import com.fundradar.marketdata.config.MarketDataProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily bars from the Yahoo Finance v8 chart API ({@code /chart/{symbol}?period1&period2&interval=1d&events=div,split}).
 * Requests pass through a shared resilience4j rate limiter.
 */
@Slf4j
public class YahooChartGateway implements MarketDataGateway {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final MarketDataProperties properties;

    public YahooChartGateway(WebClient.Builder builder, RateLimiter rateLimiter, MarketDataProperties properties) {
        this.webClient = builder
                .baseUrl(properties.getYahooBaseUrl())
                .defaultHeader("User-Agent", properties.getUserAgent())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    @Override
    public List<PriceBar> fetchDailyBars(String symbol, DateWindow window) {
        if (!rateLimiter.acquirePermission()) {
            throw new MarketDataException("Local rate limiter timeout before chart request for " + symbol, true);
        }
        long period1 = window.start().atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        long period2 = window.end().plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        String body;
        try {
            body = webClient.get()
                    .uri(b -> b.path("/{symbol}")
                            .queryParam("period1", period1)
                            .queryParam("period2", period2)
                            .queryParam("interval", "1d")
                            .queryParam("events", "div,split")
                            .build(symbol))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(properties.getReadTimeoutSeconds()));
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 404) {
                // Yahoo answers 404 both for unknown symbols and for ranges with no data
                log.debug("Chart 404 for {} {}: {}", symbol, window, e.getMessage());
                return List.of();
            }
            boolean retryable = status == 429 || status >= 500;
            throw new MarketDataException("Chart request failed for " + symbol + " " + window + ": HTTP " + status, retryable, e);
        } catch (WebClientRequestException e) {
            throw new MarketDataException("Chart request failed for " + symbol + " " + window + ": " + e.getMessage(), true, e);
        } catch (IllegalStateException e) {
            // block() timeout
            throw new MarketDataException("Chart request timed out for " + symbol + " " + window, true, e);
        }
        return parseChart(symbol, body, window);
    }

    /**
     * Parses a chart response into bars within {@code window}. Rows without a close are skipped.
     * Dates use the exchange time zone from {@code meta.exchangeTimezoneName}, UTC when absent.
     */
    static List<PriceBar> parseChart(String symbol, String json, DateWindow window) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MarketDataException("Malformed chart response for " + symbol, true, e);
        }
        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            log.debug("Chart error for {}: {}", symbol, error.path("description").asText());
            return List.of();
        }
        JsonNode result = chart.path("result");
        if (!result.isArray() || result.isEmpty()) {
            return List.of();
        }
        JsonNode first = result.get(0);
        JsonNode timestamps = first.path("timestamp");
        if (!timestamps.isArray() || timestamps.isEmpty()) {
            return List.of();
        }
        ZoneId zone = zoneOf(first.path("meta").path("exchangeTimezoneName").asText(null));
        JsonNode quote = first.path("indicators").path("quote").path(0);
        JsonNode adjClose = first.path("indicators").path("adjclose").path(0).path("adjclose");
        Map<LocalDate, BigDecimal> dividends = dividends(first.path("events").path("dividends"), zone);
        Map<LocalDate, BigDecimal> splits = splits(first.path("events").path("splits"), zone);

        Map<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (int i = 0; i < timestamps.size(); i++) {
            LocalDate date = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(zone).toLocalDate();
            BigDecimal close = decimal(quote.path("close").path(i));
            if (close == null || !window.contains(date)) {
                continue;
            }
            PriceBar bar = new PriceBar();
            bar.setSymbol(symbol);
            bar.setDate(date);
            bar.setOpen(decimal(quote.path("open").path(i)));
            bar.setHigh(decimal(quote.path("high").path(i)));
            bar.setLow(decimal(quote.path("low").path(i)));
            bar.setClose(close);
            BigDecimal adj = decimal(adjClose.path(i));
            bar.setAdjClose(adj != null ? adj : close);
            JsonNode volume = quote.path("volume").path(i);
            bar.setVolume(volume.isNumber() ? volume.asLong() : null);
            bar.setDividend(dividends.getOrDefault(date, BigDecimal.ZERO));
            bar.setSplit(splits.getOrDefault(date, BigDecimal.ZERO));
            bar.ensureId();
            byDate.put(date, bar);
        }
        return new ArrayList<>(byDate.values());
    }

    private static Map<LocalDate, BigDecimal> dividends(JsonNode node, ZoneId zone) {
        Map<LocalDate, BigDecimal> out = new TreeMap<>();
        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            JsonNode d = it.next();
            BigDecimal amount = decimal(d.path("amount"));
            if (amount != null) {
                out.put(Instant.ofEpochSecond(d.path("date").asLong()).atZone(zone).toLocalDate(), amount);
            }
        }
        return out;
    }

    private static Map<LocalDate, BigDecimal> splits(JsonNode node, ZoneId zone) {
        Map<LocalDate, BigDecimal> out = new TreeMap<>();
        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            JsonNode s = it.next();
            double numerator = s.path("numerator").asDouble(0);
            double denominator = s.path("denominator").asDouble(0);
            if (numerator > 0 && denominator > 0) {
                out.put(Instant.ofEpochSecond(s.path("date").asLong()).atZone(zone).toLocalDate(),
                        BigDecimal.valueOf(numerator / denominator));
            }
        }
        return out;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        return node.decimalValue();
    }

    private static ZoneId zoneOf(String name) {
        if (name == null || name.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(name);
        } catch (DateTimeException e) {
            log.debug("Unknown exchange time zone {}, using UTC", name);
            return ZoneOffset.UTC;
        }
    }
}
