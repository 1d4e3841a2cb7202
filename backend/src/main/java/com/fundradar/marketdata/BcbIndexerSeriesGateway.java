package com.fundradar.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fundradar.common.DateWindow;
import com.fundradar.domain.Indexer;
import com.fundradar.domain.IndexerRate;
import com.fundradar.marketdata.config.MarketDataProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Banco Central do Brasil SGS series: IPCA (433, monthly %), SELIC (11, daily %), CDI (12, daily %).
 * SGS limits daily series to ten years per request, so longer windows are requested in slices.
 */
@Slf4j
public class BcbIndexerSeriesGateway implements IndexerSeriesGateway {

    static final Map<Indexer, Integer> SERIES_CODES = Map.of(
            Indexer.IPCA, 433,
            Indexer.SELIC, 11,
            Indexer.CDI, 12);

    private static final DateTimeFormatter SGS_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final int MAX_DAYS_PER_REQUEST = 3650;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final MarketDataProperties properties;

    public BcbIndexerSeriesGateway(WebClient.Builder builder, RateLimiter rateLimiter, MarketDataProperties properties) {
        this.webClient = builder
                .baseUrl(properties.getBcbBaseUrl())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    @Override
    public List<IndexerRate> fetchSeries(Indexer indexer, DateWindow window) {
        Integer code = SERIES_CODES.get(indexer);
        if (code == null) {
            return List.of();
        }
        List<IndexerRate> out = new ArrayList<>();
        for (DateWindow slice : window.split(MAX_DAYS_PER_REQUEST)) {
            out.addAll(parseSeries(indexer, request(indexer, code, slice)));
        }
        return out;
    }

    private String request(Indexer indexer, int code, DateWindow slice) {
        if (!rateLimiter.acquirePermission()) {
            throw new MarketDataException("Local rate limiter timeout before SGS request for " + indexer, true);
        }
        try {
            return webClient.get()
                    .uri(b -> b.path("/{code}/dados")
                            .queryParam("formato", "json")
                            .queryParam("dataInicial", slice.start().format(SGS_DATE))
                            .queryParam("dataFinal", slice.end().format(SGS_DATE))
                            .build(code))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(properties.getReadTimeoutSeconds()));
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 404) {
                log.debug("SGS 404 for {} {}", indexer, slice);
                return "[]";
            }
            throw new MarketDataException("SGS request failed for " + indexer + " " + slice + ": HTTP " + status,
                    status == 429 || status >= 500, e);
        } catch (WebClientRequestException e) {
            throw new MarketDataException("SGS request failed for " + indexer + " " + slice + ": " + e.getMessage(), true, e);
        } catch (IllegalStateException e) {
            throw new MarketDataException("SGS request timed out for " + indexer + " " + slice, true, e);
        }
    }

    /**
     * Parses {@code [{"data":"dd/MM/yyyy","valor":"0.42"}, ...]}. Unparseable entries are skipped.
     */
    static List<IndexerRate> parseSeries(Indexer indexer, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MarketDataException("Malformed SGS response for " + indexer, true, e);
        }
        if (!root.isArray()) {
            return List.of();
        }
        List<IndexerRate> out = new ArrayList<>();
        for (JsonNode row : root) {
            try {
                LocalDate date = LocalDate.parse(row.path("data").asText(), SGS_DATE);
                BigDecimal value = new BigDecimal(row.path("valor").asText().strip());
                out.add(IndexerRate.of(indexer, date, value));
            } catch (DateTimeParseException | NumberFormatException e) {
                log.debug("Skipping SGS row {} for {}: {}", row, indexer, e.getMessage());
            }
        }
        return out;
    }
}
