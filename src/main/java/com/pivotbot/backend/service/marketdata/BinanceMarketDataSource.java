package com.pivotbot.backend.service.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pivotbot.backend.exception.MarketDataException;
import com.pivotbot.backend.model.Candle;
import com.pivotbot.backend.model.MarketSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Public Binance spot endpoints: hourly klines and the ticker price. No request signing.
 */
@Service
@ConditionalOnProperty(name = "trading.market-data-source", havingValue = "binance")
public class BinanceMarketDataSource implements MarketDataSource {

    private static final Logger logger = LoggerFactory.getLogger(BinanceMarketDataSource.class);

    static final int KLINE_LIMIT = 48;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${marketdata.binance.base-url:https://api.binance.com}")
    private String baseUrl;

    @Autowired
    public BinanceMarketDataSource(RestTemplate restTemplate, ObjectMapper objectMapper, Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    @Override
    public String getSourceName() {
        return "BINANCE";
    }

    @Override
    public MarketSnapshot snapshot(String symbol) throws MarketDataException {
        List<Candle> hourly = fetchHourlyCandles(symbol);
        BigDecimal price = fetchTickerPrice(symbol);
        return MarketSnapshot.fromHourlyCandles(symbol, hourly, price, clock.instant());
    }

    List<Candle> fetchHourlyCandles(String symbol) throws MarketDataException {
        String url = baseUrl + "/api/v3/klines?symbol=" + symbol + "&interval=1h&limit=" + KLINE_LIMIT;
        JsonNode root = getJson(url, symbol);
        if (!root.isArray()) {
            throw new MarketDataException("Kline response for " + symbol + " is not an array");
        }

        List<Candle> candles = new ArrayList<>();
        for (JsonNode kline : root) {
            if (!kline.isArray() || kline.size() < 7) {
                logger.warn("Skipping malformed kline for {}: {}", symbol, kline);
                continue;
            }
            try {
                candles.add(new Candle(
                        Instant.ofEpochMilli(kline.get(0).asLong()),
                        // Binance reports the last millisecond of the bar
                        Instant.ofEpochMilli(kline.get(6).asLong() + 1),
                        new BigDecimal(kline.get(1).asText()),
                        new BigDecimal(kline.get(2).asText()),
                        new BigDecimal(kline.get(3).asText()),
                        new BigDecimal(kline.get(4).asText()),
                        new BigDecimal(kline.get(5).asText())));
            } catch (NumberFormatException e) {
                throw new MarketDataException("Unparsable kline for " + symbol + ": " + kline, e);
            }
        }
        logger.debug("Parsed {} hourly candles for {}", candles.size(), symbol);
        return candles;
    }

    BigDecimal fetchTickerPrice(String symbol) throws MarketDataException {
        JsonNode root = getJson(baseUrl + "/api/v3/ticker/price?symbol=" + symbol, symbol);
        String price = root.path("price").asText(null);
        if (price == null) {
            throw new MarketDataException("Ticker response for " + symbol + " has no price: " + root);
        }
        try {
            return new BigDecimal(price);
        } catch (NumberFormatException e) {
            throw new MarketDataException("Unparsable ticker price for " + symbol + ": " + price, e);
        }
    }

    private JsonNode getJson(String url, String symbol) throws MarketDataException {
        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(url, String.class);
        } catch (RestClientException e) {
            throw new MarketDataException("Request for " + symbol + " market data failed: " + e.getMessage(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new MarketDataException("Unexpected market data response for " + symbol + ": " + response.getStatusCode());
        }
        try {
            return objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException e) {
            throw new MarketDataException("Market data response for " + symbol + " is not JSON", e);
        }
    }
}
