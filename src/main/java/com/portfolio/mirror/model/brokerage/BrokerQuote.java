package com.portfolio.mirror.model.brokerage;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Level-1 quote as returned by {@code markets/quotes}. Absent or non-numeric upstream fields are read as zero here
 * so nothing downstream has to deal with them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokerQuote {

    private String symbol;
    private long symbolId;

    private double lastTradePrice;
    private long lastTradeSize;
    private String lastTradeTick;
    private Instant lastTradeTime;

    private double bidPrice;
    private long bidSize;
    private double askPrice;
    private long askSize;

    private double openPrice;
    private double highPrice;
    private double lowPrice;
    private double closePrice;
    private double previousClosePrice;

    private double change;
    private double changePercent;

    private long volume;
    private long averageVolume;
    private double volumeWeightedAveragePrice;

    private double week52High;
    private double week52Low;

    private String exchange;
    private boolean halted;
    private int delay;
    private boolean realTime;

    public static BrokerQuote fromJson(JsonNode q) {
        double last = number(q, "lastTradePrice");
        double previousClose = number(q, "previousClosePrice");
        int delay = (int) number(q, "delay");
        return BrokerQuote.builder()
                .symbol(q.path("symbol").asText(null))
                .symbolId((long) number(q, "symbolId"))
                .lastTradePrice(last)
                .lastTradeSize((long) number(q, "lastTradeSize"))
                .lastTradeTick(q.path("lastTradeTick").asText(null))
                .lastTradeTime(instant(q, "lastTradeTime"))
                .bidPrice(number(q, "bidPrice"))
                .bidSize((long) number(q, "bidSize"))
                .askPrice(number(q, "askPrice"))
                .askSize((long) number(q, "askSize"))
                .openPrice(number(q, "openPrice"))
                .highPrice(number(q, "highPrice"))
                .lowPrice(number(q, "lowPrice"))
                .closePrice(number(q, "closePrice"))
                .previousClosePrice(previousClose)
                .change(last - previousClose)
                .changePercent(previousClose > 0 ? ((last - previousClose) / previousClose) * 100 : 0)
                .volume((long) number(q, "volume"))
                .averageVolume((long) number(q, "averageVolume"))
                .volumeWeightedAveragePrice(number(q, "VWAP"))
                .week52High(number(q, "high52w"))
                .week52Low(number(q, "low52w"))
                .exchange(q.path("exchange").asText(null))
                .halted(q.path("isHalted").asBoolean(false))
                .delay(delay)
                .realTime(delay == 0)
                .build();
    }

    private static double number(JsonNode q, String field) {
        JsonNode node = q.get(field);
        return node != null && node.isNumber() ? node.asDouble() : 0d;
    }

    private static Instant instant(JsonNode q, String field) {
        JsonNode node = q.get(field);
        if (node == null || !node.isTextual()) return null;
        try {
            return OffsetDateTime.parse(node.asText()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
