package io.trading.bbo.feed.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.bbo.marketdata.model.BestBidOffer;
import io.trading.bbo.marketdata.model.Trade;
import io.trading.bbo.marketdata.model.TradeReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Writes one JSON object per line using Jackson.
 *
 * <pre>
 * {"type":"trade","price":"3626.73","amount":"0.8","makerSide":"BID","notional":"2901.384"}
 * {"type":"bbo","bestBid":"3626.73","bestOffer":"3627.01","bidAmountRemaining":"1.6","askAmountRemaining":"0.4"}
 * </pre>
 *
 * Decimals are written as strings, matching the exchange's own wire convention.
 */
public class JsonLinesReporter implements MarketDataReporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonLinesReporter.class);

    private final PrintStream out;
    private final ObjectMapper objectMapper;

    public JsonLinesReporter(PrintStream out) {
        this.out = out;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void onTrade(TradeReport report) {
        Trade trade = report.trade();
        ObjectNode node = objectMapper.createObjectNode()
            .put("type", "trade")
            .put("price", trade.price().toPlainString())
            .put("amount", trade.amount().toPlainString())
            .put("makerSide", trade.makerSide().name())
            .put("notional", report.notional().toPlainString());
        write(node);
    }

    @Override
    public void onBestBidOffer(BestBidOffer snapshot) {
        ObjectNode node = objectMapper.createObjectNode()
            .put("type", "bbo")
            .put("bestBid", snapshot.bestBid().toPlainString())
            .put("bestOffer", snapshot.bestOffer().toPlainString())
            .put("bidAmountRemaining", snapshot.bidAmountRemaining().toPlainString())
            .put("askAmountRemaining", snapshot.askAmountRemaining().toPlainString());
        write(node);
    }

    private void write(ObjectNode node) {
        try {
            out.println(objectMapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to encode {} to JSON: {}", node.get("type"), e.getMessage(), e);
            throw new IllegalStateException("Failed to encode report to JSON", e);
        }
    }
}
