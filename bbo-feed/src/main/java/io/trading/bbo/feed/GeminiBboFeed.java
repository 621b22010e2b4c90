package io.trading.bbo.feed;

import io.trading.bbo.feed.config.FeedConfig;
import io.trading.bbo.feed.core.FeedController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point. Follows one Gemini symbol and reports trades and the best bid/offer.
 *
 * <pre>
 *   java -jar bbo-feed.jar --symbol btcusd [--output json] [--metrics-port 9090] [--no-metrics]
 *   GEMINI_SYMBOL=btcusd java -jar bbo-feed.jar
 * </pre>
 */
public class GeminiBboFeed {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiBboFeed.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Gemini BBO Feed Starting...");
        LOGGER.info("========================================");

        try {
            // Without arguments the environment alone configures the feed
            FeedConfig config = args.length == 0 ? FeedConfig.fromEnv() : FeedConfig.fromArgs(args);
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Symbol: {}", config.symbol());
            LOGGER.info("  Stream: {}", config.streamUri());
            LOGGER.info("  Output: {}", config.outputFormat());
            LOGGER.info("  Metrics: {}", config.metricsEnabled() ? "port " + config.metricsPort() : "disabled");

            FeedController controller = new FeedController(config);
            controller.start();

            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.waitForShutdown();

            controller.close();

        } catch (Exception e) {
            LOGGER.error("Fatal error in Gemini BBO Feed", e);
            System.exit(1);
        }

        LOGGER.info("Gemini BBO Feed exited");
    }
}
