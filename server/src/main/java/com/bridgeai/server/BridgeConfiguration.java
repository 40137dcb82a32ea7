package com.bridgeai.server;

import com.bridgeai.server.bridge.BridgeConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Exposes the bridge settings read from {@code /bridge_config.json}.
 */
@Configuration
public class BridgeConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(BridgeConfiguration.class);

    @Bean
    BridgeConfig bridgeConfig() throws IOException {
        BridgeConfig config = BridgeConfig.load(new ObjectMapper());
        config.validate();
        logger.info("Loaded bridge config: mode={}, aiEnabled={}, maxPendingRequests={}, batchTimeoutMs={}",
                config.mode, config.aiEnabled, config.maxPendingRequests, config.batchTimeoutMs);
        return config;
    }
}
