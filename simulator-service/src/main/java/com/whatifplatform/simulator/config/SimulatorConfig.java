package com.whatifplatform.simulator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whatifplatform.common.external.EarlyDeclineDetection;
import com.whatifplatform.common.external.RoiAttribution;
import com.whatifplatform.common.external.TrendLifecycleEngine;
import com.whatifplatform.simulator.baseline.BaselineExtractor;
import com.whatifplatform.simulator.client.WebClientEarlyDeclineDetection;
import com.whatifplatform.simulator.client.WebClientRoiAttribution;
import com.whatifplatform.simulator.client.WebClientTrendLifecycleEngine;
import com.whatifplatform.simulator.logger.SimulationFlowLogger;
import com.whatifplatform.simulator.roi.RoiComputationService;
import com.whatifplatform.simulator.service.ScenarioSimulator;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Wires the upstream clients and the simulation pipeline. Everything here is created once
 * at startup and shared by all requests.
 */
@Configuration
public class SimulatorConfig {

    @Value("${services.trend-lifecycle.base-url}")
    private String trendLifecycleUrl;

    @Value("${services.early-decline.base-url}")
    private String earlyDeclineUrl;

    @Value("${services.roi-attribution.base-url}")
    private String roiAttributionUrl;

    @Bean
    public WebClient trendLifecycleClient(WebClient.Builder builder, SimulatorProperties properties) {
        return client(builder, trendLifecycleUrl, properties);
    }

    @Bean
    public WebClient earlyDeclineClient(WebClient.Builder builder, SimulatorProperties properties) {
        return client(builder, earlyDeclineUrl, properties);
    }

    @Bean
    public WebClient roiAttributionClient(WebClient.Builder builder, SimulatorProperties properties) {
        return client(builder, roiAttributionUrl, properties);
    }

    @Bean
    public TrendLifecycleEngine trendLifecycleEngine(WebClient trendLifecycleClient) {
        return new WebClientTrendLifecycleEngine(trendLifecycleClient);
    }

    @Bean
    public EarlyDeclineDetection earlyDeclineDetection(WebClient earlyDeclineClient) {
        return new WebClientEarlyDeclineDetection(earlyDeclineClient);
    }

    @Bean
    public RoiAttribution roiAttribution(WebClient roiAttributionClient) {
        return new WebClientRoiAttribution(roiAttributionClient);
    }

    @Bean
    public BaselineExtractor baselineExtractor(TrendLifecycleEngine trendLifecycleEngine,
                                               EarlyDeclineDetection earlyDeclineDetection,
                                               SimulatorProperties properties) {
        return new BaselineExtractor(trendLifecycleEngine, earlyDeclineDetection,
            properties.getCollaboratorTimeout());
    }

    @Bean
    public RoiComputationService roiComputationService(RoiAttribution roiAttribution,
                                                       SimulatorProperties properties) {
        return new RoiComputationService(roiAttribution, properties.getCollaboratorTimeout());
    }

    @Bean
    public ScenarioSimulator scenarioSimulator(BaselineExtractor baselineExtractor,
                                               RoiComputationService roiComputationService,
                                               SimulationFlowLogger simulationFlowLogger) {
        return new ScenarioSimulator(baselineExtractor, roiComputationService, simulationFlowLogger);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    private static WebClient client(WebClient.Builder builder, String baseUrl, SimulatorProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutMillis())
            .responseTimeout(properties.getCollaboratorTimeout());

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
