package com.signalplatform.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalplatform.common.calibration.CalibrationSettings;
import com.signalplatform.common.calibration.ThresholdsRegistry;
import com.signalplatform.common.confluence.ConfluenceAggregator;
import com.signalplatform.common.confluence.ConfluenceSettings;
import com.signalplatform.common.confluence.TimeframeSet;
import com.signalplatform.common.consensus.AgreementConsensusStrategy;
import com.signalplatform.common.consensus.ConsensusResolver;
import com.signalplatform.common.consensus.ConsensusStatistics;
import com.signalplatform.common.gate.GateSettings;
import com.signalplatform.common.gate.PreTradeGate;
import com.signalplatform.common.gate.TradingSession;
import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.Timeframe;
import com.signalplatform.orchestrator.judge.AnalysisPromptBuilder;
import com.signalplatform.orchestrator.judge.ChatCompletionJudge;
import com.signalplatform.orchestrator.judge.Judge;
import com.signalplatform.orchestrator.judge.JudgePool;
import com.signalplatform.orchestrator.judge.JudgeResponseParser;
import com.signalplatform.orchestrator.pipeline.SignalDecisionPipeline;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    // ── collaborator endpoints ────────────────────────────────────────────────

    @Value("${services.market-data.base-url}")
    private String marketDataUrl;

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Value("${services.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${services.response-timeout-seconds:15}")
    private int responseTimeoutSeconds;

    // ── pipeline ──────────────────────────────────────────────────────────────

    @Value("${pipeline.timeframes:5m:0.10,15m:0.15,30m:0.15,1h:0.20,4h:0.20,1d:0.20}")
    private String timeframeWeights;

    @Value("${pipeline.higher-timeframes:4h,1d}")
    private String higherTimeframes;

    @Value("${pipeline.min-candles:50}")
    private int minSnapshotCandles;

    @Value("${pipeline.min-confluence:3}")
    private int minConfluence;

    @Value("${pipeline.strong-confluence:5}")
    private int strongConfluence;

    @Value("${pipeline.signal-validity:PT5M}")
    private Duration signalValidity;

    @Value("${pipeline.default-analysis-window:100}")
    private int defaultAnalysisWindow;

    @Value("${pipeline.performance-filter-enabled:true}")
    private boolean performanceFilterEnabled;

    // ── thresholds ────────────────────────────────────────────────────────────

    @Value("${thresholds.min-confidence:70}")
    private double initialMinConfidence;

    @Value("${thresholds.consensus-required:true}")
    private boolean initialConsensusRequired;

    @Value("${thresholds.consensus-agreement-bonus:0}")
    private double initialAgreementBonus;

    // ── gate ──────────────────────────────────────────────────────────────────

    @Value("${gate.min-candles:5}")
    private int gateMinCandles;

    @Value("${gate.min-aggregate-score:0.6}")
    private double gateMinAggregateScore;

    @Value("${gate.spread.enabled:true}")
    private boolean spreadEnabled;

    @Value("${gate.spread.max-percent:0.05}")
    private double maxSpreadPercent;

    @Value("${gate.spread.max-pips:5}")
    private double maxSpreadPips;

    @Value("${gate.volatility.enabled:true}")
    private boolean volatilityEnabled;

    @Value("${gate.volatility.min-percent:0.01}")
    private double minVolatilityPercent;

    @Value("${gate.volatility.max-percent:2.0}")
    private double maxVolatilityPercent;

    @Value("${gate.volatility.window:10}")
    private int volatilityWindow;

    @Value("${gate.low-volatility-factor:0.1}")
    private double lowVolatilityFactor;

    @Value("${gate.liquidity.enabled:true}")
    private boolean liquidityEnabled;

    @Value("${gate.liquidity.min-volume-ratio:0.5}")
    private double minVolumeRatio;

    @Value("${gate.liquidity.min-absolute-volume:1000}")
    private double minAbsoluteVolume;

    @Value("${gate.liquidity.window:20}")
    private int volumeWindow;

    @Value("${gate.session.enabled:true}")
    private boolean sessionEnabled;

    @Value("${gate.session.allowed:asian,london,newyork}")
    private String allowedSessions;

    @Value("${gate.session.news-buffer-minutes:30}")
    private int newsBufferMinutes;

    @Value("${gate.price-action.enabled:true}")
    private boolean priceActionEnabled;

    @Value("${gate.price-action.max-gap-percent:0.5}")
    private double maxGapPercent;

    @Value("${gate.price-action.min-body-percent:0.01}")
    private double minBodyPercent;

    // ── calibration ───────────────────────────────────────────────────────────

    @Value("${calibration.lookback-days:7}")
    private int lookbackDays;

    @Value("${calibration.min-move-percent:0.01}")
    private double minMovePercent;

    @Value("${calibration.min-samples:20}")
    private int minSamples;

    @Value("${calibration.low-accuracy:60}")
    private double lowAccuracy;

    @Value("${calibration.high-accuracy:80}")
    private double highAccuracy;

    @Value("${calibration.raise-step:5}")
    private double raiseStep;

    @Value("${calibration.relax-step:2}")
    private double relaxStep;

    @Value("${calibration.min-min-confidence:50}")
    private double minMinConfidence;

    @Value("${calibration.max-min-confidence:80}")
    private double maxMinConfidence;

    @Value("${calibration.bonus-step:1}")
    private double bonusStep;

    @Value("${calibration.max-agreement-bonus:5}")
    private double maxAgreementBonus;

    // ── web clients ───────────────────────────────────────────────────────────

    @Bean
    public WebClient marketDataClient(WebClient.Builder builder) {
        return collaboratorClient(builder, marketDataUrl);
    }

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        return collaboratorClient(builder, historyUrl);
    }

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return collaboratorClient(builder, notificationUrl);
    }

    private WebClient collaboratorClient(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException("Collaborator server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    // ── judges ────────────────────────────────────────────────────────────────

    @Bean
    public JudgePool judgePool(JudgeProperties properties, WebClient.Builder builder, ObjectMapper objectMapper,
                               AnalysisPromptBuilder promptBuilder, JudgeResponseParser parser) {
        List<Judge> judges = properties.definitions().stream()
            .map(def -> (Judge) new ChatCompletionJudge(def, builder, objectMapper))
            .toList();
        log.info("Judge pool configured. judges={} timeoutMs={}",
                 judges.stream().map(Judge::id).toList(), properties.timeout().toMillis());
        return new JudgePool(judges, promptBuilder, parser, properties.timeout());
    }

    // ── decision components ───────────────────────────────────────────────────

    @Bean
    public TimeframeSet timeframeSet() {
        Map<Timeframe, Double> weights = new LinkedHashMap<>();
        for (String entry : timeframeWeights.split(",")) {
            String[] parts = entry.trim().split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Timeframe weight must be <timeframe>:<weight>, got '" + entry + "'");
            }
            weights.put(Timeframe.fromLabel(parts[0]), Double.parseDouble(parts[1].trim()));
        }
        List<Timeframe> higher = Arrays.stream(higherTimeframes.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(Timeframe::fromLabel)
            .toList();
        return new TimeframeSet(weights, higher);
    }

    @Bean
    public ConfluenceAggregator confluenceAggregator(TimeframeSet timeframeSet) {
        ConfluenceSettings defaults = ConfluenceSettings.defaults();
        ConfluenceSettings settings = new ConfluenceSettings(minConfluence, strongConfluence,
            defaults.higherTimeframeBoost(), defaults.strongConfluenceIncrement(), defaults.confidenceCap());
        return new ConfluenceAggregator(timeframeSet, settings, minSnapshotCandles);
    }

    @Bean
    public ConsensusStatistics consensusStatistics() {
        return new ConsensusStatistics();
    }

    @Bean
    public ConsensusResolver consensusResolver(ConsensusStatistics consensusStatistics) {
        return new AgreementConsensusStrategy(consensusStatistics);
    }

    @Bean
    public GateSettings gateSettings() {
        Set<TradingSession> sessions = Arrays.stream(allowedSessions.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(TradingSession::fromText)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(TradingSession.class)));
        return new GateSettings(
            new GateSettings.Spread(spreadEnabled, maxSpreadPercent, maxSpreadPips),
            new GateSettings.Volatility(volatilityEnabled, minVolatilityPercent, maxVolatilityPercent,
                                        volatilityWindow, lowVolatilityFactor),
            new GateSettings.Liquidity(liquidityEnabled, minVolumeRatio, minAbsoluteVolume, volumeWindow),
            new GateSettings.Session(sessionEnabled, sessions, newsBufferMinutes),
            new GateSettings.PriceAction(priceActionEnabled, maxGapPercent, minBodyPercent, lowVolatilityFactor),
            gateMinCandles,
            gateMinAggregateScore);
    }

    @Bean
    public PreTradeGate preTradeGate(GateSettings gateSettings) {
        return new PreTradeGate(gateSettings);
    }

    @Bean
    public CalibrationSettings calibrationSettings() {
        return new CalibrationSettings(lookbackDays, minMovePercent, minSamples, lowAccuracy, highAccuracy,
                                       raiseStep, relaxStep, minMinConfidence, maxMinConfidence,
                                       bonusStep, maxAgreementBonus);
    }

    @Bean
    public ThresholdsRegistry thresholdsRegistry(Clock clock, CalibrationSettings calibrationSettings) {
        return new ThresholdsRegistry(calibrationSettings.requireWithinBounds(AdaptiveThresholds.initial(
            initialMinConfidence, initialConsensusRequired, initialAgreementBonus, clock.instant())));
    }

    @Bean
    public SignalDecisionPipeline.PipelineSettings pipelineSettings() {
        return new SignalDecisionPipeline.PipelineSettings(signalValidity, defaultAnalysisWindow,
                                                           performanceFilterEnabled);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
