package com.jay.formulaengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.formulaengine.model.PositionSizing;
import com.jay.formulaengine.model.RiskPolicy;
import com.jay.formulaengine.model.enums.PriceLevelType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;

/**
 * Loads and exposes engine configuration from config.yaml.
 * Values are read once at startup and cached. Edit config.yaml and restart to apply changes.
 */
@Slf4j
@Component
public class EngineConfig {

    @Value("${engine.config-file:config.yaml}")
    private String configFile = "config.yaml";

    @Autowired(required = false)
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null || env == null) return value;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, key -> env.getProperty(key));
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Scheduler scheduler = new Scheduler();
    private Evaluation evaluation = new Evaluation();
    private Risk risk = new Risk();
    private Sizing sizing = new Sizing();
    private Approval approval = new Approval();
    private Execution execution = new Execution();
    private MarketData marketData = new MarketData();
    private Telegram telegram = new Telegram();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            this.scheduler  = root.getScheduler();
            this.evaluation = root.getEvaluation();
            this.risk       = root.getRisk();
            this.sizing     = root.getSizing();
            this.approval   = root.getApproval();
            this.execution  = root.getExecution();
            this.marketData = root.getMarketData();
            this.telegram   = root.getTelegram();

            // Resolve ${VAR:default} placeholders that Jackson reads as literal strings
            this.marketData.setBaseUrl(resolve(this.marketData.getBaseUrl()));
            this.marketData.setApiKey(resolve(this.marketData.getApiKey()));
            this.telegram.setBotToken(resolve(this.telegram.getBotToken()));
            this.telegram.setChatId(resolve(this.telegram.getChatId()));
            log.info("EngineConfig loaded from '{}'. Scheduler enabled: {}, interval {} ms",
                configFile, scheduler.isEnabled(), scheduler.getIntervalMs());
        } catch (Exception e) {
            log.error("Failed to load {} — engine will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Scheduler scheduler()   { return scheduler; }
    public Evaluation evaluation() { return evaluation; }
    public Risk risk()             { return risk; }
    public Sizing sizing()         { return sizing; }
    public Approval approval()     { return approval; }
    public Execution execution()   { return execution; }
    public MarketData marketData() { return marketData; }
    public Telegram telegram()     { return telegram; }

    /** Policy applied when a subscription carries none. */
    public RiskPolicy defaultRiskPolicy() {
        return RiskPolicy.builder()
            .maxPortfolioRisk(risk.getMaxPortfolioRisk())
            .maxPositionSize(risk.getMaxPositionSize())
            .maxRiskPerTrade(risk.getMaxRiskPerTrade())
            .maxDrawdown(risk.getMaxDrawdown())
            .minRiskRewardRatio(risk.getMinRiskRewardRatio())
            .maxLeverage(risk.getMaxLeverage())
            .build();
    }

    /** Sizing applied when a subscription carries none. */
    public PositionSizing defaultSizing() {
        return PositionSizing.builder()
            .portfolioValue(sizing.getPortfolioValue())
            .allocationPct(sizing.getAllocationPct())
            .stopLoss(sizing.getStopLoss())
            .stopLossType(sizing.getStopLossType())
            .takeProfit(sizing.getTakeProfit())
            .takeProfitType(sizing.getTakeProfitType())
            .leverage(sizing.getLeverage())
            .build();
    }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Scheduler scheduler = new Scheduler();
        private Evaluation evaluation = new Evaluation();
        private Risk risk = new Risk();
        private Sizing sizing = new Sizing();
        private Approval approval = new Approval();
        private Execution execution = new Execution();
        private MarketData marketData = new MarketData();
        private Telegram telegram = new Telegram();
    }

    @Data public static class Scheduler {
        private boolean enabled = true;
        private long intervalMs = 300_000;
        private String marketOpenCron = "0 30 9 * * MON-FRI";
        private String marketCloseCron = "0 0 16 * * MON-FRI";
        private String zone = "America/New_York";
    }

    @Data public static class Evaluation {
        private long timeoutMs = 1500;
        private int workerThreads = 0;          // 0 → sized from available processors
        private int sandboxThreads = 0;         // 0 → sized from available processors
        private int queueCapacity = 1000;
        private long marketDataTimeoutMs = 20_000;
    }

    @Data public static class Risk {
        private double maxPortfolioRisk = 0.02;
        private double maxPositionSize = 0.1;
        private double maxRiskPerTrade = 0.01;
        private double maxDrawdown = 0.05;
        private double minRiskRewardRatio = 1.0;
        private double maxLeverage = 1.0;
    }

    @Data public static class Sizing {
        private double portfolioValue = 10000;
        private double allocationPct = 0.05;
        private double stopLoss = 2.0;
        private PriceLevelType stopLossType = PriceLevelType.PERCENTAGE;
        private double takeProfit = 4.0;
        private PriceLevelType takeProfitType = PriceLevelType.PERCENTAGE;
        private double leverage = 1.0;
    }

    @Data public static class Approval {
        private int expiryMinutes = 30;
    }

    @Data public static class Execution {
        private String defaultBroker = "paper";
        private long brokerTimeoutMs = 10_000;
        private int orderFillTimeoutSeconds = 300;
        private double paperSlippagePct = 0.0;
    }

    @Data public static class MarketData {
        private String baseUrl = "";
        private String apiKey = "";
        private int historyBars = 120;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 15;
    }

    @Data public static class Telegram {
        private String apiBase = "https://api.telegram.org";
        private String botToken = "";
        private String chatId = "";         // operator chat; receives every notification
        private String offsetFile = "";     // blank: ~/.formula-engine-telegram-offset
    }
}
