package com.jay.lbomodel.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
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
 * Loads and exposes all model configuration from config.yaml.
 * Values are read once at startup and cached. Edit config.yaml and restart to apply changes.
 */
@Slf4j
@Component
public class ModelConfig {

    @Value("${lbo.config-file:config.yaml}")
    private String configFile = "config.yaml";

    @Autowired
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null || env == null) return value;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, env::getProperty);
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Deal deal = new Deal();
    private Sensitivity sensitivity = new Sensitivity();
    private Solver solver = new Solver();
    private Report report = new Report();

    @PostConstruct
    public void load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            if (root == null) {
                log.warn("Config file '{}' is empty — using defaults", configFile);
                return;
            }
            this.deal        = root.getDeal() != null ? root.getDeal() : new Deal();
            this.sensitivity = root.getSensitivity() != null ? root.getSensitivity() : new Sensitivity();
            this.solver      = root.getSolver() != null ? root.getSolver() : new Solver();
            this.report      = root.getReport() != null ? root.getReport() : new Report();

            // Jackson reads ${VAR:default} placeholders as literal strings
            this.deal.setCompanyName(resolve(this.deal.getCompanyName()));
            log.info("ModelConfig loaded from '{}'. Base case: {} {}-{}",
                configFile, deal.getCompanyName(), deal.getEntryYear(), deal.getExitYear());
        } catch (Exception e) {
            log.error("Failed to load {} — model will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Deal deal()               { return deal; }
    public Sensitivity sensitivity() { return sensitivity; }
    public Solver solver()           { return solver; }
    public Report report()           { return report; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Deal deal;
        private Sensitivity sensitivity;
        private Solver solver;
        private Report report;
    }

    /** Base-case deal inputs. Percentages are whole numbers (25 = 25%); tax rate is a fraction. */
    @Data public static class Deal {
        private String companyName = "Acme Corp";
        private int entryYear = 2023;
        private int exitYear = 2028;
        private double revenueEntry = 500;
        private double ebitdaMarginEntryPct = 25;
        private double revenueGrowthPct = 8;
        private double ebitdaMarginExitPct = 30;
        private double capexPct = 4;
        private double dso = 45;
        private double dpo = 60;
        private double dsi = 30;
        private double purchasePriceMultiple = 10.0;
        private double debtPct = 60;
        private double interestRatePct = 8;
        private int amortizationYears = 5;
        private double taxRate = 0.21;
        private Double exitMultiple;     // null → exit at the purchase multiple
    }

    @Data public static class Sensitivity {
        private double step = 1.0;
        private int pointsEachSide = 2;
        private int parallelism = 4;
    }

    @Data public static class Solver {
        private double relativeAccuracy = 1e-12;
        private double absoluteAccuracy = 1e-12;
        private int maxEvaluations = 500;
        private double minRate = -0.9999;   // as a fraction; must stay above -1
        private double maxRate = 100.0;
        private int gridPoints = 1000;
        private int maxRangeExpansions = 8;   // doublings of log(1 + max_rate) tried past the grid
    }

    @Data public static class Report {
        private boolean printOnStartup = true;
    }
}
