package com.cgekernel.infra.config;

import com.cgekernel.api.exceptions.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Kernel-wide defaults for solving, residual checks and export.
 *
 * <p><b>Sources, lowest to highest precedence:</b>
 * <ol>
 *   <li>Built-in defaults</li>
 *   <li>A properties file ({@link #loadFromProperties(String)})</li>
 *   <li>Environment variables {@code CGE_<PROPERTY_NAME>}</li>
 * </ol>
 *
 * <p>Example environment variables:
 * <pre>
 * CGE_TOLERANCE=1e-8
 * CGE_BACKEND=newton
 * CGE_NEWTON_MAX_ITERATIONS=200
 * </pre>
 *
 * <p><b>Example kernel.properties:</b>
 * <pre>
 * kernel.tolerance=1e-6
 * kernel.dataset.id=cge
 * kernel.backend=evaluate
 * kernel.newton.max.iterations=50
 * kernel.newton.tolerance=1e-10
 * kernel.scaling.large=1e6
 * kernel.scaling.small=1e-8
 * kernel.validation.top.residuals=5
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * KernelConfig config = KernelConfig.builder()
 *     .tolerance(1e-8)
 *     .defaultBackend("newton")
 *     .build();
 * }</pre>
 */
public final class KernelConfig {

    private static final Logger logger = LoggerFactory.getLogger(KernelConfig.class);

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    private static final String ENV_TOLERANCE = "CGE_TOLERANCE";
    private static final String ENV_DATASET_ID = "CGE_DATASET_ID";
    private static final String ENV_BACKEND = "CGE_BACKEND";
    private static final String ENV_NEWTON_MAX_ITERATIONS = "CGE_NEWTON_MAX_ITERATIONS";
    private static final String ENV_NEWTON_TOLERANCE = "CGE_NEWTON_TOLERANCE";
    private static final String ENV_SCALING_LARGE = "CGE_SCALING_LARGE";
    private static final String ENV_SCALING_SMALL = "CGE_SCALING_SMALL";
    private static final String ENV_TOP_RESIDUALS = "CGE_TOP_RESIDUALS";

    // ========================================================================
    // DEFAULTS
    // ========================================================================

    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final String DEFAULT_DATASET_ID = "cge";
    public static final String DEFAULT_BACKEND = "evaluate";
    public static final int DEFAULT_NEWTON_MAX_ITERATIONS = 50;
    public static final double DEFAULT_NEWTON_TOLERANCE = 1e-10;
    public static final double DEFAULT_SCALING_LARGE = 1e6;
    public static final double DEFAULT_SCALING_SMALL = 1e-8;
    public static final int DEFAULT_TOP_RESIDUALS = 5;

    private final double tolerance;
    private final String datasetId;
    private final String defaultBackend;
    private final int newtonMaxIterations;
    private final double newtonTolerance;
    private final double scalingLargeThreshold;
    private final double scalingSmallThreshold;
    private final int topResidualCount;

    private KernelConfig(Builder builder) {
        this.tolerance = builder.tolerance;
        this.datasetId = builder.datasetId;
        this.defaultBackend = builder.defaultBackend;
        this.newtonMaxIterations = builder.newtonMaxIterations;
        this.newtonTolerance = builder.newtonTolerance;
        this.scalingLargeThreshold = builder.scalingLargeThreshold;
        this.scalingSmallThreshold = builder.scalingSmallThreshold;
        this.topResidualCount = builder.topResidualCount;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults overridden by the process environment.
     */
    public static KernelConfig fromEnvironment() {
        return builder().environment(System.getenv()).build();
    }

    /**
     * Loads {@code kernel.properties} from the classpath root, falling back to
     * defaults when absent. Environment variables override file values.
     */
    public static KernelConfig loadDefault() {
        return loadFromProperties("kernel.properties");
    }

    /**
     * Loads configuration from a properties file looked up on the classpath
     * first, then on the file system. Environment variables override file values.
     *
     * @param propertiesPath classpath resource or file path
     */
    public static KernelConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading kernel configuration from: {}", propertiesPath);
        Properties props = new Properties();

        try (InputStream is = KernelConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} properties from classpath: {}", props.size(), propertiesPath);
            }
        } catch (IOException e) {
            logger.debug("Could not load from classpath: {}", propertiesPath, e);
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded {} properties from file: {}", props.size(), propertiesPath);
            } catch (IOException e) {
                logger.warn("Could not load properties file: {}. Using defaults.", propertiesPath);
            }
        }

        return builder().properties(props).environment(System.getenv()).build();
    }

    private void validate() {
        if (!(tolerance >= 0.0)) {
            throw new ConfigurationException("tolerance must be >= 0, got: " + tolerance);
        }
        if (datasetId == null || datasetId.isBlank()) {
            throw new ConfigurationException("datasetId must not be empty");
        }
        if (defaultBackend == null || defaultBackend.isBlank()) {
            throw new ConfigurationException("defaultBackend must not be empty");
        }
        if (newtonMaxIterations <= 0) {
            throw new ConfigurationException("newtonMaxIterations must be positive, got: " + newtonMaxIterations);
        }
        if (!(newtonTolerance > 0.0)) {
            throw new ConfigurationException("newtonTolerance must be positive, got: " + newtonTolerance);
        }
        if (!(scalingSmallThreshold > 0.0) || !(scalingLargeThreshold > scalingSmallThreshold)) {
            throw new ConfigurationException("scaling thresholds must satisfy 0 < small < large, got: "
                    + scalingSmallThreshold + " / " + scalingLargeThreshold);
        }
        if (topResidualCount < 0) {
            throw new ConfigurationException("topResidualCount must be >= 0, got: " + topResidualCount);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public double getTolerance() {
        return tolerance;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public String getDefaultBackend() {
        return defaultBackend;
    }

    public int getNewtonMaxIterations() {
        return newtonMaxIterations;
    }

    public double getNewtonTolerance() {
        return newtonTolerance;
    }

    public double getScalingLargeThreshold() {
        return scalingLargeThreshold;
    }

    public double getScalingSmallThreshold() {
        return scalingSmallThreshold;
    }

    public int getTopResidualCount() {
        return topResidualCount;
    }

    @Override
    public String toString() {
        return "KernelConfig{" +
                "tolerance=" + tolerance +
                ", datasetId='" + datasetId + '\'' +
                ", defaultBackend='" + defaultBackend + '\'' +
                ", newtonMaxIterations=" + newtonMaxIterations +
                ", newtonTolerance=" + newtonTolerance +
                ", scalingLargeThreshold=" + scalingLargeThreshold +
                ", scalingSmallThreshold=" + scalingSmallThreshold +
                ", topResidualCount=" + topResidualCount +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private double tolerance = DEFAULT_TOLERANCE;
        private String datasetId = DEFAULT_DATASET_ID;
        private String defaultBackend = DEFAULT_BACKEND;
        private int newtonMaxIterations = DEFAULT_NEWTON_MAX_ITERATIONS;
        private double newtonTolerance = DEFAULT_NEWTON_TOLERANCE;
        private double scalingLargeThreshold = DEFAULT_SCALING_LARGE;
        private double scalingSmallThreshold = DEFAULT_SCALING_SMALL;
        private int topResidualCount = DEFAULT_TOP_RESIDUALS;

        private Builder() {
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder datasetId(String datasetId) {
            this.datasetId = datasetId;
            return this;
        }

        public Builder defaultBackend(String defaultBackend) {
            this.defaultBackend = defaultBackend;
            return this;
        }

        public Builder newtonMaxIterations(int newtonMaxIterations) {
            this.newtonMaxIterations = newtonMaxIterations;
            return this;
        }

        public Builder newtonTolerance(double newtonTolerance) {
            this.newtonTolerance = newtonTolerance;
            return this;
        }

        public Builder scalingThresholds(double small, double large) {
            this.scalingSmallThreshold = small;
            this.scalingLargeThreshold = large;
            return this;
        }

        public Builder topResidualCount(int topResidualCount) {
            this.topResidualCount = topResidualCount;
            return this;
        }

        /**
         * Applies {@code kernel.*} keys from a properties file.
         */
        public Builder properties(Properties props) {
            String value = props.getProperty("kernel.tolerance");
            if (value != null) {
                tolerance = parseDouble("kernel.tolerance", value);
            }
            value = props.getProperty("kernel.dataset.id");
            if (value != null) {
                datasetId = value.trim();
            }
            value = props.getProperty("kernel.backend");
            if (value != null) {
                defaultBackend = value.trim();
            }
            value = props.getProperty("kernel.newton.max.iterations");
            if (value != null) {
                newtonMaxIterations = parseInt("kernel.newton.max.iterations", value);
            }
            value = props.getProperty("kernel.newton.tolerance");
            if (value != null) {
                newtonTolerance = parseDouble("kernel.newton.tolerance", value);
            }
            value = props.getProperty("kernel.scaling.large");
            if (value != null) {
                scalingLargeThreshold = parseDouble("kernel.scaling.large", value);
            }
            value = props.getProperty("kernel.scaling.small");
            if (value != null) {
                scalingSmallThreshold = parseDouble("kernel.scaling.small", value);
            }
            value = props.getProperty("kernel.validation.top.residuals");
            if (value != null) {
                topResidualCount = parseInt("kernel.validation.top.residuals", value);
            }
            return this;
        }

        /**
         * Applies {@code CGE_*} overrides from an environment map.
         */
        public Builder environment(Map<String, String> env) {
            String value = env.get(ENV_TOLERANCE);
            if (value != null) {
                tolerance = parseDouble(ENV_TOLERANCE, value);
            }
            value = env.get(ENV_DATASET_ID);
            if (value != null) {
                datasetId = value.trim();
            }
            value = env.get(ENV_BACKEND);
            if (value != null) {
                defaultBackend = value.trim();
            }
            value = env.get(ENV_NEWTON_MAX_ITERATIONS);
            if (value != null) {
                newtonMaxIterations = parseInt(ENV_NEWTON_MAX_ITERATIONS, value);
            }
            value = env.get(ENV_NEWTON_TOLERANCE);
            if (value != null) {
                newtonTolerance = parseDouble(ENV_NEWTON_TOLERANCE, value);
            }
            value = env.get(ENV_SCALING_LARGE);
            if (value != null) {
                scalingLargeThreshold = parseDouble(ENV_SCALING_LARGE, value);
            }
            value = env.get(ENV_SCALING_SMALL);
            if (value != null) {
                scalingSmallThreshold = parseDouble(ENV_SCALING_SMALL, value);
            }
            value = env.get(ENV_TOP_RESIDUALS);
            if (value != null) {
                topResidualCount = parseInt(ENV_TOP_RESIDUALS, value);
            }
            return this;
        }

        public KernelConfig build() {
            return new KernelConfig(this);
        }

        private static double parseDouble(String key, String value) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid number for " + key + ": " + value, e);
            }
        }

        private static int parseInt(String key, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid integer for " + key + ": " + value, e);
            }
        }
    }
}
