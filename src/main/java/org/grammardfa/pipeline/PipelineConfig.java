package org.grammardfa.pipeline;

import lombok.Getter;
import org.grammardfa.acceptance.TokenizationMode;
import org.grammardfa.automata.minimization.MinimizationStrategy;
import org.grammardfa.grammar.SymbolNotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * 流水线配置。此类是不可变的，通过 {@link Builder} 或属性文件创建。
 * <p>
 * 支持的属性：
 * <ul>
 *     <li>{@code grammar.notation}：CHARACTER | TOKEN</li>
 *     <li>{@code acceptor.tokenization}：AUTO | CHARACTER | LONGEST_MATCH，AUTO 表示由文法记法决定</li>
 *     <li>{@code minimizer.strategy}：PARTITION_REFINEMENT | TABLE_FILLING</li>
 * </ul>
 */
@Getter
public final class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String DEFAULT_RESOURCE = "/grammardfa.properties";

    public static final String NOTATION_KEY = "grammar.notation";
    public static final String TOKENIZATION_KEY = "acceptor.tokenization";
    public static final String MINIMIZER_KEY = "minimizer.strategy";
    public static final String AUTO = "AUTO";

    public static final PipelineConfig DEFAULTS = builder().build();

    private final SymbolNotation notation;
    // null 表示由文法记法决定
    private final TokenizationMode tokenizationOverride;
    private final MinimizationStrategy minimizationStrategy;

    private PipelineConfig(Builder builder) {
        this.notation = Objects.requireNonNull(builder.notation, "Notation cannot be null.");
        this.tokenizationOverride = builder.tokenizationOverride;
        this.minimizationStrategy = Objects.requireNonNull(builder.minimizationStrategy,
                "Minimization strategy cannot be null.");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 对给定的文法记法实际采用的切分方式。
     */
    public TokenizationMode tokenizationFor(SymbolNotation grammarNotation) {
        return tokenizationOverride != null ? tokenizationOverride : TokenizationMode.forNotation(grammarNotation);
    }

    /**
     * 从类路径上的 {@value #DEFAULT_RESOURCE} 加载配置，文件不存在时使用默认值。
     */
    public static PipelineConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static PipelineConfig load(String resource) {
        try (InputStream input = PipelineConfig.class.getResourceAsStream(resource)) {
            if (input == null) {
                logger.info("未找到配置文件 {}，使用默认配置", resource);
                return DEFAULTS;
            }
            Properties properties = new Properties();
            properties.load(input);
            logger.info("从 {} 加载配置", resource);
            return fromProperties(properties);
        } catch (IOException e) {
            logger.error("读取配置文件 {} 失败", resource, e);
            throw new UncheckedIOException("Cannot read configuration " + resource, e);
        }
    }

    /**
     * 由属性创建配置，缺失的键取默认值，无法识别的值抛出 {@link IllegalArgumentException}。
     */
    public static PipelineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String notation = properties.getProperty(NOTATION_KEY);
        if (notation != null) {
            builder.notation(parseEnum(SymbolNotation.class, NOTATION_KEY, notation));
        }
        String tokenization = properties.getProperty(TOKENIZATION_KEY);
        if (tokenization != null && !AUTO.equalsIgnoreCase(tokenization.trim())) {
            builder.tokenization(parseEnum(TokenizationMode.class, TOKENIZATION_KEY, tokenization));
        }
        String strategy = properties.getProperty(MINIMIZER_KEY);
        if (strategy != null) {
            builder.minimizationStrategy(parseEnum(MinimizationStrategy.class, MINIMIZER_KEY, strategy));
        }
        PipelineConfig config = builder.build();
        logger.debug("配置：{}", config);
        return config;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            logger.warn("配置项 {} 的值 '{}' 无法识别", key, value);
            throw new IllegalArgumentException("Invalid value '" + value + "' for " + key, e);
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig{notation=" + notation
                + ", tokenization=" + (tokenizationOverride == null ? AUTO : tokenizationOverride)
                + ", minimizer=" + minimizationStrategy + '}';
    }

    public static final class Builder {
        private SymbolNotation notation = SymbolNotation.CHARACTER;
        private TokenizationMode tokenizationOverride;
        private MinimizationStrategy minimizationStrategy = MinimizationStrategy.PARTITION_REFINEMENT;

        public Builder notation(SymbolNotation notation) {
            this.notation = notation;
            return this;
        }

        /**
         * @param mode 固定的切分方式；null 表示由文法记法决定。
         */
        public Builder tokenization(TokenizationMode mode) {
            this.tokenizationOverride = mode;
            return this;
        }

        public Builder minimizationStrategy(MinimizationStrategy strategy) {
            this.minimizationStrategy = strategy;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
