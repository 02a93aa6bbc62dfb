package org.grammardfa.grammar;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 逐条追加产生式来组装文法文本。每条产生式在追加时即做格式校验，
 * 最终文本以冒号分隔，可直接交给 {@link GrammarParser}。
 */
public final class GrammarBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GrammarBuilder.class);

    public static final String PRODUCTION_SEPARATOR = ": ";

    private final GrammarParser parser;
    private final List<String> productions = new ArrayList<>();

    public GrammarBuilder(GrammarParser parser) {
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null.");
    }

    /**
     * 从已有的文法文本开始，已有文本不做校验。
     */
    public GrammarBuilder(GrammarParser parser, String existingText) {
        this(parser);
        if (StringUtils.isNotBlank(existingText)) {
            productions.add(existingText.trim());
        }
    }

    /**
     * 追加一条产生式。
     * @param production 形如 {@code A -> aA | b} 的文本。
     * @return this
     * @throws org.grammardfa.exceptions.GrammarSyntaxException 产生式格式错误。
     */
    public GrammarBuilder addProduction(String production) {
        if (StringUtils.isBlank(production)) {
            logger.debug("忽略空白产生式");
            return this;
        }
        String trimmed = production.trim();
        parser.parseProduction(trimmed, nextLineNumber());
        productions.add(trimmed);
        logger.debug("追加产生式：{}", trimmed);
        return this;
    }

    /**
     * 新产生式追加在 {@link #toText()} 的最后一行，报告错误时使用该行号。
     */
    private int nextLineNumber() {
        return productions.isEmpty() ? 1 : StringUtils.countMatches(toText(), '\n') + 1;
    }

    public List<String> getProductions() {
        return Collections.unmodifiableList(productions);
    }

    /**
     * @return 以冒号分隔的文法文本。
     */
    public String toText() {
        return String.join(PRODUCTION_SEPARATOR, productions);
    }

    public Grammar build() {
        return parser.parse(toText());
    }

    public Grammar build(String startName) {
        return parser.parse(toText(), startName);
    }
}
