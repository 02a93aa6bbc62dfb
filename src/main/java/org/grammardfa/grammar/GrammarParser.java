package org.grammardfa.grammar;

import org.apache.commons.lang3.StringUtils;
import org.grammardfa.automata.base.Alphabet;
import org.grammardfa.core.Symbol;
import org.grammardfa.exceptions.EmptyAlphabetException;
import org.grammardfa.exceptions.GrammarException;
import org.grammardfa.exceptions.GrammarSyntaxException;
import org.grammardfa.pipeline.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 将按行书写的 BNF 文法文本解析为 {@link Grammar}。
 * <p>
 * 每行（或以单个冒号分隔的每一段）一条产生式，左部与右部之间用 {@code ->}、{@code →} 或 {@code ::=} 分隔，
 * 候选式之间用 {@code |} 分隔。空行和以 {@code #} 开头的行被忽略。
 * 右部符号的书写方式由 {@link SymbolNotation} 决定。
 * <p>
 * 解析器本身无状态，可以被多个线程共享。
 */
public final class GrammarParser {

    private static final Logger logger = LoggerFactory.getLogger(GrammarParser.class);

    public static final List<String> DERIVATION_MARKERS = List.of("::=", "->", "→");
    public static final String ALTERNATION_MARKER = "|";
    public static final String COMMENT_PREFIX = "#";
    public static final Set<String> EPSILON_SPELLINGS = Set.of("ε", "epsilon");

    // 单独的冒号分隔产生式，但 "::=" 中的冒号不算
    private static final Pattern PRODUCTION_SEPARATOR = Pattern.compile("(?<!:):(?![:=])");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

    private static final Pattern NONTERMINAL_TOKEN = Pattern.compile("[A-Z][A-Za-z0-9_']*");
    private static final Pattern BRACKETED_NONTERMINAL_TOKEN = Pattern.compile("<([A-Za-z][A-Za-z0-9_\\-]*)>");
    private static final Pattern TERMINAL_TOKEN = Pattern.compile("[a-z0-9][a-z0-9_]*");
    private static final Pattern QUOTED_TERMINAL_TOKEN = Pattern.compile("'([^'\\s]+)'|\"([^\"\\s]+)\"");

    private final SymbolNotation notation;

    public GrammarParser() {
        this(SymbolNotation.CHARACTER);
    }

    public GrammarParser(SymbolNotation notation) {
        this.notation = Objects.requireNonNull(notation, "Notation cannot be null.");
    }

    public SymbolNotation getNotation() {
        return notation;
    }

    /**
     * 解析文法文本，开始符号取第一条产生式的左部。
     */
    public Grammar parse(String text) {
        return parse(text, null);
    }

    /**
     * 解析文法文本。
     *
     * @param text      原始文法文本。
     * @param startName 显式指定的开始非终结符名称；为 null 或空白时取第一条产生式的左部。
     * @return 解析得到的不可变文法。
     * @throws GrammarSyntaxException 产生式格式错误或开始符号未定义。
     * @throws EmptyAlphabetException 文法中没有终结符。
     */
    public Grammar parse(String text, String startName) {
        Objects.requireNonNull(text, "Grammar text cannot be null.");
        logger.debug("开始解析文法（{} 记法）：\n{}", notation, text);

        Set<ProductionRule> rules = new LinkedHashSet<>();
        String[] lines = LINE_BREAK.split(text, -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i];
            if (StringUtils.isBlank(line) || line.trim().startsWith(COMMENT_PREFIX)) {
                continue;
            }
            for (String segment : PRODUCTION_SEPARATOR.split(line)) {
                if (StringUtils.isBlank(segment)) {
                    continue;
                }
                for (ProductionRule rule : parseProduction(segment, lineNumber)) {
                    if (!rules.add(rule)) {
                        logger.debug("第 {} 行的产生式 {} 重复，已忽略", lineNumber, rule);
                    }
                }
            }
        }

        if (rules.isEmpty()) {
            throw new GrammarSyntaxException(GrammarException.UNKNOWN_LINE, "", "grammar contains no productions");
        }

        List<ProductionRule> ordered = List.copyOf(rules);
        Set<Symbol> nonterminals = new LinkedHashSet<>();
        Set<Symbol> terminals = new TreeSet<>();
        for (ProductionRule rule : ordered) {
            nonterminals.add(rule.getHead());
            for (Symbol symbol : rule.getBody()) {
                if (symbol.isNonterminal()) {
                    nonterminals.add(symbol);
                } else if (symbol.isTerminal()) {
                    terminals.add(symbol);
                }
            }
        }

        Set<Symbol> defined = new LinkedHashSet<>();
        ordered.forEach(rule -> defined.add(rule.getHead()));
        for (Symbol nonterminal : nonterminals) {
            if (!defined.contains(nonterminal)) {
                logger.warn("非终结符 {} 被引用但没有任何产生式，它只会成为死状态", nonterminal);
            }
        }

        Symbol start = resolveStart(startName, ordered, defined);

        if (terminals.isEmpty()) {
            logger.warn("文法中没有任何终结符");
            throw new EmptyAlphabetException(PipelineStage.GRAMMAR_PARSING, text.trim());
        }

        Grammar grammar = new Grammar(ordered, Alphabet.of(terminals), nonterminals, start, notation);
        logger.info("文法解析完成：{} 条产生式，{} 个非终结符，{} 个终结符，开始符号 {}",
                ordered.size(), nonterminals.size(), terminals.size(), start);
        return grammar;
    }

    /**
     * 解析单条产生式（可含多个候选式），不做全局检查。
     *
     * @param production 形如 {@code A -> aB | b} 的文本。
     * @param lineNumber 用于错误报告的行号。
     * @return 每个候选式对应一条产生式。
     */
    public List<ProductionRule> parseProduction(String production, int lineNumber) {
        String segment = production.trim();
        int markerIndex = -1;
        String marker = null;
        for (String candidate : DERIVATION_MARKERS) {
            int index = segment.indexOf(candidate);
            if (index >= 0 && (markerIndex < 0 || index < markerIndex)) {
                markerIndex = index;
                marker = candidate;
            }
        }
        if (marker == null) {
            throw new GrammarSyntaxException(lineNumber, segment, "missing derivation marker ('->' or '::=')");
        }

        String headText = segment.substring(0, markerIndex).trim();
        String bodyText = segment.substring(markerIndex + marker.length());
        Symbol head = parseHead(headText, lineNumber, segment);
        if (StringUtils.isBlank(bodyText)) {
            throw new GrammarSyntaxException(lineNumber, segment, "missing rule body; write ε for the empty string");
        }

        List<ProductionRule> result = new ArrayList<>();
        for (String alternative : StringUtils.splitPreserveAllTokens(bodyText, ALTERNATION_MARKER)) {
            String trimmed = alternative.trim();
            if (trimmed.isEmpty()) {
                throw new GrammarSyntaxException(lineNumber, segment,
                        "alternative of " + head + " has no symbols; write ε for the empty string");
            }
            List<Symbol> body = normalizeEpsilon(parseBody(trimmed, lineNumber), lineNumber);
            result.add(new ProductionRule(head, body, lineNumber));
        }
        return result;
    }

    private Symbol parseHead(String headText, int lineNumber, String segment) {
        if (headText.isEmpty()) {
            throw new GrammarSyntaxException(lineNumber, segment, "missing rule head");
        }
        Symbol head = switch (notation) {
            case CHARACTER -> headText.length() == 1 && isNonterminalChar(headText.charAt(0))
                    ? Symbol.nonterminal(headText)
                    : null;
            case TOKEN -> parseNonterminalToken(headText);
        };
        if (head == null) {
            throw new GrammarSyntaxException(lineNumber, headText, "rule head must be a single nonterminal");
        }
        return head;
    }

    private List<Symbol> parseBody(String alternative, int lineNumber) {
        if (EPSILON_SPELLINGS.contains(alternative)) {
            return List.of(Symbol.EPSILON);
        }
        return switch (notation) {
            case CHARACTER -> parseCharacterBody(alternative, lineNumber);
            case TOKEN -> parseTokenBody(alternative, lineNumber);
        };
    }

    private List<Symbol> parseCharacterBody(String alternative, int lineNumber) {
        List<Symbol> body = new ArrayList<>();
        for (int i = 0; i < alternative.length(); i++) {
            char c = alternative.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            if (c == 'ε') {
                body.add(Symbol.EPSILON);
            } else if (isTerminalChar(c)) {
                body.add(Symbol.terminal(String.valueOf(c)));
            } else if (isNonterminalChar(c)) {
                body.add(Symbol.nonterminal(String.valueOf(c)));
            } else {
                throw new GrammarSyntaxException(lineNumber, String.valueOf(c),
                        "character is neither a terminal (ASCII lowercase letter or digit) nor a nonterminal (ASCII uppercase letter)");
            }
        }
        return body;
    }

    // 字符记法只接受 ASCII：小写字母和数字是终结符，大写字母是非终结符
    private static boolean isTerminalChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }

    private static boolean isNonterminalChar(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private List<Symbol> parseTokenBody(String alternative, int lineNumber) {
        List<Symbol> body = new ArrayList<>();
        for (String token : StringUtils.split(alternative)) {
            if (EPSILON_SPELLINGS.contains(token)) {
                body.add(Symbol.EPSILON);
                continue;
            }
            Symbol nonterminal = parseNonterminalToken(token);
            if (nonterminal != null) {
                body.add(nonterminal);
                continue;
            }
            Symbol terminal = parseTerminalToken(token);
            if (terminal == null) {
                throw new GrammarSyntaxException(lineNumber, token, "unrecognized symbol token");
            }
            body.add(terminal);
        }
        return body;
    }

    private static Symbol parseNonterminalToken(String token) {
        if (NONTERMINAL_TOKEN.matcher(token).matches()) {
            return Symbol.nonterminal(token);
        }
        Matcher bracketed = BRACKETED_NONTERMINAL_TOKEN.matcher(token);
        if (bracketed.matches()) {
            return Symbol.nonterminal(bracketed.group(1));
        }
        return null;
    }

    private static Symbol parseTerminalToken(String token) {
        if (TERMINAL_TOKEN.matcher(token).matches()) {
            return Symbol.terminal(token);
        }
        Matcher quoted = QUOTED_TERMINAL_TOKEN.matcher(token);
        if (quoted.matches()) {
            return Symbol.terminal(quoted.group(1) != null ? quoted.group(1) : quoted.group(2));
        }
        return null;
    }

    /**
     * 单独的 ε 变为空右部；开头的 ε 被丢弃。其余位置的 ε 原样保留，由 NFA 构造阶段拒绝。
     */
    private static List<Symbol> normalizeEpsilon(List<Symbol> body, int lineNumber) {
        int leading = 0;
        while (leading < body.size() && body.get(leading).isEpsilon()) {
            leading++;
        }
        if (leading > 0 && leading < body.size()) {
            logger.debug("第 {} 行：丢弃右部开头的 {} 个 ε", lineNumber, leading);
        }
        return List.copyOf(body.subList(leading, body.size()));
    }

    private static Symbol resolveStart(String startName, List<ProductionRule> rules, Set<Symbol> defined) {
        if (StringUtils.isBlank(startName)) {
            return rules.get(0).getHead();
        }
        String name = startName.trim();
        Matcher bracketed = BRACKETED_NONTERMINAL_TOKEN.matcher(name);
        if (bracketed.matches()) {
            name = bracketed.group(1);
        }
        for (Symbol candidate : defined) {
            if (candidate.getText().equals(name)) {
                return candidate;
            }
        }
        throw new GrammarSyntaxException(GrammarException.UNKNOWN_LINE, startName,
                "start nonterminal has no productions");
    }
}
