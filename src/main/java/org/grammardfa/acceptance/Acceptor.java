package org.grammardfa.acceptance;

import lombok.Getter;
import org.grammardfa.automata.base.Alphabet;
import org.grammardfa.automata.base.State;
import org.grammardfa.automata.models.DFA;
import org.grammardfa.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 在（最小化的）DFA 上判定测试串是否被接受。
 * <p>
 * 先按 {@link TokenizationMode} 把输入切分为终结符，再从开始状态逐个跟随迁移；
 * 某个 (状态, 符号) 没有迁移时立即拒绝。切分失败同样是拒绝，不会抛出异常。
 */
@Getter
public final class Acceptor {

    private static final Logger logger = LoggerFactory.getLogger(Acceptor.class);

    private final DFA dfa;
    private final TokenizationMode mode;

    public Acceptor(DFA dfa, TokenizationMode mode) {
        this.dfa = Objects.requireNonNull(dfa, "DFA cannot be null.");
        this.mode = Objects.requireNonNull(mode, "Tokenization mode cannot be null.");
    }

    public boolean accepts(String input) {
        return run(input).isAccepted();
    }

    public AcceptanceResult run(String input) {
        Objects.requireNonNull(input, "Input cannot be null.");
        List<Integer> visited = new ArrayList<>();
        List<Symbol> consumed = new ArrayList<>();
        State current = dfa.getStartState();
        visited.add(current.getId());

        Tokenization tokens = tokenize(input);
        if (!tokens.complete()) {
            logger.debug("输入 '{}' 在位置 {} 无法切分为已知终结符", input, tokens.stoppedAt());
            return new AcceptanceResult(input, RejectionReason.UNKNOWN_SYMBOL, visited, consumed, tokens.stoppedAt());
        }

        for (int i = 0; i < tokens.symbols().size(); i++) {
            Symbol symbol = tokens.symbols().get(i);
            Optional<State> next = dfa.next(current, symbol);
            if (next.isEmpty()) {
                logger.debug("状态 {} 在符号 {} 上没有迁移，拒绝 '{}'", current, symbol, input);
                return new AcceptanceResult(input, RejectionReason.NO_TRANSITION, visited, consumed,
                        tokens.offsets().get(i));
            }
            current = next.get();
            visited.add(current.getId());
            consumed.add(symbol);
        }

        RejectionReason reason = current.isAccepting() ? RejectionReason.NONE : RejectionReason.NOT_ACCEPTING;
        AcceptanceResult result = new AcceptanceResult(input, reason, visited, consumed, input.length());
        logger.debug("{}", result);
        return result;
    }

    /**
     * 把输入切分为终结符序列。
     * @return 切分结果；无法完整切分时为空。
     */
    public Optional<List<Symbol>> toSymbols(String input) {
        Tokenization tokens = tokenize(input);
        return tokens.complete() ? Optional.of(tokens.symbols()) : Optional.empty();
    }

    private Tokenization tokenize(String input) {
        Alphabet alphabet = dfa.getAlphabet();
        List<Symbol> symbols = new ArrayList<>();
        List<Integer> offsets = new ArrayList<>();
        int offset = 0;
        while (offset < input.length()) {
            Symbol symbol;
            if (mode == TokenizationMode.CHARACTER) {
                int end = input.offsetByCodePoints(offset, 1);
                symbol = alphabet.getSymbolByText(input.substring(offset, end));
            } else {
                if (Character.isWhitespace(input.charAt(offset))) {
                    offset++;
                    continue;
                }
                symbol = alphabet.longestMatch(input, offset).orElse(null);
            }
            if (symbol == null) {
                return new Tokenization(symbols, offsets, false, offset);
            }
            symbols.add(symbol);
            offsets.add(offset);
            offset += symbol.length();
        }
        return new Tokenization(symbols, offsets, true, offset);
    }

    private record Tokenization(List<Symbol> symbols, List<Integer> offsets, boolean complete, int stoppedAt) {
    }
}
