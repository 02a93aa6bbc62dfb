package org.grammardfa.regex;

import org.grammardfa.automata.base.Alphabet;
import org.grammardfa.automata.base.State;
import org.grammardfa.automata.models.NFA;
import org.grammardfa.core.Symbol;
import org.grammardfa.exceptions.RegexSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Thompson 构造：正则表达式 -> NFA。
 * <p>
 * 字面量为字母和数字，运算符为 {@code |}、{@code *}、{@code +}、{@code ?} 和括号；
 * 中缀形式中的连接是隐式的，后缀形式中用 {@code .} 显式表示。
 */
public final class RegexToNFA {

    private static final Logger logger = LoggerFactory.getLogger(RegexToNFA.class);

    static final char CONCAT = '.';
    static final char UNION = '|';
    static final char STAR = '*';
    static final char PLUS = '+';
    static final char OPTIONAL = '?';

    private static final Map<Character, Integer> PRECEDENCE = Map.of(
            UNION, 1,
            CONCAT, 2);

    /**
     * 由中缀正则表达式构造 NFA，如 {@code a(b|c)*}。
     */
    public NFA fromInfix(String regex) {
        return fromPostfix(toPostfix(regex));
    }

    /**
     * 把中缀表达式转换为带显式连接符的后缀表达式，如 {@code ab|*} 形式。
     */
    public String toPostfix(String regex) {
        Objects.requireNonNull(regex, "Regex cannot be null.");
        String compact = regex.replaceAll("\\s+", "");
        if (compact.isEmpty()) {
            throw new RegexSyntaxException(regex, "empty expression");
        }

        StringBuilder output = new StringBuilder();
        Deque<Character> operators = new ArrayDeque<>();
        char previous = 0;
        for (int i = 0; i < compact.length(); i++) {
            char c = compact.charAt(i);
            if (c != '(' && c != ')' && c != UNION && !isPostfixUnary(c) && !isLiteral(c)) {
                throw new RegexSyntaxException(regex, "unexpected character '" + c + "'");
            }
            if ((isLiteral(c) || c == '(') && endsOperand(previous)) {
                pushOperator(CONCAT, operators, output);
            }
            if (isLiteral(c)) {
                output.append(c);
            } else if (isPostfixUnary(c)) {
                if (!endsOperand(previous)) {
                    throw new RegexSyntaxException(regex, "'" + c + "' has no operand");
                }
                output.append(c);
            } else if (c == '(') {
                operators.push(c);
            } else if (c == ')') {
                if (previous == '(') {
                    throw new RegexSyntaxException(regex, "empty group");
                }
                while (!operators.isEmpty() && operators.peek() != '(') {
                    output.append(operators.pop());
                }
                if (operators.isEmpty()) {
                    throw new RegexSyntaxException(regex, "unbalanced ')'");
                }
                operators.pop();
            } else {
                if (!endsOperand(previous)) {
                    throw new RegexSyntaxException(regex, "'|' has no left operand");
                }
                pushOperator(c, operators, output);
            }
            previous = c;
        }
        if (!endsOperand(previous)) {
            throw new RegexSyntaxException(regex, "expression ends with an operator");
        }
        while (!operators.isEmpty()) {
            char op = operators.pop();
            if (op == '(') {
                throw new RegexSyntaxException(regex, "unbalanced '('");
            }
            output.append(op);
        }
        logger.debug("正则 {} 的后缀形式为 {}", regex, output);
        return output.toString();
    }

    private static void pushOperator(char op, Deque<Character> operators, StringBuilder output) {
        while (!operators.isEmpty() && operators.peek() != '('
                && PRECEDENCE.get(operators.peek()) >= PRECEDENCE.get(op)) {
            output.append(operators.pop());
        }
        operators.push(op);
    }

    private static boolean endsOperand(char c) {
        return isLiteral(c) || c == ')' || isPostfixUnary(c);
    }

    private static boolean isLiteral(char c) {
        return c < 128 && Character.isLetterOrDigit(c);
    }

    private static boolean isPostfixUnary(char c) {
        return c == STAR || c == PLUS || c == OPTIONAL;
    }

    /**
     * 由后缀表达式构造 NFA。
     */
    public NFA fromPostfix(String postfix) {
        Objects.requireNonNull(postfix, "Postfix expression cannot be null.");
        ThompsonGraph graph = new ThompsonGraph();
        Deque<Fragment> stack = new ArrayDeque<>();

        for (int i = 0; i < postfix.length(); i++) {
            char c = postfix.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            if (isLiteral(c)) {
                int start = graph.newNode();
                int accept = graph.newNode();
                graph.edge(start, Symbol.terminal(String.valueOf(c)), accept);
                stack.push(new Fragment(start, accept));
                continue;
            }
            switch (c) {
                case CONCAT -> {
                    Fragment right = pop(stack, postfix, c);
                    Fragment left = pop(stack, postfix, c);
                    graph.epsilon(left.accept(), right.start());
                    stack.push(new Fragment(left.start(), right.accept()));
                }
                case UNION -> {
                    Fragment right = pop(stack, postfix, c);
                    Fragment left = pop(stack, postfix, c);
                    int start = graph.newNode();
                    int accept = graph.newNode();
                    graph.epsilon(start, left.start());
                    graph.epsilon(start, right.start());
                    graph.epsilon(left.accept(), accept);
                    graph.epsilon(right.accept(), accept);
                    stack.push(new Fragment(start, accept));
                }
                case STAR, PLUS, OPTIONAL -> {
                    Fragment inner = pop(stack, postfix, c);
                    int start = graph.newNode();
                    int accept = graph.newNode();
                    graph.epsilon(start, inner.start());
                    graph.epsilon(inner.accept(), accept);
                    if (c != PLUS) {
                        graph.epsilon(start, accept);
                    }
                    if (c != OPTIONAL) {
                        graph.epsilon(inner.accept(), inner.start());
                    }
                    stack.push(new Fragment(start, accept));
                }
                default -> throw new RegexSyntaxException(postfix, "unexpected character '" + c + "'");
            }
        }

        if (stack.size() != 1) {
            throw new RegexSyntaxException(postfix,
                    stack.isEmpty() ? "empty expression" : "missing operator, " + stack.size() + " operands left");
        }
        NFA nfa = graph.toNFA(stack.pop());
        logger.info("Thompson 构造完成：{} 个状态，{} 条迁移", nfa.size(), nfa.getTransitions().size());
        return nfa;
    }

    private static Fragment pop(Deque<Fragment> stack, String postfix, char op) {
        if (stack.isEmpty()) {
            throw new RegexSyntaxException(postfix, "operator '" + op + "' is missing an operand");
        }
        return stack.pop();
    }

    /**
     * 一个子表达式的 NFA 片段：唯一的入口和唯一的出口。
     */
    private record Fragment(int start, int accept) {
    }

    /**
     * 构造过程中的中间图。接受状态要到最后才确定，所以先记录边，最后一次性生成 NFA。
     */
    private static final class ThompsonGraph {

        private final List<Edge> edges = new ArrayList<>();
        private int nodeCount;

        int newNode() {
            return nodeCount++;
        }

        void edge(int from, Symbol symbol, int to) {
            edges.add(new Edge(from, symbol, to));
        }

        void epsilon(int from, int to) {
            edges.add(new Edge(from, Symbol.EPSILON, to));
        }

        NFA toNFA(Fragment whole) {
            TreeSet<Symbol> terminals = new TreeSet<>();
            for (Edge edge : edges) {
                if (edge.symbol().isTerminal()) {
                    terminals.add(edge.symbol());
                }
            }
            NFA.Builder builder = new NFA.Builder(Alphabet.of(terminals));
            List<State> states = new ArrayList<>();
            for (int i = 0; i < nodeCount; i++) {
                states.add(builder.addState("s" + i, i == whole.accept()));
            }
            for (Edge edge : edges) {
                builder.addTransition(states.get(edge.from()), edge.symbol(), states.get(edge.to()));
            }
            builder.setStartState(states.get(whole.start()));
            return builder.build();
        }

        private record Edge(int from, Symbol symbol, int to) {
        }
    }
}
