package org.grammardfa.automata.minimization;

import org.grammardfa.automata.base.State;
import org.grammardfa.automata.base.StateSubset;
import org.grammardfa.automata.models.AutomatonKind;
import org.grammardfa.automata.models.DFA;
import org.grammardfa.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 最小化的公共骨架：剪除不可达状态、由子类计算划分、再把划分组装成最小 DFA。
 * <p>
 * 划分中包含合成死状态的块（死块）不会出现在结果中，指向它的迁移被省略；
 * 其余块按成员 ID 序列排序后依次编号，因此同样的输入总是得到同样的结果。
 */
abstract class AbstractDFAMinimizer implements DFAMinimizer {

    private static final Logger logger = LoggerFactory.getLogger(AbstractDFAMinimizer.class);

    @Override
    public final DFA minimize(DFA dfa) {
        Objects.requireNonNull(dfa, "DFA cannot be null.");
        SinkCompletedDFA view = new SinkCompletedDFA(dfa);
        int pruned = dfa.size() - view.reachableCount();
        if (pruned > 0) {
            logger.info("剪除 {} 个不可达状态", pruned);
        }

        List<StateSubset> partition = partition(view);
        DFA minimized = assemble(view, partition);
        logger.info("{} 最小化完成：{} 个状态 -> {} 个状态",
                getClass().getSimpleName(), dfa.size(), minimized.size());
        return minimized;
    }

    /**
     * 计算可达状态与死状态上的 Myhill-Nerode 等价划分。
     * @param view 完全化视图。
     * @return 覆盖 {@link SinkCompletedDFA#getStateIds()} 的不相交块。
     */
    abstract List<StateSubset> partition(SinkCompletedDFA view);

    private DFA assemble(SinkCompletedDFA view, List<StateSubset> partition) {
        DFA dfa = view.getDfa();
        Map<Integer, StateSubset> blockOf = new HashMap<>();
        for (StateSubset block : partition) {
            for (Integer id : block) {
                if (blockOf.put(id, block) != null) {
                    throw new IllegalStateException("State " + id + " appears in more than one block");
                }
            }
        }
        if (blockOf.size() != view.getStateIds().size()) {
            throw new IllegalStateException("Partition does not cover every reachable state");
        }

        StateSubset deadBlock = blockOf.get(SinkCompletedDFA.SINK);
        int startId = dfa.getStartState().getId();
        DFA.Builder builder = new DFA.Builder(AutomatonKind.MINIMIZED_DFA, dfa.getAlphabet());

        if (deadBlock.contains(startId)) {
            // 语言为空：只剩一个不接受的开始状态
            logger.debug("开始状态与死状态等价，结果为空语言自动机");
            State only = builder.addState(render(deadBlock), false);
            builder.setStartState(only);
            return builder.build();
        }

        List<StateSubset> live = partition.stream()
                .filter(block -> !block.equals(deadBlock))
                .sorted()
                .toList();

        Map<StateSubset, State> stateOfBlock = new HashMap<>();
        for (StateSubset block : live) {
            boolean accepting = view.isAccepting(block.first());
            for (Integer member : block) {
                if (view.isAccepting(member) != accepting) {
                    throw new IllegalStateException("Block " + block + " mixes accepting and non-accepting states");
                }
            }
            stateOfBlock.put(block, builder.addState(render(block), accepting));
        }

        for (StateSubset block : live) {
            int representative = block.first();
            for (Symbol symbol : dfa.getAlphabet()) {
                StateSubset targetBlock = blockOf.get(view.successor(representative, symbol));
                for (Integer member : block) {
                    if (!blockOf.get(view.successor(member, symbol)).equals(targetBlock)) {
                        throw new IllegalStateException("Partition is not stable: block " + block
                                + " disagrees on symbol " + symbol);
                    }
                }
                if (!targetBlock.equals(deadBlock)) {
                    builder.addTransition(stateOfBlock.get(block), symbol, stateOfBlock.get(targetBlock));
                }
            }
        }

        builder.setStartState(stateOfBlock.get(blockOf.get(startId)));
        return builder.build();
    }

    /**
     * 块的显示标签，形如 {0,3}，死状态不显示。
     */
    private static String render(StateSubset block) {
        List<Integer> members = new ArrayList<>();
        for (Integer id : block) {
            if (id != SinkCompletedDFA.SINK) {
                members.add(id);
            }
        }
        return members.stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}"));
    }
}
