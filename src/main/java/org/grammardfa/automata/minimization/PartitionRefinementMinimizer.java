package org.grammardfa.automata.minimization;

import org.grammardfa.automata.base.StateSubset;
import org.grammardfa.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Myhill-Nerode 划分细化。
 * <p>
 * 初始划分为 {接受状态} 与 {非接受状态}（死状态属于后者），空块丢弃。
 * 之后对每个块、每个符号 t，把 t 迁移落入不同当前块的状态分开，直到没有块再分裂。
 */
public final class PartitionRefinementMinimizer extends AbstractDFAMinimizer {

    private static final Logger logger = LoggerFactory.getLogger(PartitionRefinementMinimizer.class);

    @Override
    List<StateSubset> partition(SinkCompletedDFA view) {
        List<Integer> accepting = new ArrayList<>();
        List<Integer> rejecting = new ArrayList<>();
        for (Integer id : view.getStateIds()) {
            (view.isAccepting(id) ? accepting : rejecting).add(id);
        }

        List<List<Integer>> blocks = new ArrayList<>();
        if (!accepting.isEmpty()) {
            blocks.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            blocks.add(rejecting);
        }

        boolean changed;
        int rounds = 0;
        do {
            changed = false;
            rounds++;
            for (Symbol symbol : view.getDfa().getAlphabet()) {
                Map<Integer, Integer> blockIndex = indexOf(blocks);
                List<List<Integer>> refined = new ArrayList<>();
                for (List<Integer> block : blocks) {
                    Map<Integer, List<Integer>> bySuccessorBlock = new LinkedHashMap<>();
                    for (Integer id : block) {
                        int successorBlock = blockIndex.get(view.successor(id, symbol));
                        bySuccessorBlock.computeIfAbsent(successorBlock, k -> new ArrayList<>()).add(id);
                    }
                    if (bySuccessorBlock.size() > 1) {
                        changed = true;
                        logger.debug("块 {} 在符号 {} 上分裂为 {}", block, symbol, bySuccessorBlock.values());
                    }
                    refined.addAll(bySuccessorBlock.values());
                }
                blocks = refined;
            }
        } while (changed);

        logger.debug("划分细化经过 {} 轮达到不动点，共 {} 个块", rounds, blocks.size());
        return blocks.stream().map(StateSubset::of).toList();
    }

    private static Map<Integer, Integer> indexOf(List<List<Integer>> blocks) {
        Map<Integer, Integer> index = new HashMap<>();
        for (int i = 0; i < blocks.size(); i++) {
            for (Integer id : blocks.get(i)) {
                index.put(id, i);
            }
        }
        return index;
    }
}
