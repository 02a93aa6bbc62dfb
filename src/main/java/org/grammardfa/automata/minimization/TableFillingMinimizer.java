package org.grammardfa.automata.minimization;

import org.grammardfa.automata.base.StateSubset;
import org.grammardfa.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 填表法求等价类。
 * <p>
 * 先标记一个接受一个不接受的状态对，然后反复标记在某个符号上迁移到已标记对的状态对，
 * 直到表不再变化。未被标记的状态对彼此等价。
 */
public final class TableFillingMinimizer extends AbstractDFAMinimizer {

    private static final Logger logger = LoggerFactory.getLogger(TableFillingMinimizer.class);

    @Override
    List<StateSubset> partition(SinkCompletedDFA view) {
        List<Integer> ids = view.getStateIds();
        int n = ids.size();
        List<Symbol> alphabet = new ArrayList<>(view.getDfa().getAlphabet().getSymbols());

        // successors[i][k]：第 i 个状态在第 k 个符号上的后继在 ids 中的下标
        int[][] successors = new int[n][alphabet.size()];
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < alphabet.size(); k++) {
                successors[i][k] = ids.indexOf(view.successor(ids.get(i), alphabet.get(k)));
            }
        }

        boolean[][] distinguishable = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < i; j++) {
                if (view.isAccepting(ids.get(i)) != view.isAccepting(ids.get(j))) {
                    mark(distinguishable, i, j);
                }
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < i; j++) {
                    if (distinguishable[i][j]) {
                        continue;
                    }
                    for (int k = 0; k < alphabet.size(); k++) {
                        if (distinguishable[successors[i][k]][successors[j][k]]) {
                            mark(distinguishable, i, j);
                            changed = true;
                            break;
                        }
                    }
                }
            }
        }

        List<StateSubset> blocks = new ArrayList<>();
        boolean[] assigned = new boolean[n];
        for (int i = 0; i < n; i++) {
            if (assigned[i]) {
                continue;
            }
            List<Integer> block = new ArrayList<>();
            for (int j = i; j < n; j++) {
                if (!assigned[j] && (i == j || !distinguishable[i][j])) {
                    block.add(ids.get(j));
                    assigned[j] = true;
                }
            }
            blocks.add(StateSubset.of(block));
        }
        logger.debug("填表法得到 {} 个等价类：{}", blocks.size(), blocks);
        return blocks;
    }

    private static void mark(boolean[][] table, int i, int j) {
        table[i][j] = true;
        table[j][i] = true;
    }
}
