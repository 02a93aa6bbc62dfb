package org.grammardfa.automata.minimization;

/**
 * 可选的最小化算法。两者得到相同的划分。
 */
public enum MinimizationStrategy {

    /**
     * 划分细化：从 {接受, 非接受} 开始反复分裂直到稳定。
     */
    PARTITION_REFINEMENT,

    /**
     * 填表法：逐对标记可区分的状态。
     */
    TABLE_FILLING;

    public DFAMinimizer create() {
        return switch (this) {
            case PARTITION_REFINEMENT -> new PartitionRefinementMinimizer();
            case TABLE_FILLING -> new TableFillingMinimizer();
        };
    }
}
