package org.grammardfa.acceptance;

/**
 * 测试串被拒绝的原因。
 */
public enum RejectionReason {

    NONE,
    // 输入无法切分为已知终结符
    UNKNOWN_SYMBOL,
    // 当前状态在下一个符号上没有迁移
    NO_TRANSITION,
    // 输入读完但停在非接受状态
    NOT_ACCEPTING
}
