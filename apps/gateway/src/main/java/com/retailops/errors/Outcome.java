package com.retailops.errors;

/**
 * What the caller can safely assume about backend state after a failure.
 */
public enum Outcome {
    /** 后端没有被改动，可放心重试 */
    NOTHING_HAPPENED,
    /** 不确定是否生效，应先查询状态再决定 */
    UNKNOWN,
    /** 请求到达后端但被业务规则拒绝 */
    REJECTED
}
