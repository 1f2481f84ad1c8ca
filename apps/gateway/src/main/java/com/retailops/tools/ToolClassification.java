package com.retailops.tools;

public enum ToolClassification {
    /** 无副作用，直接执行 */
    READ,
    /** 改动后端状态，必须 preview -> confirm */
    WRITE
}
