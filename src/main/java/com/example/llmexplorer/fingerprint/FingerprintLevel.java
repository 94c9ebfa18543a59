package com.example.llmexplorer.fingerprint;

/**
 * 指纹粒度：越往下越粗，合并的界面越多
 */
public enum FingerprintLevel {
    /** 保留文本与描述 */
    TEXT,
    /** 忽略文本，保留 class / resource-id / 交互标志 */
    STRUCTURE,
    /** 只看 class 树 */
    LAYOUT,
    /** 只看 Activity 名 */
    SCREEN
}
