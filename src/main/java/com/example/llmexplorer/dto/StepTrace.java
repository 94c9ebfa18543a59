package com.example.llmexplorer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单步探索追踪记录
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepTrace {

    /**
     * 步号（从 1 开始，与边的 step 一致）
     */
    private Integer step;

    /**
     * 起始界面
     */
    private String fromScreen;

    /**
     * 目标界面
     */
    private String toScreen;

    /**
     * 动作描述
     */
    private String action;

    /**
     * 决策来源（ORACLE / FALLBACK / NO_ELEMENTS / LOOP_ESCAPE）
     */
    private String decisionSource;

    /**
     * 边结果（SUCCESS / FAILURE / CRASH）
     */
    private String outcome;

    /**
     * 是否到达了新界面
     */
    private Boolean newScreen;

    /**
     * 本步耗时（毫秒）
     */
    private Long durationMs;
}
