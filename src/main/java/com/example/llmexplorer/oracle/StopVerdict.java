package com.example.llmexplorer.oracle;

import java.util.Locale;

public enum StopVerdict {
    GOAL_REACHED,
    BUDGET_EXHAUSTED,
    ORACLE_DONE;

    /**
     * "goal_reached" / "budget_exhausted" / "done"，不认识返回 null
     */
    public static StopVerdict fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("goal_reached".equals(normalized)) {
            return GOAL_REACHED;
        }
        if ("budget_exhausted".equals(normalized)) {
            return BUDGET_EXHAUSTED;
        }
        if ("done".equals(normalized) || "oracle_done".equals(normalized)) {
            return ORACLE_DONE;
        }
        return null;
    }
}
