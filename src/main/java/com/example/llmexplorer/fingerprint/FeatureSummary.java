package com.example.llmexplorer.fingerprint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureSummary {

    @Builder.Default
    private Map<ElementRole, Integer> roleCounts = new EnumMap<>(ElementRole.class);
    private int editableCount;
    private boolean loginPage;
}
