package com.example.llmexplorer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 设备池中的一台设备
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceHandle {

    private String serial;
    private DeviceType type;
    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();
}
