package com.example.llmexplorer.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 任务对设备的要求；字段为空表示不限制
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceSelector {

    private String serial;
    private DeviceType type;
    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    public boolean matches(DeviceHandle device) {
        if (serial != null && !serial.equals(device.getSerial())) {
            return false;
        }
        if (type != null && type != device.getType()) {
            return false;
        }
        return tags == null || tags.isEmpty()
                || (device.getTags() != null && device.getTags().containsAll(tags));
    }

    public static DeviceSelector any() {
        return new DeviceSelector();
    }
}
