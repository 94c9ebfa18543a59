package com.example.llmexplorer.scheduler;

import com.example.llmexplorer.dto.DeviceHandle;
import com.example.llmexplorer.dto.JobDescriptor;
import com.example.llmexplorer.executor.DeviceDriver;

/**
 * 为一次会话连接设备，由接入方提供实现
 */
@FunctionalInterface
public interface DeviceDriverFactory {

    DeviceDriver connect(DeviceHandle device, JobDescriptor job);
}
