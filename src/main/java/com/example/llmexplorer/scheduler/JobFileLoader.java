package com.example.llmexplorer.scheduler;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.dto.DeviceSelector;
import com.example.llmexplorer.dto.DeviceType;
import com.example.llmexplorer.dto.GoalSpec;
import com.example.llmexplorer.dto.JobDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 任务文件加载器
 *
 * 支持三种写法：
 * 1. {"jobs": [...]}，顶层的 appId / package_name / device_type / entryActivity 作为默认值
 * 2. 直接是任务数组
 * 3. 单个任务对象
 * 不合法的任务记入 problems 后跳过，不影响其他任务
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobFileLoader {

    private final ObjectMapper objectMapper;
    private final ExplorerProperties properties;

    public JobLoadReport load(List<Path> files) {
        JobLoadReport report = new JobLoadReport();
        Set<String> seenIds = new HashSet<>();
        for (Path file : files) {
            loadFile(file, report, seenIds);
        }
        log.info("[Jobs] 从 {} 个文件加载了 {} 个任务，{} 个问题",
                files.size(), report.getJobs().size(), report.getProblems().size());
        return report;
    }

    private void loadFile(Path file, JobLoadReport report, Set<String> seenIds) {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("[Jobs] 无法读取任务文件 {}: {}", file, e.getMessage());
            report.addProblem(file + ": not a readable JSON file (" + e.getMessage() + ")");
            return;
        }
        if (root == null || root.isMissingNode()) {
            report.addProblem(file + ": empty file");
            return;
        }

        Defaults defaults = new Defaults();
        JsonNode entries;
        if (root.isArray()) {
            entries = root;
        } else if (root.isObject() && root.has("jobs")) {
            entries = root.get("jobs");
            if (!entries.isArray()) {
                report.addProblem(file + ": 'jobs' must be an array");
                return;
            }
            try {
                defaults = readDefaults(root);
            } catch (JobFileException e) {
                report.addProblem(file + ": " + e.getMessage());
                return;
            }
        } else if (root.isObject()) {
            entries = objectMapper.createArrayNode().add(root);
        } else {
            report.addProblem(file + ": expected an object or an array of jobs");
            return;
        }

        String fileBase = baseName(file);
        for (int i = 0; i < entries.size(); i++) {
            try {
                JobDescriptor job = parseJob(entries.get(i), i, fileBase, defaults, file);
                if (!seenIds.add(job.getId())) {
                    throw new JobFileException("duplicate job id '" + job.getId() + "'");
                }
                report.getJobs().add(job);
            } catch (JobFileException e) {
                log.warn("[Jobs] {} 第 {} 个任务被跳过: {}", file, i + 1, e.getMessage());
                report.addProblem(file + " job #" + (i + 1) + ": " + e.getMessage());
            }
        }
    }

    private Defaults readDefaults(JsonNode root) {
        Defaults defaults = new Defaults();
        defaults.appId = firstText(root, "appId", "package_name");
        defaults.entryActivity = firstText(root, "entryActivity", "entry_activity");
        String type = firstText(root, "deviceType", "device_type");
        if (type != null) {
            defaults.deviceType = deviceType(type);
        }
        return defaults;
    }

    private JobDescriptor parseJob(JsonNode node, int index, String fileBase, Defaults defaults, Path file) {
        if (node == null || !node.isObject()) {
            throw new JobFileException("job entry must be an object");
        }

        String appId = firstText(node, "appId", "package_name");
        if (appId == null) {
            appId = defaults.appId;
        }
        if (appId == null) {
            throw new JobFileException("missing 'appId'");
        }

        String id = firstText(node, "id");
        if (id == null) {
            id = fileBase + "#" + (index + 1);
        }

        int stepBudget = positiveInt(node, "stepBudget", properties.getSession().getDefaultStepBudget());
        long timeBudget = positiveInt(node, "timeBudgetSeconds",
                (int) properties.getSession().getDefaultTimeBudget().getSeconds());

        DeviceSelector selector = DeviceSelector.any();
        JsonNode deviceNode = node.get("device");
        if (deviceNode != null && !deviceNode.isNull()) {
            if (!deviceNode.isObject()) {
                throw new JobFileException("'device' must be an object");
            }
            selector = convert(deviceNode, DeviceSelector.class, "device");
        }
        if (selector.getType() == null) {
            String type = firstText(node, "deviceType", "device_type");
            selector.setType(type != null ? deviceType(type) : defaults.deviceType);
        }

        GoalSpec goal = null;
        JsonNode goalNode = node.get("goal");
        if (goalNode != null && !goalNode.isNull()) {
            goal = goalNode.isTextual()
                    ? new GoalSpec(null, goalNode.asText())
                    : convert(goalNode, GoalSpec.class, "goal");
        }

        String entryActivity = firstText(node, "entryActivity", "entry_activity");
        return JobDescriptor.builder()
                .id(id)
                .appId(appId)
                .entryActivity(entryActivity != null ? entryActivity : defaults.entryActivity)
                .device(selector)
                .stepBudget(stepBudget)
                .timeBudgetSeconds(timeBudget)
                .goal(goal)
                .source(file.toString())
                .build();
    }

    private <T> T convert(JsonNode node, Class<T> type, String field) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JobFileException("invalid '" + field + "': " + e.getMessage(), e);
        }
    }

    private int positiveInt(JsonNode node, String field, int defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new JobFileException("'" + field + "' must be an integer");
        }
        if (value.asInt() <= 0) {
            throw new JobFileException("'" + field + "' must be positive");
        }
        return value.asInt();
    }

    private DeviceType deviceType(String value) {
        try {
            return DeviceType.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new JobFileException(e.getMessage(), e);
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static class Defaults {
        private String appId;
        private String entryActivity;
        private DeviceType deviceType;
    }
}
