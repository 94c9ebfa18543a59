package com.example.llmexplorer.scheduler;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.dto.RunSummary;
import com.example.llmexplorer.dto.SessionResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * 把会话结果与运行汇总写成 JSON，结果目录为空时不写
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultWriter {

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    private final ObjectMapper objectMapper;
    private final ExplorerProperties properties;

    public Optional<Path> writeSession(SessionResult result) {
        return write("session-" + sanitize(result.getSessionId()) + ".json", result);
    }

    public Optional<Path> writeSummary(RunSummary summary) {
        return write("run-summary-" + FILE_TIMESTAMP.format(summary.getStartedAt()) + ".json", summary);
    }

    private Optional<Path> write(String fileName, Object value) {
        String directory = properties.getResults().getDirectory();
        if (directory == null || directory.isBlank()) {
            return Optional.empty();
        }
        Path target = Path.of(directory).resolve(fileName);
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), value);
            log.debug("[Results] 写入 {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.error("[Results] 写入结果文件失败: {}", target, e);
            return Optional.empty();
        }
    }

    private static String sanitize(String value) {
        return value.replaceAll("[^A-Za-z0-9._@-]", "_");
    }
}
