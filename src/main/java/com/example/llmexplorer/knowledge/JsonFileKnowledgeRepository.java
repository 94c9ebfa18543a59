package com.example.llmexplorer.knowledge;

import com.example.llmexplorer.config.ExplorerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * 每个 App 一个 JSON 文件，先写临时文件再原子替换
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonFileKnowledgeRepository implements KnowledgeRepository {

    private final ObjectMapper objectMapper;
    private final ExplorerProperties properties;

    @Override
    public Map<String, AppKnowledge> load() {
        Path directory = directory();
        Map<String, AppKnowledge> result = new HashMap<>();
        if (!Files.isDirectory(directory)) {
            log.info("[Knowledge] 知识库目录不存在，从空库开始: {}", directory);
            return result;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                try {
                    AppKnowledge knowledge = objectMapper.readValue(file.toFile(), AppKnowledge.class);
                    if (knowledge.getAppId() == null) {
                        log.warn("[Knowledge] 文件缺少 appId，已跳过: {}", file);
                        continue;
                    }
                    result.put(knowledge.getAppId(), knowledge);
                } catch (IOException e) {
                    log.error("[Knowledge] 知识文件损坏，已跳过: {}", file, e);
                }
            }
        } catch (IOException e) {
            throw new KnowledgePersistenceException("读取知识库目录失败: " + directory, e);
        }
        return result;
    }

    @Override
    public void save(Collection<AppKnowledge> apps) {
        Path directory = directory();
        try {
            Files.createDirectories(directory);
            for (AppKnowledge knowledge : apps) {
                Path target = directory.resolve(fileNameOf(knowledge.getAppId()));
                Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
                try {
                    objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), knowledge);
                    moveIntoPlace(temp, target);
                } finally {
                    Files.deleteIfExists(temp);
                }
                log.debug("[Knowledge] 写入 {}", target);
            }
        } catch (IOException e) {
            throw new KnowledgePersistenceException("写入知识库失败: " + directory, e);
        }
    }

    static String fileNameOf(String appId) {
        return appId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }

    private Path directory() {
        return Path.of(properties.getKnowledge().getDirectory());
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("[Knowledge] 文件系统不支持原子移动，退回普通替换: {}", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
