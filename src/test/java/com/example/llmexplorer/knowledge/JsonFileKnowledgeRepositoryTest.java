package com.example.llmexplorer.knowledge;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.support.TestExplorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileKnowledgeRepositoryTest {

    @TempDir
    Path tempDir;

    private JsonFileKnowledgeRepository repository;

    @BeforeEach
    void setUp() {
        ExplorerProperties properties = new ExplorerProperties();
        properties.getKnowledge().setDirectory(tempDir.resolve("knowledge").toString());
        repository = new JsonFileKnowledgeRepository(TestExplorer.objectMapper(), properties);
    }

    @Test
    void missingDirectoryLoadsNothing() {
        assertThat(repository.load()).isEmpty();
    }

    @Test
    void savesOneFilePerAppAndReadsItBack() throws Exception {
        AppKnowledge shop = new AppKnowledge("com.example.shop");
        KnowledgeRecord record = new KnowledgeRecord("f00d", "MainActivity");
        record.setVisits(3);
        record.getTriedActions().add("open::TAP");
        record.getCrashActions().add("settings::TAP");
        record.setDeadEnd(true);
        record.getAnnotations().put("purpose", "home");
        shop.getRecords().put("f00d", record);
        shop.getBannedActions().add("help::TAP");

        repository.save(List.of(shop, new AppKnowledge("com.example.notes")));

        try (Stream<Path> files = Files.list(tempDir.resolve("knowledge"))) {
            assertThat(files.map(p -> p.getFileName().toString()).collect(Collectors.toList()))
                    .containsExactlyInAnyOrder("com.example.shop.json", "com.example.notes.json");
        }
        Map<String, AppKnowledge> loaded = repository.load();
        KnowledgeRecord restored = loaded.get("com.example.shop").getRecords().get("f00d");
        assertThat(restored.getVisits()).isEqualTo(3);
        assertThat(restored.getTriedActions()).containsExactly("open::TAP");
        assertThat(restored.getCrashActions()).containsExactly("settings::TAP");
        assertThat(restored.isDeadEnd()).isTrue();
        assertThat(restored.getAnnotations()).containsEntry("purpose", "home");
        assertThat(loaded.get("com.example.shop").getBannedActions()).containsExactly("help::TAP");
        assertThat(loaded).containsKey("com.example.notes");
    }

    @Test
    void saveReplacesPreviousContent() {
        AppKnowledge shop = new AppKnowledge("com.example.shop");
        shop.getBannedActions().add("a::TAP");
        repository.save(List.of(shop));
        shop.getBannedActions().add("b::TAP");
        repository.save(List.of(shop));

        assertThat(repository.load().get("com.example.shop").getBannedActions())
                .containsExactly("a::TAP", "b::TAP");
    }

    @Test
    void corruptFilesAreSkipped() throws Exception {
        repository.save(List.of(new AppKnowledge("com.example.shop")));
        Files.writeString(tempDir.resolve("knowledge").resolve("broken.json"), "{ not json",
                StandardCharsets.UTF_8);

        assertThat(repository.load()).containsOnlyKeys("com.example.shop");
    }

    @Test
    void fileNamesAreSanitized() {
        assertThat(JsonFileKnowledgeRepository.fileNameOf("com.example/evil app"))
                .isEqualTo("com.example_evil_app.json");
    }
}
