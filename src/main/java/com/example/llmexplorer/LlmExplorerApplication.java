package com.example.llmexplorer;

import com.example.llmexplorer.config.ExplorerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExplorerProperties.class)
public class LlmExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmExplorerApplication.class, args);
    }
}
