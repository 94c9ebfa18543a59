package com.example.llmexplorer.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ollama /api/chat 客户端（非流式，JSON 模式）
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OllamaLlmClient implements LlmClient {

    private final WebClient llmWebClient;

    @Value("${llm.model}")
    private String model;

    @Value("${llm.request-timeout:60s}")
    private Duration requestTimeout;

    @Value("${llm.temperature:0.2}")
    private double temperature;

    @Override
    public String chat(List<ChatMessage> messages) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        payload.put("stream", false);
        payload.put("format", "json");

        List<Map<String, Object>> wireMessages = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> wire = new HashMap<>();
            wire.put("role", message.getRole());
            wire.put("content", message.getContent());
            wireMessages.add(wire);
        }
        payload.put("messages", wireMessages);

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", temperature);
        payload.put("options", options);

        OllamaChatResponse response;
        try {
            response = llmWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(OllamaChatResponse.class)
                    .timeout(requestTimeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.warn("[Oracle] LLM 接口返回错误状态: {}", e.getStatusCode().value());
            throw new OracleUnavailableException("LLM endpoint returned " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            log.warn("[Oracle] 调用 LLM 失败: {}", e.toString());
            throw new OracleUnavailableException("LLM endpoint unreachable: " + e.getMessage(), e);
        }

        if (response == null || response.getMessage() == null || response.getMessage().getContent() == null) {
            log.warn("[Oracle] 模型未返回内容");
            return "";
        }
        return response.getMessage().getContent();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OllamaChatResponse {
        private Message message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private String content;
    }
}
