package com.example.llmexplorer.oracle;

import java.util.List;

/**
 * LLM 接入点
 */
public interface LlmClient {

    /**
     * 发送一轮对话，返回模型回复的原始文本
     *
     * @throws OracleUnavailableException 网络错误、超时或服务端错误
     */
    String chat(List<ChatMessage> messages);
}
