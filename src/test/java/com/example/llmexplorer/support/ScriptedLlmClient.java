package com.example.llmexplorer.support;

import com.example.llmexplorer.oracle.ChatMessage;
import com.example.llmexplorer.oracle.LlmClient;
import com.example.llmexplorer.oracle.OracleUnavailableException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按脚本回复的 LLM：先消费排好的回复或异常，排完后交给 otherwise 策略
 */
public class ScriptedLlmClient implements LlmClient {

    private static final Pattern ELEMENT_LINE = Pattern.compile("^(E\\d+) \\[[A-Z_]+] \".*\" actions: (.*)$");

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<List<ChatMessage>> requests = new ArrayList<>();
    private Function<List<ChatMessage>, String> otherwise;
    private long delayMillis;

    public synchronized ScriptedLlmClient reply(String... replies) {
        for (String reply : replies) {
            script.addLast(reply);
        }
        return this;
    }

    public synchronized ScriptedLlmClient fail(RuntimeException error, int times) {
        for (int i = 0; i < times; i++) {
            script.addLast(error);
        }
        return this;
    }

    public synchronized ScriptedLlmClient otherwise(Function<List<ChatMessage>, String> strategy) {
        this.otherwise = strategy;
        return this;
    }

    public synchronized ScriptedLlmClient delay(long millis) {
        this.delayMillis = millis;
        return this;
    }

    @Override
    public String chat(List<ChatMessage> messages) {
        Object next;
        Function<List<ChatMessage>, String> strategy;
        long delay;
        synchronized (this) {
            requests.add(new ArrayList<>(messages));
            next = script.pollFirst();
            strategy = otherwise;
            delay = delayMillis;
        }
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OracleUnavailableException("interrupted", e);
            }
        }
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        if (next != null) {
            return (String) next;
        }
        if (strategy != null) {
            return strategy.apply(messages);
        }
        throw new OracleUnavailableException("script exhausted");
    }

    public synchronized List<List<ChatMessage>> getRequests() {
        return new ArrayList<>(requests);
    }

    public synchronized int callCount() {
        return requests.size();
    }

    /**
     * 点第一个本次还没点过的元素，都点过了就返回
     */
    public static Function<List<ChatMessage>, String> tapFirstUntried() {
        return messages -> {
            String prompt = lastScreenPrompt(messages);
            for (String line : prompt.split("\n")) {
                Matcher m = ELEMENT_LINE.matcher(line);
                if (!m.matches()) {
                    continue;
                }
                for (String action : m.group(2).split(", ")) {
                    if (action.equals("tap")) {
                        return "{\"action\":\"tap\",\"element\":\"" + m.group(1) + "\"}";
                    }
                }
            }
            return "{\"action\":\"back\"}";
        };
    }

    public static Function<List<ChatMessage>, String> always(String reply) {
        return messages -> reply;
    }

    public static String lastScreenPrompt(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage message = messages.get(i);
            if ("user".equals(message.getRole()) && message.getContent().contains("Elements:")) {
                return message.getContent();
            }
        }
        return "";
    }
}
