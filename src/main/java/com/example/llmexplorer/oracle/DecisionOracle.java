package com.example.llmexplorer.oracle;

import com.example.llmexplorer.common.ExplorerException;
import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.fingerprint.ActionableElement;
import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.ObservedState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * 决策 Oracle
 *
 * 流程：构建提示词 -> 调用 LLM -> 严格解析 -> 校验元素与交互
 * - 回复无效：附上问题说明重问，最多 invalid-reply-retries 次
 * - LLM 不可用：指数退避重试，总尝试次数 unavailable-max-attempts
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionOracle {

    private final LlmClient llmClient;
    private final PromptBuilder promptBuilder;
    private final OracleReplyParser replyParser;
    private final ExplorerProperties properties;

    public Decision decide(OracleRequest request) {
        int maxAttempts = Math.max(0, properties.getOracle().getInvalidReplyRetries()) + 1;
        List<ChatMessage> messages = promptBuilder.build(request);
        ExplorerException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String raw = callWithBackoff(messages);
            OracleReply reply = replyParser.parse(raw);
            try {
                Decision decision = toDecision(reply, request.getObserved(), attempt - 1);
                log.debug("[Oracle] {} 的决定: {}", request.getObserved().getScreenName(), decision);
                return decision;
            } catch (OracleParseException | OracleInvalidActionException e) {
                lastError = e;
                log.warn("[Oracle] 第 {}/{} 次回复无效: {}", attempt, maxAttempts, e.getMessage());
                messages = promptBuilder.withCorrection(messages, raw, e.getMessage());
            }
        }
        throw new OracleRetriesExhaustedException(maxAttempts, lastError);
    }

    private String callWithBackoff(List<ChatMessage> messages) {
        ExplorerProperties.Oracle config = properties.getOracle();
        int maxAttempts = Math.max(1, config.getUnavailableMaxAttempts());
        Duration backoff = config.getInitialBackoff();
        OracleUnavailableException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return llmClient.chat(messages);
            } catch (OracleUnavailableException e) {
                lastError = e;
                if (attempt == maxAttempts) {
                    break;
                }
                log.warn("[Oracle] LLM 不可用（第 {}/{} 次），{} ms 后重试: {}",
                        attempt, maxAttempts, backoff.toMillis(), e.getMessage());
                sleep(backoff);
                Duration doubled = backoff.multipliedBy(2);
                backoff = doubled.compareTo(config.getMaxBackoff()) > 0 ? config.getMaxBackoff() : doubled;
            }
        }
        log.error("[Oracle] LLM 在 {} 次尝试后仍不可用", maxAttempts);
        throw new OracleUnavailableException("LLM unavailable after " + maxAttempts + " attempts", lastError);
    }

    private Decision toDecision(OracleReply reply, ObservedState observed, int invalidReplies) {
        if (reply.getKind() == OracleReply.Kind.INVALID) {
            throw new OracleParseException(reply.getProblem());
        }
        if (reply.getKind() == OracleReply.Kind.STOP) {
            return Decision.builder()
                    .kind(Decision.Kind.STOP)
                    .verdict(reply.getVerdict())
                    .source(DecisionSource.ORACLE)
                    .reason(reply.getReason())
                    .invalidReplies(invalidReplies)
                    .screenDescription(reply.getScreenDescription())
                    .build();
        }

        Interaction interaction = reply.getInteraction();
        if (interaction == Interaction.BACK) {
            return Decision.builder()
                    .kind(Decision.Kind.ACTION)
                    .interaction(Interaction.BACK)
                    .source(DecisionSource.ORACLE)
                    .reason(reply.getReason())
                    .invalidReplies(invalidReplies)
                    .screenDescription(reply.getScreenDescription())
                    .build();
        }

        ActionableElement element = observed.findElement(reply.getElementId())
                .orElseThrow(() -> new OracleInvalidActionException(
                        "element " + reply.getElementId() + " does not exist on this screen"));
        if (!element.supports(interaction)) {
            throw new OracleInvalidActionException("element " + element.getId() + " does not support "
                    + interaction.wireName());
        }
        if (interaction == Interaction.TYPE_TEXT && (reply.getText() == null || reply.getText().isBlank())) {
            throw new OracleInvalidActionException("type_text needs a non-empty 'text'");
        }

        return Decision.builder()
                .kind(Decision.Kind.ACTION)
                .element(element)
                .interaction(interaction)
                .text(reply.getText())
                .direction(reply.getDirection())
                .source(DecisionSource.ORACLE)
                .reason(reply.getReason())
                .invalidReplies(invalidReplies)
                .screenDescription(reply.getScreenDescription())
                .build();
    }

    private void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("interrupted while waiting to retry the LLM", e);
        }
    }
}
