package com.example.llmexplorer.oracle;

import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.SwipeDirection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM 回复解析器
 *
 * 优先取回复中第一个 '{' 到最后一个 '}' 之间的 JSON 对象（允许前后夹杂说明文字），
 * 取不到时再尝试 tap(E3) 这种函数调用写法。永远不抛异常，解析失败返回 INVALID。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OracleReplyParser {

    private static final Pattern SHORTHAND = Pattern.compile(
            "\\b(tap|long_press|type_text|swipe|back|stop)\\s*\\(\\s*[\"']?(E\\d+)?[\"']?\\s*(?:,\\s*[\"']([^\"']*)[\"'])?\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public OracleReply parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return OracleReply.invalid("the reply was empty");
        }

        String json = extractJson(raw);
        if (json != null) {
            try {
                return fromJson(objectMapper.readTree(json));
            } catch (JsonProcessingException e) {
                log.debug("[Oracle] JSON 解析失败，尝试函数写法: {}", raw);
            }
        }

        OracleReply shorthand = parseShorthand(raw);
        if (shorthand != null) {
            return shorthand;
        }
        return OracleReply.invalid(json != null
                ? "the reply is not a well-formed JSON object"
                : "the reply contains no JSON object");
    }

    private String extractJson(String raw) {
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return raw.substring(start, end + 1);
        }
        return null;
    }

    private OracleReply fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return OracleReply.invalid("the reply must be a JSON object");
        }
        String action = text(node, "action");
        if (action == null) {
            return OracleReply.invalid("missing field 'action'");
        }
        String reason = text(node, "reason");
        String description = text(node, "screen_description");

        if ("stop".equalsIgnoreCase(action.trim())) {
            String verdictValue = text(node, "verdict");
            if (verdictValue == null) {
                return OracleReply.stop(StopVerdict.ORACLE_DONE, reason).describing(description);
            }
            StopVerdict verdict = StopVerdict.fromWireName(verdictValue);
            if (verdict == null) {
                return OracleReply.invalid("unknown verdict '" + verdictValue + "', use goal_reached or done");
            }
            return OracleReply.stop(verdict, reason).describing(description);
        }

        Interaction interaction = Interaction.fromWireName(action);
        if (interaction == null) {
            return OracleReply.invalid("unknown action '" + action
                    + "', use one of tap, long_press, type_text, swipe, back, stop");
        }
        String elementId = text(node, "element");
        if (interaction != Interaction.BACK && elementId == null) {
            return OracleReply.invalid("missing field 'element' for action '" + interaction.wireName() + "'");
        }

        SwipeDirection direction = null;
        if (interaction == Interaction.SWIPE) {
            String directionValue = text(node, "direction");
            direction = SwipeDirection.fromWireName(directionValue);
            if (direction == null) {
                return OracleReply.invalid("swipe needs 'direction' to be one of up, down, left, right");
            }
        }
        return OracleReply.action(interaction, elementId == null ? null : elementId.trim(),
                text(node, "text"), direction, reason).describing(description);
    }

    private OracleReply parseShorthand(String raw) {
        Matcher m = SHORTHAND.matcher(raw);
        if (!m.find()) {
            return null;
        }
        String name = m.group(1);
        String elementId = m.group(2);
        String argument = m.group(3);

        if ("stop".equalsIgnoreCase(name)) {
            return OracleReply.stop(StopVerdict.ORACLE_DONE, null);
        }
        Interaction interaction = Interaction.fromWireName(name);
        if (interaction != Interaction.BACK && elementId == null) {
            return OracleReply.invalid("missing element id in " + m.group());
        }
        if (interaction == Interaction.SWIPE) {
            SwipeDirection direction = SwipeDirection.fromWireName(argument);
            if (direction == null) {
                return OracleReply.invalid("swipe needs a direction, e.g. swipe(E1, \"up\")");
            }
            return OracleReply.action(interaction, elementId, null, direction, null);
        }
        String text = interaction == Interaction.TYPE_TEXT ? argument : null;
        return OracleReply.action(interaction, elementId, text, null, null);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
