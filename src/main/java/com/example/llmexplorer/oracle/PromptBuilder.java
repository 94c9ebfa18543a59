package com.example.llmexplorer.oracle;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.fingerprint.ActionableElement;
import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.ObservedState;
import com.example.llmexplorer.graph.GraphEdge;
import com.example.llmexplorer.graph.GraphNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 构建决策提示词
 *
 * 输出只依赖输入内容，同样的输入得到同样的消息列表
 */
@Component
@RequiredArgsConstructor
public class PromptBuilder {

    static final String SYSTEM_PROMPT =
            "You are testing an Android app by exploring it. Your job is to reach as many distinct "
                    + "screens as possible and to trigger bugs. At every step you see the current screen "
                    + "and choose exactly one action.\n"
                    + "Reply with a single JSON object and nothing else:\n"
                    + "{\"action\":\"tap|long_press|type_text|swipe|back|stop\",\"element\":\"E3\","
                    + "\"text\":\"...\",\"direction\":\"up|down|left|right\","
                    + "\"verdict\":\"goal_reached|done\",\"reason\":\"...\","
                    + "\"screen_description\":\"...\"}\n"
                    + "Rules: use only element ids listed for the current screen and only the actions "
                    + "listed for that element; 'text' is required for type_text; 'direction' is required "
                    + "for swipe; 'back' needs no element; use 'stop' only when the goal is reached or "
                    + "nothing is left to explore; 'screen_description' is an optional one-line summary of "
                    + "what the current screen is for. Prefer actions not tried before.";

    private final ExplorerProperties properties;

    public List<ChatMessage> build(OracleRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(SYSTEM_PROMPT));
        messages.add(ChatMessage.user(describe(request)));
        return messages;
    }

    /**
     * 把上一次的无效回复和问题说明追加到对话里，让模型重答
     */
    public List<ChatMessage> withCorrection(List<ChatMessage> messages, String rawReply, String problem) {
        List<ChatMessage> corrected = new ArrayList<>(messages);
        corrected.add(ChatMessage.assistant(rawReply == null ? "" : rawReply));
        corrected.add(ChatMessage.user("Your last answer was invalid: " + problem
                + ". Reply again with one JSON object that uses only the listed element ids and actions."));
        return corrected;
    }

    private String describe(OracleRequest request) {
        ObservedState observed = request.getObserved();
        GraphNode node = request.getNode();
        StringBuilder sb = new StringBuilder();

        sb.append("App under test: ").append(request.getAppId()).append('\n');
        if (request.getGoal() != null && !request.getGoal().isBlank()) {
            sb.append("Goal: ").append(request.getGoal()).append('\n');
        }

        if (!request.getRecentEdges().isEmpty()) {
            sb.append("\nRecent steps:\n");
            for (GraphEdge edge : request.getRecentEdges()) {
                sb.append(edge.getStep()).append(". ")
                        .append(edge.getSourceScreen()).append(": ")
                        .append(edge.getAction().describe())
                        .append(" -> ").append(edge.getDestinationScreen())
                        .append(" [").append(edge.getOutcome()).append("]\n");
            }
        }

        sb.append("\nCurrent screen: ").append(observed.getScreenName());
        if (node != null) {
            sb.append(" (visited ").append(node.getVisitCount()).append(" times)");
        }
        sb.append('\n');
        if (request.getScreenDescription() != null) {
            sb.append("Described in earlier runs as: ").append(request.getScreenDescription()).append('\n');
        }

        if (observed.getSummary() != null && observed.getSummary().isLoginPage()) {
            appendCredentials(sb);
        }

        sb.append("\nElements:\n");
        if (observed.getElements().isEmpty()) {
            sb.append("(none)\n");
        }
        for (ActionableElement element : observed.getElements()) {
            sb.append(element.getId()).append(" [").append(element.getRole()).append("] \"")
                    .append(element.getLabel()).append("\" actions: ");
            List<String> actions = new ArrayList<>();
            for (Interaction interaction : element.getInteractions()) {
                actions.add(interaction.wireName() + markers(request, element.actionKey(interaction)));
            }
            sb.append(String.join(", ", actions)).append('\n');
        }
        sb.append("Global actions: back")
                .append(markers(request, ActionableElement.BACK_ACTION_KEY)).append('\n');

        if (request.getLoopHint() != null) {
            sb.append("\nWarning: ").append(request.getLoopHint()).append('\n');
        }
        sb.append("\nChoose the next action.");
        return sb.toString();
    }

    private String markers(OracleRequest request, String actionKey) {
        List<String> marks = new ArrayList<>();
        GraphNode node = request.getNode();
        if (node != null && node.attemptsOf(actionKey) > 0) {
            marks.add("tried " + node.attemptsOf(actionKey) + "x this run");
        }
        if (request.getPastTriedActions().contains(actionKey)) {
            marks.add("tried in earlier runs");
        }
        if (request.getCrashActions().contains(actionKey)) {
            marks.add("crashed the app before");
        }
        if (request.getBannedActions().contains(actionKey)) {
            marks.add("leaves the app, avoid");
        }
        return marks.isEmpty() ? "" : " (" + String.join("; ", marks) + ")";
    }

    private void appendCredentials(StringBuilder sb) {
        ExplorerProperties.Testing testing = properties.getTesting();
        List<String> parts = new ArrayList<>();
        if (!testing.getUsername().isBlank()) {
            parts.add("username=" + testing.getUsername());
        }
        if (!testing.getEmail().isBlank()) {
            parts.add("email=" + testing.getEmail());
        }
        if (!testing.getPassword().isBlank()) {
            parts.add("password=" + testing.getPassword());
        }
        sb.append("This looks like a login page.");
        if (!parts.isEmpty()) {
            sb.append(" Use the test account: ").append(String.join(", ", parts)).append('.');
        }
        sb.append('\n');
    }
}
