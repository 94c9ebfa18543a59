package com.example.llmexplorer.fingerprint;

import com.example.llmexplorer.config.ExplorerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 状态指纹器
 *
 * 1. 去掉易变属性后规范化层级树，连同 Activity 名一起做 SHA-256
 * 2. 按深度优先、从左到右的文档顺序枚举可交互元素，保证提示词可复现
 * 3. 父容器与子元素都可点时，父容器的点击交给子元素
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateFingerprinter {

    private static final int MAX_LABEL_LENGTH = 60;
    private static final int MAX_NEARBY_TEXTS = 3;
    private static final List<String> LOGIN_KEYWORDS = List.of(
            "login", "log in", "sign in", "signin", "password", "登录", "密码");
    private static final List<String> LIST_CONTAINERS = List.of(
            "ListView", "RecyclerView", "GridView", "ExpandableListView");

    private final ExplorerProperties properties;

    public ObservedState fingerprint(UiSnapshot snapshot) {
        validate(snapshot);

        FingerprintLevel level = properties.getFingerprint().getLevel();
        Set<String> ignored = new HashSet<>(properties.getFingerprint().getIgnoredPackages());
        UiElementNode root = snapshot.getRoot();

        StringBuilder canonical = new StringBuilder();
        canonical.append(level.name()).append('|').append(snapshot.getScreenName()).append('|');
        if (level != FingerprintLevel.SCREEN) {
            canonicalize(root, level, ignored, canonical);
        }
        StateFingerprint fingerprint = StateFingerprint.of(sha256Hex(canonical.toString()));

        List<ActionableElement> elements = new ArrayList<>();
        collect(root, "", false, level, ignored, elements);
        disambiguateKeys(elements);

        ObservedState observed = ObservedState.builder()
                .fingerprint(fingerprint)
                .screenName(snapshot.getScreenName())
                .packageName(snapshot.getPackageName())
                .elements(elements)
                .summary(summarize(root, elements, ignored))
                .build();

        log.debug("[Fingerprint] {} -> {}, {} 个可交互元素",
                snapshot.getScreenName(), fingerprint.shortValue(), elements.size());
        return observed;
    }

    private void validate(UiSnapshot snapshot) {
        if (snapshot == null) {
            throw new CaptureException("界面抓取结果为空");
        }
        if (snapshot.getScreenName() == null || snapshot.getScreenName().isBlank()) {
            throw new CaptureException("界面抓取缺少 Activity 名");
        }
        UiElementNode root = snapshot.getRoot();
        if (root == null) {
            throw new CaptureException("界面抓取没有根节点: " + snapshot.getScreenName());
        }
        boolean blankRoot = (root.getClassName() == null || root.getClassName().isBlank())
                && (root.getResourceId() == null || root.getResourceId().isBlank());
        if (blankRoot && root.getChildren().isEmpty()) {
            throw new CaptureException("空白界面: " + snapshot.getScreenName());
        }
    }

    // ==================== 规范化 ====================

    private void canonicalize(UiElementNode node, FingerprintLevel level, Set<String> ignored, StringBuilder out) {
        if (isIgnored(node, ignored)) {
            return;
        }
        out.append(nullToEmpty(node.getClassName()));
        if (level != FingerprintLevel.LAYOUT) {
            out.append('|').append(nullToEmpty(node.getResourceId()))
                    .append('|').append(flags(node));
        }
        if (level == FingerprintLevel.TEXT) {
            out.append('|').append(nullToEmpty(node.getText()))
                    .append('|').append(nullToEmpty(node.getContentDesc()));
        }
        if (!node.getChildren().isEmpty()) {
            out.append('(');
            boolean first = true;
            for (UiElementNode child : node.getChildren()) {
                if (isIgnored(child, ignored)) {
                    continue;
                }
                if (!first) {
                    out.append(';');
                }
                canonicalize(child, level, ignored, out);
                first = false;
            }
            out.append(')');
        }
    }

    private String flags(UiElementNode node) {
        StringBuilder sb = new StringBuilder();
        if (node.isClickable()) {
            sb.append('c');
        }
        if (node.isLongClickable()) {
            sb.append('l');
        }
        if (node.isCheckable()) {
            sb.append('k');
        }
        if (node.isTextInput()) {
            sb.append('e');
        }
        if (node.isScrollable()) {
            sb.append('s');
        }
        if (node.isPassword()) {
            sb.append('p');
        }
        if (!node.isEnabled()) {
            sb.append('d');
        }
        return sb.toString();
    }

    // ==================== 元素枚举 ====================

    private void collect(UiElementNode node, String parentPath, boolean insideList, FingerprintLevel level,
                         Set<String> ignored, List<ActionableElement> out) {
        if (isIgnored(node, ignored)) {
            return;
        }
        String path = parentPath.isEmpty() ? node.simpleClassName() : parentPath + "/" + node.simpleClassName();

        Set<Interaction> interactions = interactionsOf(node);
        if (!interactions.isEmpty() && hasActionableDescendant(node, ignored)) {
            interactions.remove(Interaction.TAP);
            interactions.remove(Interaction.LONG_PRESS);
        }
        if (!interactions.isEmpty()) {
            String label = labelOf(node, ignored);
            out.add(ActionableElement.builder()
                    .id("E" + out.size())
                    .role(roleOf(node, insideList))
                    .bounds(node.getBounds())
                    .label(label)
                    .resourceId(node.getResourceId())
                    .className(node.getClassName())
                    .text(node.getText())
                    .password(node.isPassword())
                    .interactions(interactions)
                    .structuralKey(structuralKey(path, node, label, level))
                    .build());
        }

        boolean childrenInsideList = isListContainer(node);
        for (UiElementNode child : node.getChildren()) {
            collect(child, path, childrenInsideList, level, ignored, out);
        }
    }

    /**
     * 只有 TEXT 级别把文字算进 key；其他级别文字变化不改变指纹，key 也不能变
     */
    private String structuralKey(String path, UiElementNode node, String label, FingerprintLevel level) {
        String key = path + "#" + nullToEmpty(node.getResourceId());
        return level == FingerprintLevel.TEXT ? key + "#" + label : key;
    }

    /**
     * 同一界面上 key 相同的元素按文档顺序加序号，第一个保持原样
     */
    private void disambiguateKeys(List<ActionableElement> elements) {
        Map<String, Integer> seen = new HashMap<>();
        for (ActionableElement element : elements) {
            String key = element.getStructuralKey();
            int occurrence = seen.merge(key, 1, Integer::sum);
            if (occurrence > 1) {
                element.setStructuralKey(key + "#" + occurrence);
            }
        }
    }

    private Set<Interaction> interactionsOf(UiElementNode node) {
        Set<Interaction> interactions = EnumSet.noneOf(Interaction.class);
        if (!node.isEnabled()) {
            return interactions;
        }
        if (node.isClickable() || node.isCheckable()) {
            interactions.add(Interaction.TAP);
        }
        if (node.isLongClickable()) {
            interactions.add(Interaction.LONG_PRESS);
        }
        if (node.isTextInput()) {
            interactions.add(Interaction.TYPE_TEXT);
        }
        if (node.isScrollable()) {
            interactions.add(Interaction.SWIPE);
        }
        return interactions;
    }

    private boolean hasActionableDescendant(UiElementNode node, Set<String> ignored) {
        for (UiElementNode child : node.getChildren()) {
            if (isIgnored(child, ignored)) {
                continue;
            }
            if (child.isEnabled() && (child.isClickable() || child.isLongClickable() || child.isCheckable())) {
                return true;
            }
            if (hasActionableDescendant(child, ignored)) {
                return true;
            }
        }
        return false;
    }

    private ElementRole roleOf(UiElementNode node, boolean insideList) {
        String simple = node.simpleClassName();
        if (node.isTextInput()) {
            return ElementRole.TEXT_FIELD;
        }
        if (node.isCheckable()) {
            return ElementRole.CHECKABLE;
        }
        if (insideList && (node.isClickable() || node.isLongClickable())) {
            return ElementRole.LIST_ITEM;
        }
        if (simple.contains("Button")) {
            return ElementRole.BUTTON;
        }
        if (node.isScrollable()) {
            return ElementRole.SCROLL_CONTAINER;
        }
        if (simple.contains("Image")) {
            return ElementRole.IMAGE;
        }
        return ElementRole.OTHER;
    }

    private boolean isListContainer(UiElementNode node) {
        String simple = node.simpleClassName();
        return LIST_CONTAINERS.stream().anyMatch(simple::endsWith);
    }

    /**
     * 标签优先级：文本 > 描述 > 子节点文本 > resource-id 短名 > 类名
     */
    private String labelOf(UiElementNode node, Set<String> ignored) {
        String label;
        if (!node.isPassword() && hasText(node.getText())) {
            label = node.getText().trim();
        } else if (hasText(node.getContentDesc())) {
            label = node.getContentDesc().trim();
        } else {
            List<String> nearby = new ArrayList<>();
            nearbyTexts(node, ignored, nearby);
            if (!nearby.isEmpty()) {
                label = String.join(" ", nearby);
            } else if (hasText(node.getResourceId())) {
                String rid = node.getResourceId();
                int idx = rid.indexOf(":id/");
                label = idx >= 0 ? rid.substring(idx + 4) : rid;
            } else {
                label = node.simpleClassName();
            }
        }
        label = label.replaceAll("\\s+", " ");
        return label.length() > MAX_LABEL_LENGTH ? label.substring(0, MAX_LABEL_LENGTH) : label;
    }

    private void nearbyTexts(UiElementNode node, Set<String> ignored, List<String> out) {
        for (UiElementNode child : node.getChildren()) {
            if (out.size() >= MAX_NEARBY_TEXTS) {
                return;
            }
            if (isIgnored(child, ignored)) {
                continue;
            }
            if (hasText(child.getText())) {
                out.add(child.getText().trim());
            } else if (hasText(child.getContentDesc())) {
                out.add(child.getContentDesc().trim());
            }
            nearbyTexts(child, ignored, out);
        }
    }

    // ==================== 特征摘要 ====================

    private FeatureSummary summarize(UiElementNode root, List<ActionableElement> elements, Set<String> ignored) {
        Map<ElementRole, Integer> roleCounts = new EnumMap<>(ElementRole.class);
        int editable = 0;
        for (ActionableElement element : elements) {
            roleCounts.merge(element.getRole(), 1, Integer::sum);
            if (element.supports(Interaction.TYPE_TEXT)) {
                editable++;
            }
        }
        boolean login = editable > 0 && containsLoginKeyword(root, ignored);
        return FeatureSummary.builder()
                .roleCounts(roleCounts)
                .editableCount(editable)
                .loginPage(login)
                .build();
    }

    private boolean containsLoginKeyword(UiElementNode node, Set<String> ignored) {
        if (isIgnored(node, ignored)) {
            return false;
        }
        String haystack = (nullToEmpty(node.getText()) + " " + nullToEmpty(node.getContentDesc()) + " "
                + nullToEmpty(node.getResourceId())).toLowerCase(Locale.ROOT);
        for (String keyword : LOGIN_KEYWORDS) {
            if (haystack.contains(keyword)) {
                return true;
            }
        }
        for (UiElementNode child : node.getChildren()) {
            if (containsLoginKeyword(child, ignored)) {
                return true;
            }
        }
        return false;
    }

    // ==================== 工具方法 ====================

    private boolean isIgnored(UiElementNode node, Set<String> ignored) {
        return node.getPackageName() != null && ignored.contains(node.getPackageName());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
