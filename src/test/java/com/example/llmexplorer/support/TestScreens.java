package com.example.llmexplorer.support;

import com.example.llmexplorer.fingerprint.Bounds;
import com.example.llmexplorer.fingerprint.UiElementNode;
import com.example.llmexplorer.fingerprint.UiSnapshot;

import java.time.Instant;

/**
 * 构造测试用界面的小工具
 */
public final class TestScreens {

    private TestScreens() {
    }

    public static UiSnapshot screen(String appId, String screenName, UiElementNode... children) {
        UiElementNode root = UiElementNode.builder()
                .className("android.widget.FrameLayout")
                .packageName(appId)
                .bounds(new Bounds(0, 0, 1080, 1920))
                .build();
        for (UiElementNode child : children) {
            root.addChild(child);
        }
        return UiSnapshot.builder()
                .screenName(screenName)
                .packageName(appId)
                .root(root)
                .capturedAt(Instant.now())
                .build();
    }

    public static UiElementNode button(String appId, String resourceId, String text) {
        return UiElementNode.builder()
                .className("android.widget.Button")
                .packageName(appId)
                .resourceId(appId + ":id/" + resourceId)
                .text(text)
                .clickable(true)
                .bounds(new Bounds(0, 100, 500, 200))
                .build();
    }

    public static UiElementNode editText(String appId, String resourceId, String hint) {
        return UiElementNode.builder()
                .className("android.widget.EditText")
                .packageName(appId)
                .resourceId(appId + ":id/" + resourceId)
                .contentDesc(hint)
                .clickable(true)
                .editable(true)
                .bounds(new Bounds(0, 300, 1000, 400))
                .build();
    }

    public static UiElementNode label(String appId, String text) {
        return UiElementNode.builder()
                .className("android.widget.TextView")
                .packageName(appId)
                .text(text)
                .bounds(new Bounds(0, 0, 1000, 80))
                .build();
    }
}
