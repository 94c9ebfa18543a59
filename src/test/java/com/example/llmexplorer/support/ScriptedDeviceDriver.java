package com.example.llmexplorer.support;

import com.example.llmexplorer.executor.AppCrashedException;
import com.example.llmexplorer.executor.DeviceDriver;
import com.example.llmexplorer.executor.DriverTimeoutException;
import com.example.llmexplorer.executor.StaleElementException;
import com.example.llmexplorer.fingerprint.ActionableElement;
import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.SwipeDirection;
import com.example.llmexplorer.fingerprint.UiElementNode;
import com.example.llmexplorer.fingerprint.UiSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把 App 模拟成“界面 + 跳转表”的测试驱动
 *
 * 元素按 resource-id 的短名识别；可以注入元素失效、抓取超时、崩溃和跳出 App
 */
public class ScriptedDeviceDriver implements DeviceDriver {

    public static final String LAUNCHER = "com.android.launcher3";

    private final String appId;
    private final String entryScreen;
    private final Map<String, UiSnapshot> screens = new LinkedHashMap<>();
    private final Map<String, String> transitions = new HashMap<>();
    private final Set<String> crashTriggers = new HashSet<>();
    private final Set<String> leaveTriggers = new HashSet<>();
    private final Set<String> leaveOnBack = new HashSet<>();
    private final Deque<String> backStack = new ArrayDeque<>();
    private final List<String> actionLog = Collections.synchronizedList(new ArrayList<>());

    private String current;
    private String foreground;
    private boolean crashed;
    private boolean crashOnLaunch;
    private int staleFailures;
    private int captureTimeouts;
    private int restarts;
    private boolean closed;

    public ScriptedDeviceDriver(String appId, String entryScreen) {
        this.appId = appId;
        this.entryScreen = entryScreen;
        this.current = entryScreen;
        this.foreground = appId;
    }

    public ScriptedDeviceDriver screen(String name, UiElementNode... children) {
        screens.put(name, TestScreens.screen(appId, name, children));
        return this;
    }

    public ScriptedDeviceDriver on(String screen, String resourceId, Interaction interaction, String target) {
        transitions.put(key(screen, resourceId, interaction), target);
        return this;
    }

    public ScriptedDeviceDriver crashOn(String screen, String resourceId, Interaction interaction) {
        crashTriggers.add(key(screen, resourceId, interaction));
        return this;
    }

    public ScriptedDeviceDriver leaveAppOn(String screen, String resourceId, Interaction interaction) {
        leaveTriggers.add(key(screen, resourceId, interaction));
        return this;
    }

    /**
     * 在这个界面按返回键会回到桌面
     */
    public ScriptedDeviceDriver leaveAppOnBack(String screen) {
        leaveOnBack.add(screen);
        return this;
    }

    /**
     * App 每次启动都立即崩溃
     */
    public ScriptedDeviceDriver crashOnLaunch() {
        crashOnLaunch = true;
        crashed = true;
        return this;
    }

    public ScriptedDeviceDriver failNextActionsWithStale(int count) {
        this.staleFailures = count;
        return this;
    }

    public ScriptedDeviceDriver failNextCapturesWithTimeout(int count) {
        this.captureTimeouts = count;
        return this;
    }

    @Override
    public synchronized UiSnapshot capture() {
        if (captureTimeouts > 0) {
            captureTimeouts--;
            throw new DriverTimeoutException("capture timed out");
        }
        if (crashed) {
            throw new AppCrashedException(appId + " is not running");
        }
        UiSnapshot snapshot = screens.get(current);
        if (snapshot == null) {
            throw new IllegalStateException("no screen named " + current);
        }
        return snapshot;
    }

    @Override
    public void tap(ActionableElement element) {
        act(element, Interaction.TAP);
    }

    @Override
    public void longPress(ActionableElement element) {
        act(element, Interaction.LONG_PRESS);
    }

    @Override
    public void typeText(ActionableElement element, String text) {
        act(element, Interaction.TYPE_TEXT);
        actionLog.add("text:" + text);
    }

    @Override
    public void swipe(ActionableElement element, SwipeDirection direction) {
        act(element, Interaction.SWIPE);
    }

    @Override
    public synchronized void back() {
        actionLog.add(current + ":BACK");
        if (!appId.equals(foreground)) {
            foreground = appId;
            return;
        }
        if (leaveOnBack.contains(current)) {
            foreground = LAUNCHER;
            return;
        }
        if (!backStack.isEmpty()) {
            current = backStack.pop();
        }
    }

    @Override
    public synchronized void restartApp(String appId, String entryActivity) {
        restarts++;
        crashed = crashOnLaunch;
        foreground = this.appId;
        current = entryScreen;
        backStack.clear();
    }

    @Override
    public synchronized String foregroundPackage() {
        return foreground;
    }

    @Override
    public void close() {
        closed = true;
    }

    private synchronized void act(ActionableElement element, Interaction interaction) {
        if (staleFailures > 0) {
            staleFailures--;
            throw new StaleElementException("element " + element.getId() + " is gone");
        }
        String key = key(current, shortId(element.getResourceId()), interaction);
        actionLog.add(key);
        if (crashTriggers.contains(key)) {
            crashed = true;
            throw new AppCrashedException(appId + " crashed");
        }
        if (leaveTriggers.contains(key)) {
            foreground = LAUNCHER;
            return;
        }
        String target = transitions.get(key);
        if (target != null && !target.equals(current)) {
            backStack.push(current);
            current = target;
        }
    }

    private static String shortId(String resourceId) {
        if (resourceId == null) {
            return "";
        }
        int idx = resourceId.indexOf(":id/");
        return idx >= 0 ? resourceId.substring(idx + 4) : resourceId;
    }

    private static String key(String screen, String resourceId, Interaction interaction) {
        return screen + "|" + resourceId + "|" + interaction.name();
    }

    public String getCurrentScreen() {
        return current;
    }

    public List<String> getActionLog() {
        return new ArrayList<>(actionLog);
    }

    public int getRestarts() {
        return restarts;
    }

    public boolean isClosed() {
        return closed;
    }
}
