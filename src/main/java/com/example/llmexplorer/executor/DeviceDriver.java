package com.example.llmexplorer.executor;

import com.example.llmexplorer.fingerprint.ActionableElement;
import com.example.llmexplorer.fingerprint.SwipeDirection;
import com.example.llmexplorer.fingerprint.UiSnapshot;

/**
 * 移动端自动化驱动（由外部实现，比如 uiautomator2 / Appium 的适配层）
 *
 * 所有方法都可能抛出 DriverTimeoutException 与 AppCrashedException；
 * 操作元素的方法在元素已失效时抛 StaleElementException
 */
public interface DeviceDriver extends AutoCloseable {

    /**
     * 抓取当前界面
     *
     * @throws com.example.llmexplorer.fingerprint.CaptureException 抓取结果无法使用
     */
    UiSnapshot capture();

    void tap(ActionableElement element);

    void longPress(ActionableElement element);

    void typeText(ActionableElement element, String text);

    void swipe(ActionableElement element, SwipeDirection direction);

    void back();

    /**
     * 结束并重新启动 App，回到入口界面
     */
    void restartApp(String appId, String entryActivity);

    /**
     * 当前前台应用的包名
     */
    String foregroundPackage();

    @Override
    default void close() {
    }
}
