package com.example.llmexplorer.executor;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.fingerprint.ActionableElement;
import com.example.llmexplorer.fingerprint.CaptureException;
import com.example.llmexplorer.fingerprint.Interaction;
import com.example.llmexplorer.fingerprint.ObservedState;
import com.example.llmexplorer.fingerprint.StateFingerprinter;
import com.example.llmexplorer.fingerprint.SwipeDirection;
import com.example.llmexplorer.oracle.Decision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * 动作执行器
 *
 * - 元素失效：重新抓取界面，按结构 key（其次标签）重新定位，只重试一次
 * - 驱动超时：重试 driver-timeout-retries 次
 * - 崩溃 / 离开 App：如实上报，由会话进入恢复状态
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionExecutor {

    private final StateFingerprinter fingerprinter;
    private final ExplorerProperties properties;

    public ExecutionResult execute(DeviceDriver driver, Decision decision, ObservedState observed, String appId) {
        ActionableElement target = decision.getElement();
        String text = decision.getInteraction() == Interaction.TYPE_TEXT ? resolveText(decision, target) : null;
        int maxTimeoutRetries = Math.max(0, properties.getExecutor().getDriverTimeoutRetries());
        int timeouts = 0;
        boolean staleRetried = false;
        ObservedState refreshed = null;

        while (true) {
            try {
                perform(driver, decision, target, text);
                break;
            } catch (StaleElementException e) {
                if (staleRetried) {
                    log.warn("[Executor] 重新定位后元素仍然失效: {}", describe(target));
                    return new ExecutionResult(ActionOutcome.ELEMENT_STALE, target, refreshed, e.getMessage());
                }
                staleRetried = true;
                try {
                    refreshed = recapture(driver);
                } catch (AppCrashedException crash) {
                    return new ExecutionResult(ActionOutcome.APP_CRASHED, target, null, crash.getMessage());
                }
                Optional<ActionableElement> resolved = refreshed == null
                        ? Optional.empty()
                        : reResolve(refreshed, target);
                if (resolved.isEmpty()) {
                    log.warn("[Executor] 元素失效且无法重新定位: {}", describe(target));
                    return new ExecutionResult(ActionOutcome.ELEMENT_STALE, target, refreshed, e.getMessage());
                }
                log.info("[Executor] 元素失效，重新定位 {} -> {}", target.getId(), resolved.get().getId());
                target = resolved.get();
            } catch (DriverTimeoutException e) {
                timeouts++;
                if (timeouts > maxTimeoutRetries) {
                    log.warn("[Executor] 驱动连续超时 {} 次，放弃本步: {}", timeouts, describe(target));
                    return new ExecutionResult(ActionOutcome.DRIVER_TIMEOUT, target, refreshed, e.getMessage());
                }
                log.debug("[Executor] 驱动超时，第 {} 次重试", timeouts);
            } catch (AppCrashedException e) {
                log.warn("[Executor] 执行 {} 时 App 崩溃: {}", describe(target), e.getMessage());
                return new ExecutionResult(ActionOutcome.APP_CRASHED, target, refreshed, e.getMessage());
            }
        }

        try {
            String foreground = driver.foregroundPackage();
            if (foreground != null && !foreground.equals(appId)) {
                log.info("[Executor] 动作后离开了被测 App，前台为 {}", foreground);
                return new ExecutionResult(ActionOutcome.LEFT_APP, target, refreshed, "foreground package " + foreground);
            }
        } catch (AppCrashedException e) {
            return new ExecutionResult(ActionOutcome.APP_CRASHED, target, refreshed, e.getMessage());
        } catch (DriverTimeoutException e) {
            log.warn("[Executor] 查询前台包名超时，按仍在 App 内处理: {}", e.getMessage());
        }
        return new ExecutionResult(ActionOutcome.SUCCESS, target, refreshed, null);
    }

    /**
     * 让 App 回到可探索状态：离开 App 时先尝试返回键，不行再重启
     *
     * @throws ActionExecutionException 多次重启仍失败
     */
    public void recover(DeviceDriver driver, String appId, String entryActivity, boolean leftApp) {
        if (leftApp) {
            try {
                driver.back();
                if (appId.equals(driver.foregroundPackage())) {
                    log.info("[Executor] 返回键已回到 {}", appId);
                    return;
                }
            } catch (ActionExecutionException e) {
                log.warn("[Executor] 返回键恢复失败，改为重启 App: {}", e.getMessage());
            }
        }

        int maxRetries = Math.max(0, properties.getExecutor().getDriverTimeoutRetries());
        int failures = 0;
        while (true) {
            try {
                driver.restartApp(appId, entryActivity);
                log.info("[Executor] 已重启 {}", appId);
                return;
            } catch (DriverTimeoutException | AppCrashedException e) {
                failures++;
                if (failures > maxRetries) {
                    throw new ActionExecutionException("failed to restart " + appId + " after " + failures + " attempts", e);
                }
                log.warn("[Executor] 重启 App 失败，第 {} 次重试: {}", failures, e.getMessage());
            }
        }
    }

    private void perform(DeviceDriver driver, Decision decision, ActionableElement target, String text) {
        switch (decision.getInteraction()) {
            case TAP:
                driver.tap(target);
                break;
            case LONG_PRESS:
                driver.longPress(target);
                break;
            case TYPE_TEXT:
                driver.typeText(target, text);
                break;
            case SWIPE:
                driver.swipe(target, decision.getDirection() == null ? SwipeDirection.UP : decision.getDirection());
                break;
            case BACK:
                driver.back();
                break;
            default:
                throw new IllegalStateException("unsupported interaction " + decision.getInteraction());
        }
    }

    private ObservedState recapture(DeviceDriver driver) {
        try {
            return fingerprinter.fingerprint(driver.capture());
        } catch (CaptureException | DriverTimeoutException e) {
            log.warn("[Executor] 元素失效后重新抓取界面失败: {}", e.getMessage());
            return null;
        }
    }

    private Optional<ActionableElement> reResolve(ObservedState fresh, ActionableElement stale) {
        if (stale == null) {
            return Optional.empty();
        }
        Optional<ActionableElement> byKey = fresh.getElements().stream()
                .filter(e -> e.getStructuralKey().equals(stale.getStructuralKey()))
                .findFirst();
        if (byKey.isPresent()) {
            return byKey;
        }
        return fresh.getElements().stream()
                .filter(e -> e.getLabel().equals(stale.getLabel()) && e.getRole() == stale.getRole())
                .findFirst();
    }

    /**
     * 输入内容：决策给出的文本 > 匹配字段的测试账号 > 默认样例
     */
    String resolveText(Decision decision, ActionableElement element) {
        if (decision.getText() != null && !decision.getText().isBlank()) {
            return decision.getText();
        }
        ExplorerProperties.Testing testing = properties.getTesting();
        String candidate = null;
        if (element != null) {
            String hint = (element.getLabel() + " " + (element.getResourceId() == null ? "" : element.getResourceId()))
                    .toLowerCase(Locale.ROOT);
            if (element.isPassword() || hint.contains("password") || hint.contains("密码")) {
                candidate = testing.getPassword();
            } else if (hint.contains("mail")) {
                candidate = testing.getEmail();
            } else if (hint.contains("user") || hint.contains("account") || hint.contains("login")
                    || hint.contains("账号") || hint.contains("用户名")) {
                candidate = testing.getUsername();
            }
        }
        return candidate == null || candidate.isBlank() ? testing.getDefaultText() : candidate;
    }

    private static String describe(ActionableElement element) {
        return element == null ? "BACK" : element.getId() + " \"" + element.getLabel() + "\"";
    }
}
