package com.example.llmexplorer.fingerprint;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 元素在屏幕上的矩形区域（左上、右下）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Bounds {

    private static final Pattern UIAUTOMATOR_BOUNDS = Pattern.compile("\\[(-?\\d+),(-?\\d+)]\\[(-?\\d+),(-?\\d+)]");

    private int left;
    private int top;
    private int right;
    private int bottom;

    public int centerX() {
        return (left + right) / 2;
    }

    public int centerY() {
        return (top + bottom) / 2;
    }

    public boolean isEmpty() {
        return right <= left || bottom <= top;
    }

    /**
     * 解析 uiautomator 的 "[0,0][1080,210]" 格式，格式不对返回 null
     */
    public static Bounds parse(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = UIAUTOMATOR_BOUNDS.matcher(value.trim());
        if (!m.matches()) {
            return null;
        }
        return new Bounds(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
    }
}
