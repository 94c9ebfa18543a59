package com.example.llmexplorer.fingerprint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 驱动返回的一次界面抓取：当前 Activity 名 + 层级树
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UiSnapshot {

    private String screenName;
    private String packageName;
    private UiElementNode root;
    private Instant capturedAt;
}
