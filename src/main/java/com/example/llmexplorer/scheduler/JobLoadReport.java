package com.example.llmexplorer.scheduler;

import com.example.llmexplorer.dto.JobDescriptor;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class JobLoadReport {

    private final List<JobDescriptor> jobs = new ArrayList<>();
    /** 被跳过的文件 / 任务及原因 */
    private final List<String> problems = new ArrayList<>();

    void addProblem(String problem) {
        problems.add(problem);
    }
}
