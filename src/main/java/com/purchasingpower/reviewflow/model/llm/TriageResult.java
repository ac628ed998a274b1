package com.purchasingpower.reviewflow.model.llm;

import lombok.Value;

import java.util.List;

@Value
public class TriageResult {
    boolean hasIssues;
    List<String> categories;
}
