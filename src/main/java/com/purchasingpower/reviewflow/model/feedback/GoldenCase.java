package com.purchasingpower.reviewflow.model.feedback;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A labelled diff from {@code classpath:golden/*.yaml}: the categories a good review must report.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoldenCase {
    private String name;
    private String filePath;
    private String diff;
    private List<String> expectedCategories = new ArrayList<>();
}
