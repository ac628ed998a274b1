package com.purchasingpower.reviewflow.model.llm;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One item of the deep-analysis JSON array.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelFinding {
    private String type;
    private String title;
    private String description;
    private String severity;

    @JsonProperty("line_number")
    @JsonAlias({"line", "lineNumber"})
    private Integer lineNumber;

    @JsonProperty("file_path")
    @JsonAlias({"file", "filePath", "path"})
    private String filePath;

    private String suggestion;
    private String category;
    private Double confidence;
}
