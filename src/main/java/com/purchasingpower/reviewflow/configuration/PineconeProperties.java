package com.purchasingpower.reviewflow.configuration;

import lombok.Data;

@Data
public class PineconeProperties {

    private String apiKey;

    private String indexName = "review-context";

    private String namespace = "";
}
