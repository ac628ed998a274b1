package com.purchasingpower.reviewflow.model.dto;

import com.purchasingpower.reviewflow.model.llm.CacheStats;
import com.purchasingpower.reviewflow.model.metrics.ModelCallStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetricsResponse {
    private double totalCost;
    private CacheStats cache;
    private List<ModelCallStats> providers;
}
