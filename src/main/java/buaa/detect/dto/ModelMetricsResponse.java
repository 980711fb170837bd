package buaa.detect.dto;

import buaa.detect.model.ModelMetrics;
import buaa.detect.model.SpeciesMetrics;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 模型指标及其下属的物种指标
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetricsResponse {

    @JsonUnwrapped
    private ModelMetrics metrics;

    private List<SpeciesMetrics> species;
}
