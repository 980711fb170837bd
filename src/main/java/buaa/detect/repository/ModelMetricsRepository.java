package buaa.detect.repository;

import buaa.detect.model.MetricsRowType;
import buaa.detect.model.ModelMetrics;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ModelMetricsRepository extends JpaRepository<ModelMetrics, Long> {

    List<ModelMetrics> findByRunIdOrderByIdAsc(Long runId);

    List<ModelMetrics> findByRunIdAndRowTypeOrderByIdAsc(Long runId, MetricsRowType rowType);

    void deleteByRunId(Long runId);
}
