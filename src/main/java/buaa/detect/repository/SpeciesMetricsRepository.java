package buaa.detect.repository;

import buaa.detect.model.SpeciesMetrics;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SpeciesMetricsRepository extends JpaRepository<SpeciesMetrics, Long> {

    List<SpeciesMetrics> findByModelMetricsIdInOrderByClassNameAsc(Collection<Long> modelMetricsIds);

    void deleteByRunId(Long runId);
}
