package buaa.detect.repository;

import buaa.detect.model.ImageEvaluationResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ImageEvaluationResultRepository extends JpaRepository<ImageEvaluationResult, Long> {

    List<ImageEvaluationResult> findByRunIdOrderByIdAsc(Long runId);

    List<ImageEvaluationResult> findByRunIdAndModelNameOrderByIdAsc(Long runId, String modelName);

    long countByRunId(Long runId);

    void deleteByRunId(Long runId);
}
