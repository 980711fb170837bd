package buaa.detect.repository;

import buaa.detect.model.ConfusionMatrixEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConfusionMatrixEntryRepository extends JpaRepository<ConfusionMatrixEntry, Long> {

    List<ConfusionMatrixEntry> findByRunIdOrderByCountDesc(Long runId);

    List<ConfusionMatrixEntry> findByRunIdAndModelNameOrderByCountDesc(Long runId, String modelName);

    void deleteByRunId(Long runId);
}
