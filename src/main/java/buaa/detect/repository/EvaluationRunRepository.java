package buaa.detect.repository;

import buaa.detect.model.EvaluationRun;
import buaa.detect.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 评测运行数据访问接口
 */
@Repository
public interface EvaluationRunRepository extends JpaRepository<EvaluationRun, Long> {

    /**
     * 按创建时间倒序获取全部评测运行
     */
    List<EvaluationRun> findAllByOrderByCreatedAtDesc();

    /**
     * 获取指定状态的评测运行
     */
    List<EvaluationRun> findByStatus(RunStatus status);
}
