package buaa.detect.client;

import buaa.detect.common.convention.exception.AnnotationFormatException;
import buaa.detect.config.EvaluationConfiguration;
import buaa.detect.dto.BoundingBox;
import buaa.detect.dto.EvaluationImage;
import buaa.detect.dto.GroundTruth;
import cn.hutool.core.util.StrUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取 YOLO 格式标注文件的真实标注来源
 *
 * <p>标注文件位于标注目录下，与图像同名、扩展名为 .txt，
 * 每行格式为 {@code class_id cx cy w h}（坐标归一化到[0,1]）。</p>
 */
@Slf4j
@Component
public class YoloLabelGroundTruthStore implements GroundTruthStore {

    private final Path labelsDir;
    private final List<String> classNames;

    public YoloLabelGroundTruthStore(EvaluationConfiguration configuration) {
        this.labelsDir = Paths.get(configuration.getDataset().getLabelsDir());
        this.classNames = List.copyOf(configuration.getDataset().getClassNames());
    }

    @Override
    public List<GroundTruth> load(EvaluationImage image) {
        Path labelFile = labelsDir.resolve(stem(image.getFilename()) + ".txt");
        if (!Files.isRegularFile(labelFile)) {
            log.debug("未找到标注文件: {}", labelFile);
            return List.of();
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(labelFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AnnotationFormatException("标注文件读取失败: " + labelFile, e);
        }

        List<GroundTruth> groundTruths = new ArrayList<>();
        for (int lineNo = 0; lineNo < lines.size(); lineNo++) {
            String line = lines.get(lineNo);
            if (StrUtil.isBlank(line)) {
                continue;
            }
            groundTruths.add(parseLine(line.trim(), labelFile, lineNo + 1));
        }
        return groundTruths;
    }

    private GroundTruth parseLine(String line, Path labelFile, int lineNo) {
        String[] parts = line.split("\\s+");
        if (parts.length < 5) {
            throw new AnnotationFormatException(
                String.format("标注行字段不足: %s:%d", labelFile.getFileName(), lineNo));
        }
        try {
            int classId = Integer.parseInt(parts[0]);
            if (classId < 0 || classId >= classNames.size()) {
                throw new AnnotationFormatException(
                    String.format("未知类别ID %d: %s:%d", classId, labelFile.getFileName(), lineNo));
            }
            BoundingBox box = BoundingBox.ofCenter(
                Double.parseDouble(parts[1]), Double.parseDouble(parts[2]),
                Double.parseDouble(parts[3]), Double.parseDouble(parts[4]));
            return new GroundTruth(box, classId, classNames.get(classId));
        } catch (IllegalArgumentException e) {
            // NumberFormatException 亦在此列
            throw new AnnotationFormatException(
                String.format("标注行格式错误: %s:%d", labelFile.getFileName(), lineNo), e);
        }
    }

    private static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
