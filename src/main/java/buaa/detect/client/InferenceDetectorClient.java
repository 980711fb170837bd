package buaa.detect.client;

import buaa.detect.common.convention.errorcode.EvalErrorCode;
import buaa.detect.common.convention.exception.ModelLoadException;
import buaa.detect.common.convention.exception.ServiceException;
import buaa.detect.config.EvaluationConfiguration;
import buaa.detect.dto.BoundingBox;
import buaa.detect.dto.Detection;
import buaa.detect.dto.EvaluationImage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 外部推理服务客户端
 * 通过 HTTP/JSON 调用部署在推理端的 YOLO 模型
 */
@Component
public class InferenceDetectorClient implements Detector {

    private static final Logger log = LoggerFactory.getLogger(InferenceDetectorClient.class);

    private final WebClient httpClient;
    private final ObjectMapper jsonParser;
    private final EvaluationConfiguration.DetectorApi settings;

    public InferenceDetectorClient(WebClient detectorWebClient,
                                   ObjectMapper objectMapper,
                                   EvaluationConfiguration configuration) {
        this.httpClient = detectorWebClient;
        this.jsonParser = objectMapper;
        this.settings = configuration.getDetector();
    }

    @Override
    public DetectorModel loadModel(String modelId, String device) {
        log.info("请求推理服务加载模型: {} ({})", modelId, device);
        Map<String, Object> body = new HashMap<>();
        body.put("model", modelId);
        body.put("device", device);

        String response;
        try {
            response = post("/models/load", body, settings.getLoadTimeout());
        } catch (Exception e) {
            throw new ModelLoadException(modelId, e.getMessage(), e);
        }

        try {
            JsonNode root = jsonParser.readTree(response);
            JsonNode handle = root.get("handle");
            if (handle == null || handle.asText().isBlank()) {
                throw new ModelLoadException(modelId, "推理服务未返回模型句柄");
            }
            log.info("模型加载完成: {} -> {}", modelId, handle.asText());
            return new DetectorModel(modelId, device, handle.asText());
        } catch (ModelLoadException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelLoadException(modelId, "加载响应解析失败", e);
        }
    }

    @Override
    public List<Detection> detect(DetectorModel model, EvaluationImage image, double confidenceThreshold) {
        Map<String, Object> body = new HashMap<>();
        body.put("handle", model.getHandle());
        body.put("model", model.getModelId());
        body.put("device", model.getDevice());
        body.put("image_path", image.getPath() != null ? image.getPath().toString() : image.getFilename());
        body.put("confidence_threshold", confidenceThreshold);

        String response = post("/detect", body, settings.getTimeout());
        try {
            return extractDetections(jsonParser.readTree(response));
        } catch (ServiceException e) {
            throw e;
        } catch (Exception e) {
            throw new ServiceException("推理响应解析失败: " + image.getFilename(), e, EvalErrorCode.DETECTOR_ERROR);
        }
    }

    @Override
    public void unloadModel(DetectorModel model) {
        Map<String, Object> body = new HashMap<>();
        body.put("handle", model.getHandle());
        try {
            post("/models/unload", body, settings.getTimeout());
            log.info("模型已卸载: {}", model.getModelId());
        } catch (Exception e) {
            log.warn("模型卸载失败: {}", model.getModelId(), e);
        }
    }

    /**
     * 调用推理接口；block 超时抛出 IllegalStateException，由调用方按单图失败处理
     */
    private String post(String uri, Map<String, Object> body, Duration timeout) {
        return httpClient.post()
            .uri(uri)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .retryWhen(createRetryPolicy())
            .block(timeout);
    }

    /**
     * 仅对服务端 5xx 错误重试
     */
    private Retry createRetryPolicy() {
        return Retry.fixedDelay(settings.getMaxRetries(), Duration.ofSeconds(1))
            .filter(error -> error instanceof WebClientResponseException
                && ((WebClientResponseException) error).getStatusCode().is5xxServerError());
    }

    private List<Detection> extractDetections(JsonNode root) {
        JsonNode detections = root != null ? root.get("detections") : null;
        if (detections == null || !detections.isArray()) {
            throw new ServiceException("推理响应格式异常: 缺少detections数组", EvalErrorCode.DETECTOR_ERROR);
        }

        List<Detection> result = new ArrayList<>(detections.size());
        for (JsonNode item : detections) {
            result.add(new Detection(
                parseBox(item),
                item.path("confidence").asDouble(),
                item.path("class_id").asInt(-1),
                item.path("class_name").asText("unknown")
            ));
        }
        return result;
    }

    /**
     * 支持两种框格式：bbox 对象 {x1,y1,x2,y2}（像素角点）或 xywhn 数组（归一化中心点）
     */
    private BoundingBox parseBox(JsonNode item) {
        JsonNode bbox = item.get("bbox");
        if (bbox != null && bbox.isObject()) {
            return BoundingBox.ofCorners(
                bbox.path("x1").asDouble(), bbox.path("y1").asDouble(),
                bbox.path("x2").asDouble(), bbox.path("y2").asDouble());
        }
        if (bbox != null && bbox.isArray() && bbox.size() == 4) {
            return BoundingBox.ofCorners(
                bbox.get(0).asDouble(), bbox.get(1).asDouble(),
                bbox.get(2).asDouble(), bbox.get(3).asDouble());
        }
        JsonNode xywhn = item.get("xywhn");
        if (xywhn != null && xywhn.isArray() && xywhn.size() == 4) {
            return BoundingBox.ofCenter(
                xywhn.get(0).asDouble(), xywhn.get(1).asDouble(),
                xywhn.get(2).asDouble(), xywhn.get(3).asDouble());
        }
        throw new ServiceException("推理响应中存在无法识别的边界框", EvalErrorCode.DETECTOR_ERROR);
    }
}
