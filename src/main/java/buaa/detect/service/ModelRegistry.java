package buaa.detect.service;

import buaa.detect.client.Detector;
import buaa.detect.client.DetectorModel;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 已加载检测模型的注册表
 *
 * <p>以 {@code modelId@device} 为键在多个评测运行之间共享模型。每次 {@link #acquire}
 * 增加引用计数并返回一个租约，关闭租约时归还。引用计数为0的模型只在
 * {@link #evictIdle()} 或 {@link #close()} 时卸载，仍被引用的模型永远不会被卸载。</p>
 */
@Slf4j
@Component
public class ModelRegistry implements AutoCloseable {

    private final Detector detector;
    private final Map<String, Entry> entries = new HashMap<>();

    public ModelRegistry(Detector detector) {
        this.detector = detector;
    }

    /**
     * 获取模型租约，首次使用时加载
     *
     * @throws buaa.detect.common.convention.exception.ModelLoadException 模型无法加载
     */
    public synchronized Lease acquire(String modelId, String device) {
        String key = key(modelId, device);
        Entry entry = entries.get(key);
        if (entry == null) {
            entry = new Entry(detector.loadModel(modelId, device));
            entries.put(key, entry);
        }
        entry.references++;
        return new Lease(key, entry.model);
    }

    public synchronized int referenceCount(String modelId, String device) {
        Entry entry = entries.get(key(modelId, device));
        return entry == null ? 0 : entry.references;
    }

    public synchronized boolean isLoaded(String modelId, String device) {
        return entries.containsKey(key(modelId, device));
    }

    /**
     * 卸载所有空闲模型
     *
     * @return 卸载的模型数
     */
    public int evictIdle() {
        List<DetectorModel> idle = new ArrayList<>();
        synchronized (this) {
            entries.entrySet().removeIf(e -> {
                if (e.getValue().references == 0) {
                    idle.add(e.getValue().model);
                    return true;
                }
                return false;
            });
        }
        idle.forEach(this::unload);
        return idle.size();
    }

    @PreDestroy
    @Override
    public void close() {
        int evicted = evictIdle();
        synchronized (this) {
            if (!entries.isEmpty()) {
                log.warn("关闭时仍有 {} 个模型被引用，暂不卸载: {}", entries.size(), entries.keySet());
            }
        }
        log.info("模型注册表已关闭，卸载空闲模型 {} 个", evicted);
    }

    private synchronized void release(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.references == 0) {
            log.warn("重复归还模型租约: {}", key);
            return;
        }
        entry.references--;
    }

    private void unload(DetectorModel model) {
        try {
            detector.unloadModel(model);
        } catch (RuntimeException e) {
            log.warn("模型卸载失败: {}@{}", model.getModelId(), model.getDevice(), e);
        }
    }

    private static String key(String modelId, String device) {
        return modelId + "@" + device;
    }

    private static final class Entry {
        private final DetectorModel model;
        private int references;

        private Entry(DetectorModel model) {
            this.model = model;
        }
    }

    /**
     * 模型租约，关闭即归还；重复关闭无副作用
     */
    public final class Lease implements AutoCloseable {

        private final String key;
        private final DetectorModel model;
        private boolean released;

        private Lease(String key, DetectorModel model) {
            this.key = key;
            this.model = model;
        }

        public DetectorModel model() {
            return model;
        }

        @Override
        public void close() {
            synchronized (ModelRegistry.this) {
                if (released) {
                    return;
                }
                released = true;
            }
            release(key);
        }
    }
}
