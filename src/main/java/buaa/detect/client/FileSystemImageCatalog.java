package buaa.detect.client;

import buaa.detect.config.EvaluationConfiguration;
import buaa.detect.dto.EvaluationImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于本地数据集目录的图像来源，文件修改时间视为上传时间
 */
@Slf4j
@Component
public class FileSystemImageCatalog implements ImageCatalog {

    private final Path imagesDir;
    private final Set<String> extensions;

    public FileSystemImageCatalog(EvaluationConfiguration configuration) {
        this.imagesDir = Paths.get(configuration.getDataset().getImagesDir());
        this.extensions = configuration.getDataset().getImageExtensions().stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }

    @Override
    public List<EvaluationImage> findImages(LocalDateTime from, LocalDateTime to) {
        if (!Files.isDirectory(imagesDir)) {
            log.warn("图像目录不存在: {}", imagesDir.toAbsolutePath());
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> stream = Files.walk(imagesDir)) {
            files = stream
                .filter(Files::isRegularFile)
                .filter(this::isImage)
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("扫描图像目录失败: " + imagesDir, e);
        }

        List<EvaluationImage> images = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Path file : files) {
            String filename = file.getFileName().toString();
            if (!seen.add(filename)) {
                log.debug("重复文件名已跳过: {}", file);
                continue;
            }
            LocalDateTime uploadedAt = uploadedAt(file);
            if (from != null && uploadedAt.isBefore(from)) {
                continue;
            }
            if (to != null && uploadedAt.isAfter(to)) {
                continue;
            }
            int[] size = readDimensions(file);
            images.add(new EvaluationImage(filename, file, uploadedAt, size[0], size[1]));
        }
        return images;
    }

    private boolean isImage(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private LocalDateTime uploadedAt(Path file) {
        try {
            return LocalDateTime.ofInstant(Files.getLastModifiedTime(file).toInstant(), ZoneId.systemDefault());
        } catch (IOException e) {
            throw new UncheckedIOException("读取文件时间失败: " + file, e);
        }
    }

    /**
     * 只读取图像头部获取宽高，读取失败时返回 {0, 0}
     */
    private int[] readDimensions(Path file) {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input == null) {
                return new int[] {0, 0};
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return new int[] {0, 0};
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input);
                return new int[] {reader.getWidth(0), reader.getHeight(0)};
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.warn("读取图像尺寸失败: {}", file, e);
            return new int[] {0, 0};
        }
    }
}
