package buaa.detect.service;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 基于文件名哈希的确定性K折划分
 *
 * <p>折号 = MD5(文件名的UTF-8字节) 作为无符号大端整数对 k 取模，
 * 与进程、运行次数和实现语言无关。调用方负责在划分前剔除没有真实标注的图像。</p>
 */
@Component
public class FoldPartitioner {

    public int foldIndex(String filename, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("折数必须为正整数: " + k);
        }
        byte[] digest = DigestUtils.md5(filename.getBytes(StandardCharsets.UTF_8));
        return new BigInteger(1, digest).mod(BigInteger.valueOf(k)).intValue();
    }

    /**
     * 将条目划分到 k 个折中；结果包含 0..k-1 全部折号，空折对应空列表
     */
    public <T> Map<Integer, List<T>> partition(List<T> items, Function<T, String> filenameOf, int k) {
        Map<Integer, List<T>> folds = new LinkedHashMap<>();
        for (int fold = 0; fold < k; fold++) {
            folds.put(fold, new ArrayList<>());
        }
        for (T item : items) {
            folds.get(foldIndex(filenameOf.apply(item), k)).add(item);
        }
        return folds;
    }
}
