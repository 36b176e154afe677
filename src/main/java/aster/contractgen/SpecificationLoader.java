package aster.contractgen;

import aster.contractgen.core.SpecModel.Specification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 从 JSON 加载上游校验器输出的规约树。
 * <p>
 * 多态节点以 {@code kind} 字段区分，未知属性忽略（上游可能附带本生成器不消费的元数据）。
 */
public final class SpecificationLoader {

    private static final Logger LOGGER = Logger.getLogger(SpecificationLoader.class.getName());

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * 从文件加载规约
     *
     * @param file JSON 文件路径
     * @return 规约
     * @throws LoadException 文件不可读或 JSON 结构不合法时抛出
     */
    public Specification load(Path file) throws LoadException {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new LoadException("无法读取规约文件: " + file, e);
        }
        Specification spec = parse(json);
        LOGGER.log(Level.FINE, "已加载规约 {0}（{1}）", new Object[]{spec.name(), file});
        return spec;
    }

    /**
     * 从 JSON 字符串解析规约
     */
    public Specification parse(String json) throws LoadException {
        try {
            Specification spec = mapper.readValue(json, Specification.class);
            if (spec == null) {
                throw new LoadException("规约 JSON 为空");
            }
            return spec;
        } catch (JsonProcessingException e) {
            // 包含 record 构造器必填校验失败的情况
            throw new LoadException("规约 JSON 解析失败: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 规约加载异常
     */
    public static class LoadException extends Exception {
        public LoadException(String message) {
            super(message);
        }

        public LoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
