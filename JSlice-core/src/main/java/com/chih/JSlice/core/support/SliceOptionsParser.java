package com.chih.JSlice.core.support;

import com.chih.JSlice.core.domain.SliceOptions;
import com.chih.JSlice.core.exception.OptionsParseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Set;

/**
 * 选项文件解析器
 * <p>
 * 支持 YAML（.yaml / .yml）与 JSON（.json），键名使用 kebab-case：
 * </p>
 *
 * <pre>{@code
 * templater: placeholder
 * param-style: colon
 * unwrap-wrapped-queries: false
 * context:
 *   user_id: 42
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/15
 */
public class SliceOptionsParser {

    private static final Logger log = LoggerFactory.getLogger(SliceOptionsParser.class);

    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".yaml", ".yml", ".json");

    // JSON 是 YAML 的子集，宽松 YAML 映射器两种格式都能读
    private static final ObjectMapper MAPPER = SliceObjectMapperFactory.createLenientMapper();

    /**
     * 判断文件是否为支持的选项文件格式（大小写不敏感）
     */
    public static boolean isSupportedFile(String filename) {
        if (filename == null) {
            return false;
        }
        String lowerFilename = filename.toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(lowerFilename::endsWith);
    }

    /**
     * 解析选项文件；空文件得到默认选项
     *
     * @param is 输入流，调用方负责关闭
     * @param filename 文件名（用于判断文件类型与报错）
     * @throws OptionsParseException 格式不支持或内容无法解析
     * @throws IllegalArgumentException 输入参数无效时抛出
     */
    public static SliceOptions parse(InputStream is, String filename) {
        if (is == null) {
            throw new IllegalArgumentException("InputStream cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        if (!isSupportedFile(filename)) {
            throw new OptionsParseException(filename,
                    new IllegalArgumentException("Unsupported file type, expected one of " + SUPPORTED_EXTENSIONS));
        }

        try {
            byte[] content = is.readAllBytes();
            if (content.length == 0) {
                return new SliceOptions();
            }
            SliceOptions options = MAPPER.readValue(content, SliceOptions.class);
            if (options == null) {
                return new SliceOptions();
            }
            log.debug("Loaded slicing options from {}: {}", filename, options);
            return options;
        } catch (IOException e) {
            log.error("Failed to parse options file: {}. Error: {}", filename, e.getMessage(), e);
            throw new OptionsParseException(filename, e);
        }
    }
}
