package com.chih.JSlice.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * ObjectMapper 工厂类
 * <p>
 * 统一 YAML / JSON 两种格式的 Jackson 配置：选项文件的读取与 {@code TemplatedFile} 的 JSON 输出共用同一套设置。
 * </p>
 *
 * <h3>配置策略说明：</h3>
 * <ul>
 *   <li>FAIL_ON_UNKNOWN_PROPERTIES: false - 选项文件中可以出现其他工具的配置项</li>
 *   <li>FAIL_ON_EMPTY_BEANS: false</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/10/15
 */
public class SliceObjectMapperFactory {

    /**
     * 创建用于 YAML 解析的 ObjectMapper
     *
     * @return 配置好的 YAML ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createYamlMapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        configure(mapper);
        return mapper;
    }

    /**
     * 创建用于 JSON 解析与输出的 ObjectMapper
     */
    public static ObjectMapper createJsonMapper() {
        ObjectMapper mapper = new ObjectMapper();
        configure(mapper);
        return mapper;
    }

    /**
     * 创建宽松模式的 ObjectMapper（用于手写的选项文件）
     *
     * <pre>{@code
     * # 以下写法与 templater: mustache 等价：
     * templater: [mustache]      # 单值数组 -> 解包为字符串
     * }</pre>
     *
     * @return 配置为宽松模式的 YAML ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createLenientMapper() {
        ObjectMapper mapper = createYamlMapper();

        /* 配置更宽松的反序列化策略，提高用户输入的容错性 */
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        mapper.configure(DeserializationFeature.UNWRAP_SINGLE_VALUE_ARRAYS, true);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_ARRAY_AS_NULL_OBJECT, true);

        return mapper;
    }

    private static void configure(ObjectMapper mapper) {
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }
}
