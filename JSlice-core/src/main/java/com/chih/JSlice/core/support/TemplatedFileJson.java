package com.chih.JSlice.core.support;

import com.chih.JSlice.core.domain.TemplatedFile;
import com.chih.JSlice.core.exception.JSliceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link TemplatedFile} 的 JSON 输出，用于调试与外部工具对接
 *
 * @author lizhiyuan
 * @since 2026/10/15
 */
public final class TemplatedFileJson {

    private static final ObjectMapper MAPPER = SliceObjectMapperFactory.createJsonMapper();

    private TemplatedFileJson() {
    }

    public static String toJson(TemplatedFile templatedFile) {
        try {
            return MAPPER.writeValueAsString(templatedFile);
        } catch (JsonProcessingException e) {
            throw new JSliceException("Failed to serialize templated file " + templatedFile.getFileName(), e);
        }
    }
}
