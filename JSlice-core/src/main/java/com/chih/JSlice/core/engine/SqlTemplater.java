package com.chih.JSlice.core.engine;

import com.chih.JSlice.core.domain.LinePosition;
import com.chih.JSlice.core.domain.RawSpan;
import com.chih.JSlice.core.domain.SliceOptions;
import com.chih.JSlice.core.domain.SpanKind;
import com.chih.JSlice.core.domain.TemplatedFile;
import com.chih.JSlice.core.domain.TemplaterResult;
import com.chih.JSlice.core.domain.TemplaterViolation;
import com.chih.JSlice.core.exception.TemplateRenderException;
import com.chih.JSlice.core.impl.NoOpSliceMetrics;
import com.chih.JSlice.core.slice.SliceAlignment;
import com.chih.JSlice.core.slice.TemplateSlicer;
import com.chih.JSlice.core.spi.SliceMetrics;
import com.chih.JSlice.core.spi.TemplateEngine;
import com.chih.JSlice.core.support.TemplatedFileJson;
import com.chih.JSlice.core.undefined.UndefinedSet;
import com.chih.JSlice.core.undefined.UndefinedTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模板处理入口：词法扫描、渲染、对齐，并收集未定义变量
 * <p>
 * 每次调用 {@link #process} 都使用独立的 {@link UndefinedSet} 与上下文副本，
 * 因此同一实例可以被多个线程同时使用。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/15
 */
public class SqlTemplater {

    private static final Logger log = LoggerFactory.getLogger(SqlTemplater.class);

    private final TemplateEngine engine;
    private final SliceOptions options;
    private final SliceMetrics metrics;
    private final TemplateSlicer slicer;

    public SqlTemplater(TemplateEngine engine, SliceOptions options, SliceMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.options = options != null ? options : new SliceOptions();
        this.metrics = metrics != null ? metrics : new NoOpSliceMetrics();
        this.slicer = new TemplateSlicer(this.options.isUnwrapWrappedQueries());
    }

    public SqlTemplater(TemplateEngine engine) {
        this(engine, new SliceOptions(), new NoOpSliceMetrics());
    }

    /**
     * @throws com.chih.JSlice.core.exception.TemplaterConfigException 配置中的引擎无法创建
     */
    public static SqlTemplater fromOptions(SliceOptions options) {
        return new SqlTemplater(TemplateEngineFactory.create(options), options, new NoOpSliceMetrics());
    }

    public TemplaterResult process(String rawText, String fileName) {
        return process(rawText, fileName, Map.of());
    }

    /**
     * 处理一个模板文件
     *
     * @param rawText 原始模板文本
     * @param fileName 文件名，仅用于日志与报错
     * @param variables 额外的变量，覆盖配置中的同名变量
     * @throws TemplateRenderException 模板语法错误或渲染失败
     */
    public TemplaterResult process(String rawText, String fileName, Map<String, Object> variables) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            List<RawSpan> spans = engine.lexer().lex(rawText);

            Map<String, Object> context = new LinkedHashMap<>(options.getContext());
            if (variables != null) {
                context.putAll(variables);
            }
            UndefinedSet undefinedSet = new UndefinedSet();
            UndefinedTracker tracker = new UndefinedTracker(options.isIgnoreTemplating(), undefinedSet);
            Map<String, Object> live = tracker.install(context, engine.referencedNames(rawText));

            SliceAlignment alignment = slicer.slice(rawText, spans, text -> engine.render(text, live));
            TemplatedFile templatedFile = alignment.toTemplatedFile(rawText, fileName);

            Set<String> undefinedNames = undefinedSet.names();
            List<TemplaterViolation> violations = violationsFor(templatedFile, undefinedNames);
            if (!violations.isEmpty()) {
                log.debug("Undefined variables in {}: {}", fileName, undefinedNames);
            }
            if (log.isTraceEnabled()) {
                log.trace("Templated file {}: {}", fileName, TemplatedFileJson.toJson(templatedFile));
            }
            success = true;
            return new TemplaterResult(templatedFile, undefinedNames, violations);
        } catch (TemplateRenderException e) {
            log.error("Failed to render template {} at line {}, position {}: {}",
                    fileName, e.getLineNo(), e.getLinePos(), e.getMessage());
            throw e;
        } finally {
            metrics.recordSlice(fileName, System.nanoTime() - start, success);
        }
    }

    /**
     * 每个未定义名称定位到其根名称在模板表达式中的首次出现；找不到时记在第 1 行第 1 列
     */
    static List<TemplaterViolation> violationsFor(TemplatedFile templatedFile, Set<String> undefinedNames) {
        List<TemplaterViolation> violations = new ArrayList<>();
        for (String name : undefinedNames) {
            int dot = name.indexOf('.');
            String root = dot < 0 ? name : name.substring(0, dot);
            int position = firstReference(templatedFile.getRawSpans(), root);
            LinePosition location = position >= 0
                    ? templatedFile.lineAndPosition(position, true)
                    : new LinePosition(1, 1);
            violations.add(new TemplaterViolation("Undefined template variable: '" + name + "'",
                    location.line(), location.position()));
        }
        return violations;
    }

    private static int firstReference(List<RawSpan> spans, String root) {
        Pattern pattern = Pattern.compile("(?<![\\w.])" + Pattern.quote(root) + "(?!\\w)");
        for (RawSpan span : spans) {
            if (span.getKind() == SpanKind.LITERAL || span.getKind() == SpanKind.ESCAPED) {
                continue;
            }
            Matcher matcher = pattern.matcher(span.getText());
            if (matcher.find()) {
                return span.getSourceOffset() + matcher.start();
            }
        }
        return -1;
    }

    public TemplateEngine getEngine() {
        return engine;
    }

    public SliceOptions getOptions() {
        return options;
    }
}
