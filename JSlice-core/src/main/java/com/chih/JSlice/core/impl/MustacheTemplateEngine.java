package com.chih.JSlice.core.impl;

import com.chih.JSlice.core.exception.TemplateRenderException;
import com.chih.JSlice.core.exception.TemplateSyntaxException;
import com.chih.JSlice.core.lexer.MustacheLexer;
import com.chih.JSlice.core.spi.CompiledTemplate;
import com.chih.JSlice.core.spi.RawLexer;
import com.chih.JSlice.core.spi.TemplateEngine;
import com.chih.JSlice.core.undefined.Sentinel;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Iteration;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.reflect.ReflectionObjectHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于 Mustache 的模板引擎实现
 * 支持 {{user.name}}, {{#list}}循环, {{> partial}} 子模板
 * <p>
 * 渲染 SQL 时不做 HTML 转义；上下文中的 {@link Sentinel} 占位值按其自身语义输出与判断真假。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class MustacheTemplateEngine implements TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(MustacheTemplateEngine.class);

    private static final String DEFAULT_TEMPLATE_NAME = "template";

    // mustache.java 异常信息中的位置: "... @[template:3]"
    private static final Pattern LINE_PATTERN = Pattern.compile("@\\[[^\\]]*:(\\d+)\\]");

    private final MustacheLexer lexer = new MustacheLexer();
    private final Function<String, String> partialLoader;

    public MustacheTemplateEngine() {
        this(null);
    }

    /**
     * @param partialLoader 子模板加载器 (输入子模板名称，返回子模板内容)。如果为 null，则不支持子模板。
     */
    public MustacheTemplateEngine(Function<String, String> partialLoader) {
        this.partialLoader = partialLoader;
    }

    @Override
    public String name() {
        return "mustache";
    }

    @Override
    public RawLexer lexer() {
        return lexer;
    }

    @Override
    public Set<String> referencedNames(String template) {
        Set<String> names = new LinkedHashSet<>();
        for (MustacheLexer.Tag tag : lexer.tags(template)) {
            switch (tag.sigil()) {
                case 0, '#', '^', '&', '{' -> {
                    String name = tag.name();
                    int dot = name.indexOf('.');
                    String root = dot < 0 ? name : name.substring(0, dot);
                    if (!root.isEmpty()) {
                        names.add(root);
                    }
                }
                default -> {
                    // 注释、块结束、子模板等不引用变量
                }
            }
        }
        return names;
    }

    /**
     * 编译模板，并记录编译过程中引用到的子模板
     *
     * @throws TemplateSyntaxException 模板语法错误或子模板缺失
     */
    public CompiledTemplate compile(String template, String templateName) {
        String rootName = templateName == null ? DEFAULT_TEMPLATE_NAME : templateName;
        try {
            // 每次编译创建一个临时的 Factory，绑定当前的 partialLoader
            SliceMustacheFactory mf = new SliceMustacheFactory(partialLoader);
            Mustache mustache = mf.compile(new StringReader(template), rootName);
            return new CompiledTemplate(mustache, mf.getRecordedPartials());
        } catch (RuntimeException e) {
            TemplateRenderException known = findRenderException(e);
            if (known != null) {
                throw known;
            }
            int line = lineOf(e);
            log.debug("Failed to compile mustache template {} at line {}", rootName, line, e);
            throw new TemplateSyntaxException("Failed to parse mustache template " + rootName + ": "
                    + e.getMessage(), line, 1, e);
        }
    }

    @Override
    public String render(String template, Map<String, Object> context) {
        CompiledTemplate compiled = compile(template, DEFAULT_TEMPLATE_NAME);
        try {
            Mustache mustache = (Mustache) compiled.getEngineObject();
            StringWriter writer = new StringWriter();
            mustache.execute(writer, context);
            return writer.toString();
        } catch (RuntimeException e) {
            TemplateRenderException known = findRenderException(e);
            if (known != null) {
                throw known;
            }
            log.error("Template execution failed", e);
            throw new TemplateRenderException("Failed to execute mustache template: " + e.getMessage(),
                    lineOf(e), 1, e);
        }
    }

    static int lineOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                Matcher matcher = LINE_PATTERN.matcher(t.getMessage());
                if (matcher.find()) {
                    return Integer.parseInt(matcher.group(1));
                }
            }
        }
        return 1;
    }

    private static TemplateRenderException findRenderException(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TemplateRenderException renderException) {
                return renderException;
            }
        }
        return null;
    }

    /**
     * 认识 {@link Sentinel} 的对象处理器
     */
    static class SentinelObjectHandler extends ReflectionObjectHandler {

        @Override
        public String stringify(Object object) {
            if (object instanceof Sentinel sentinel) {
                return sentinel.toText();
            }
            return super.stringify(object);
        }

        @Override
        public Writer falsey(Iteration iteration, Writer writer, Object object, List<Object> scopes) {
            if (object instanceof Sentinel sentinel) {
                return sentinel.asBool() ? writer : iteration.next(writer, object, scopes);
            }
            return super.falsey(iteration, writer, object, scopes);
        }

        @Override
        public Writer iterate(Iteration iteration, Writer writer, Object object, List<Object> scopes) {
            if (object instanceof Sentinel sentinel) {
                return sentinel.asBool() ? iteration.next(writer, object, scopes) : writer;
            }
            return super.iterate(iteration, writer, object, scopes);
        }
    }

    /**
     * 自定义 Mustache 工厂：关闭 HTML 转义，并从 partialLoader 加载子模板
     * <p>
     * 子模板的递归引用由 mustache.java 自身的递归深度限制兜底，超限时在执行阶段报错。
     * </p>
     */
    private static class SliceMustacheFactory extends DefaultMustacheFactory {
        private final Function<String, String> partialLoader;
        private final Set<String> recordedPartials = new LinkedHashSet<>();

        SliceMustacheFactory(Function<String, String> partialLoader) {
            this.partialLoader = partialLoader;
            setObjectHandler(new SentinelObjectHandler());
        }

        @Override
        public void encode(String value, Writer writer) {
            try {
                writer.write(value);
            } catch (IOException e) {
                throw new MustacheException("Failed to write value", e);
            }
        }

        @Override
        public String resolvePartialPath(String dir, String name, String extension) {
            // 子模板名称原样交给加载器，不拼接目录与扩展名
            return name;
        }

        @Override
        public Reader getReader(String resourceName) {
            // Mustache 调用此方法说明模板中出现了 {{> resourceName}}
            recordedPartials.add(resourceName);
            if (partialLoader != null) {
                String content = partialLoader.apply(resourceName);
                if (content != null) {
                    return new StringReader(content);
                }
            }
            throw new TemplateSyntaxException("Partial template not found: " + resourceName, 1, 1);
        }

        Set<String> getRecordedPartials() {
            return recordedPartials;
        }
    }
}
