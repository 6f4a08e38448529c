package com.chih.JSlice.core.spi;

import java.util.Set;

/**
 * 编译后的模板及其引用的子模板
 * @author lizhiyuan
 * @since 2026/10/14
*/
public class CompiledTemplate {
    
    // 具体的模板引擎对象 (如 Mustache)
    private final Object engineObject;
    
    // 编译过程中遇到的 partial 名称
    private final Set<String> partials;
    
    public CompiledTemplate(Object engineObject, Set<String> partials) {
        this.engineObject = engineObject;
        this.partials = partials;
    }
    
    public Object getEngineObject() {
        return engineObject;
    }
    
    public Set<String> getPartials() {
        return partials;
    }
}
