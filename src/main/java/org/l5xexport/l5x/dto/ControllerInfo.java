package org.l5xexport.l5x.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 控制器元信息：{@code Controller} 元素属性的副本，外加 {@code Description}。
 * <p>
 * 持有的是独立的不可变副本，调用方无法借此修改已解析的文档树。
 *
 * @param fields 属性名 -> 值
 */
public record ControllerInfo(Map<String, String> fields) {

    public ControllerInfo {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ControllerInfo empty() {
        return new ControllerInfo(Map.of());
    }

    public String get(String key) {
        return fields.get(key);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
