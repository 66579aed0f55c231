package org.l5xexport.l5x.dto;

import java.util.List;

/**
 * 例程及其解码后的逻辑。
 *
 * @param name        Name
 * @param type        声明的 Type 原值（RLL / ST / FBD / SFC / 其它）
 * @param description Description
 * @param logic       逻辑条目，顺序与文档中源元素顺序一致
 */
public record Routine(
        String name,
        String type,
        String description,
        List<LogicItem> logic
) {
}
