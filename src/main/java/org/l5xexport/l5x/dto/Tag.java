package org.l5xexport.l5x.dto;

/**
 * 标签（控制器作用域 / 程序作用域 / AOI 本地标签）。
 *
 * @param name        Name
 * @param dataType    DataType
 * @param usage       Usage（缺省为 {@code Local}）
 * @param aliasFor    AliasFor（非别名时为空串）
 * @param radix       Radix
 * @param description Description（已压平为单行）
 */
public record Tag(
        String name,
        String dataType,
        String usage,
        String aliasFor,
        String radix,
        String description
) {
    public boolean isAlias() {
        return !aliasFor.isEmpty();
    }
}
