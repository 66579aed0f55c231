package org.l5xexport.l5x.dto;

/**
 * UDT 成员。
 *
 * @param name        Name
 * @param dataType    DataType
 * @param dimension   Dimension（标量为空串）
 * @param radix       Radix
 * @param hidden      Hidden（缺省 false；BOOL 成员常被编译器生成隐藏的宿主成员）
 * @param description Description
 */
public record DataTypeMember(
        String name,
        String dataType,
        String dimension,
        String radix,
        boolean hidden,
        String description
) {
}
