package org.l5xexport.l5x.dto;

import java.util.List;

/**
 * 数据类型定义（{@code Controller/DataTypes/DataType}）。
 *
 * @param name        Name
 * @param family      Family（例如 StringFamily、NoFamily）
 * @param typeClass   Class（例如 User、Predefined）
 * @param description Description
 * @param members     成员（文档顺序）
 */
public record DataTypeDef(
        String name,
        String family,
        String typeClass,
        String description,
        List<DataTypeMember> members
) {
    public static final String USER_CLASS = "User";

    public boolean isUserDefined() {
        return USER_CLASS.equals(typeClass);
    }
}
