package org.l5xexport.l5x.dto;

import java.util.List;

/**
 * @param name             Name
 * @param description      Description
 * @param mainRoutineName  MainRoutineName
 * @param faultRoutineName FaultRoutineName
 * @param disabled         Disabled（缺省 false）
 * @param tags             程序作用域标签
 * @param routines         例程（程序独占，文档顺序）
 */
public record Program(
        String name,
        String description,
        String mainRoutineName,
        String faultRoutineName,
        boolean disabled,
        List<Tag> tags,
        List<Routine> routines
) {
}
