package org.l5xexport.l5x.dto;

import java.util.List;

/**
 * Add-On Instruction 定义。
 *
 * @param name        Name
 * @param revision    Revision
 * @param vendor      Vendor
 * @param description Description
 * @param parameters  参数（文档顺序）
 * @param localTags   本地标签（文档顺序）
 * @param routines    例程（AOI 独占，文档顺序）
 */
public record InstructionDef(
        String name,
        String revision,
        String vendor,
        String description,
        List<InstructionParameter> parameters,
        List<Tag> localTags,
        List<Routine> routines
) {
}
