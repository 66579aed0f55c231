package org.l5xexport.l5x.dto;

import java.util.List;

/**
 * I/O 模块（{@code Controller/Modules/Module}）。
 *
 * @param name            Name
 * @param catalogNumber   CatalogNumber
 * @param parentModule    ParentModule（无父模块时为空串）
 * @param parentModPortId ParentModPortId
 * @param description     Description
 * @param ports           端口列表
 */
public record IoModule(
        String name,
        String catalogNumber,
        String parentModule,
        String parentModPortId,
        String description,
        List<ModulePort> ports
) {
    public boolean hasParent() {
        return !parentModule.isEmpty();
    }
}
