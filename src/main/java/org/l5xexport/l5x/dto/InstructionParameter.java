package org.l5xexport.l5x.dto;

/**
 * AOI 参数。
 *
 * @param name        Name
 * @param dataType    DataType
 * @param usage       Usage（Input / Output / InOut）
 * @param required    Required（缺省 false）
 * @param visible     Visible（缺省 true）
 * @param description Description
 */
public record InstructionParameter(
        String name,
        String dataType,
        String usage,
        boolean required,
        boolean visible,
        String description
) {
}
