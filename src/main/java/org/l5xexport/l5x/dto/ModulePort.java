package org.l5xexport.l5x.dto;

/**
 * @param id       Id
 * @param address  Address
 * @param type     Type
 * @param upstream Upstream（缺省 false）
 */
public record ModulePort(
        String id,
        String address,
        String type,
        boolean upstream
) {
}
