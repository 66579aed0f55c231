package org.l5xexport.l5x.dto;

import java.util.List;

/**
 * 任务（{@code Controller/Tasks/Task}）。
 * <p>
 * {@code scheduledPrograms} 只是程序名引用，不校验对应程序是否存在。
 *
 * @param name              Name
 * @param type              Type（CONTINUOUS / PERIODIC / EVENT）
 * @param rate              Rate（ms）
 * @param priority          Priority
 * @param watchdog          Watchdog（ms）
 * @param description       Description
 * @param scheduledPrograms 调度的程序名（文档顺序）
 */
public record TaskDef(
        String name,
        String type,
        String rate,
        String priority,
        String watchdog,
        String description,
        List<String> scheduledPrograms
) {
}
