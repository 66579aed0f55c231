package org.l5xexport.report;

/**
 * 报告类别：每个类别恰好产出一个文本文件。
 */
public enum ReportCategory {
    CONTROLLER_INFO("Controller Info", "extract_controller_info.txt", "Project metadata"),
    GLOBAL_TAGS("Global Tags", "extract_tags.txt", "Global (controller-scope) tags"),
    DATA_TYPES("Data Types (UDTs)", "extract_data_types.txt", "User Defined Types (UDTs)"),
    ADD_ON_INSTRUCTIONS("Add-On Instructions", "extract_aoi_definitions.txt", "Add-On Instructions with logic"),
    MODULES("I/O Modules", "extract_modules.txt", "I/O module configuration"),
    TASKS("Tasks", "extract_tasks.txt", "Task scheduling configuration"),
    PROGRAMS("Programs", "extract_programs.txt", "Programs with routines and logic");

    private final String displayName;
    private final String fileName;
    private final String summary;

    ReportCategory(String displayName, String fileName, String summary) {
        this.displayName = displayName;
        this.fileName = fileName;
        this.summary = summary;
    }

    public String displayName() {
        return displayName;
    }

    public String fileName() {
        return fileName;
    }

    public String summary() {
        return summary;
    }
}
