package org.l5xexport.l5x;

/**
 * 导出失败的分类（用于命令行提示与退出码）。
 */
public enum ErrorCategory {
    /** 输入文件不存在 */
    NOT_FOUND,
    /** XML 不是合法/良构的文档 */
    PARSE_ERROR,
    /** 根元素不是 L5X 约定的根元素 */
    INVALID_FORMAT,
    /** 其它未预期的失败（抽取、格式化、写文件等） */
    UNEXPECTED
}
