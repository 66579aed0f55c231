package org.l5xexport.l5x;

/**
 * XML 不是良构文档；消息中保留底层解析器的诊断信息。
 */
public class L5xParseException extends L5xException {

    public L5xParseException(String parserMessage, Throwable cause) {
        super("XML Parsing Error: " + parserMessage, cause);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.PARSE_ERROR;
    }
}
