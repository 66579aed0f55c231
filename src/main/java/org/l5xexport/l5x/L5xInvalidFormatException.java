package org.l5xexport.l5x;

/**
 * 根元素（去掉命名空间后的本地名）与 L5X 约定的根元素不一致。
 */
public class L5xInvalidFormatException extends L5xException {

    private final String foundRoot;
    private final String expectedRoot;

    public L5xInvalidFormatException(String foundRoot, String expectedRoot) {
        super("Invalid L5X file: Root element is '" + foundRoot + "', expected '" + expectedRoot + "'");
        this.foundRoot = foundRoot;
        this.expectedRoot = expectedRoot;
    }

    public String foundRoot() {
        return foundRoot;
    }

    public String expectedRoot() {
        return expectedRoot;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.INVALID_FORMAT;
    }
}
