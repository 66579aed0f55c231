package org.l5xexport.l5x;

/**
 * 例程的逻辑编码方式（{@code Routine@Type}）。
 */
public enum RoutineType {
    RLL,
    ST,
    FBD,
    SFC,
    /** 未识别的类型（包括缺省/空值） */
    OTHER;

    /**
     * 按声明值精确匹配（区分大小写），无法识别时返回 {@link #OTHER}。
     */
    public static RoutineType of(String declared) {
        if (declared == null) {
            return OTHER;
        }
        switch (declared) {
            case "RLL":
                return RLL;
            case "ST":
                return ST;
            case "FBD":
                return FBD;
            case "SFC":
                return SFC;
            default:
                return OTHER;
        }
    }
}
