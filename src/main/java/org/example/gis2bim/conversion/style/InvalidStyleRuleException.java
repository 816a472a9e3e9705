package org.example.gis2bim.conversion.style;

/**
 * 样式表格式错误。加载阶段抛出，转换不会开始。
 */
public class InvalidStyleRuleException extends IllegalArgumentException {

    public InvalidStyleRuleException(String message) {
        super(message);
    }

    public InvalidStyleRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
