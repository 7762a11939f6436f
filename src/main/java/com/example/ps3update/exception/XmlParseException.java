package com.example.ps3update.exception;

/**
 * 更新元数据 XML 无法解析
 */
public class XmlParseException extends Ps3UpdateException {

    public XmlParseException(String message, Throwable cause) {
        super("XML parsing error: " + message, cause);
    }
}
