package org.example.gis2bim.conversion.model;

/**
 * 在已完成（{@link ModelAssembler#finish()}）的装配器上继续写入。属于调用方的使用错误。
 */
public class InvalidStateException extends IllegalStateException {

    public InvalidStateException(String message) {
        super(message);
    }
}
