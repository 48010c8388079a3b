package com.shardmesh.engine.expression;

public class ExpressionException extends RuntimeException {
    public ExpressionException(String message) {
        super(message);
    }
}
