package com.sketchmath.server.pipeline.symbolic;

public interface ExprVisitor<T> {

    T visitNumber(NumberLiteral number);

    T visitSymbol(Symbol symbol);

    T visitConstant(Constant constant);

    T visitNegation(Negation negation);

    T visitBinary(BinaryOperation operation);

    T visitFunction(FunctionCall call);
}
