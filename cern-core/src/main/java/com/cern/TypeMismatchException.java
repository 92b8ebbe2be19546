package com.cern;

import com.cern.ast.VarType;

/**
 * Both operands of an arithmetic operator have a resolved type and the types differ.
 */
public class TypeMismatchException extends ParseException {
    private final VarType left;
    private final TokenType operator;
    private final VarType right;

    public TypeMismatchException(VarType left, TokenType operator, VarType right, int line) {
        super("wrong operation:", left.displayName() + " " + operator.displayName() + " " + right.displayName(), line);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public VarType getLeft() {
        return left;
    }

    public TokenType getOperator() {
        return operator;
    }

    public VarType getRight() {
        return right;
    }
}
