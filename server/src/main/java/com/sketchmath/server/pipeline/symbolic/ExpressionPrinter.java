package com.sketchmath.server.pipeline.symbolic;

/**
 * Renders trees back to text with the fewest parentheses that keep the
 * structure. The spaced form is used in step traces ("2 + 2"); the compact form
 * drops the spaces around sums ("3+4=10").
 */
public final class ExpressionPrinter implements ExprVisitor<String> {

    private static final ExpressionPrinter SPACED = new ExpressionPrinter(false);
    private static final ExpressionPrinter COMPACT = new ExpressionPrinter(true);

    private final boolean compact;

    private ExpressionPrinter(boolean compact) {
        this.compact = compact;
    }

    public static String print(Expr expr) {
        return expr.accept(SPACED);
    }

    public static String print(Expr expr, boolean compact) {
        return expr.accept(compact ? COMPACT : SPACED);
    }

    public static String print(Equation equation, boolean compact) {
        ExpressionPrinter printer = compact ? COMPACT : SPACED;
        String separator = compact ? "=" : " = ";
        return equation.getLeft().accept(printer) + separator + equation.getRight().accept(printer);
    }

    @Override
    public String visitNumber(NumberLiteral number) {
        return number.getLiteral();
    }

    @Override
    public String visitSymbol(Symbol symbol) {
        return symbol.getName();
    }

    @Override
    public String visitConstant(Constant constant) {
        return constant.getName();
    }

    @Override
    public String visitNegation(Negation negation) {
        Expr operand = negation.getOperand();
        boolean wrap = operand.precedence() == Expr.PRECEDENCE_SUM || operand instanceof Negation;
        return "-" + wrapIf(operand, wrap);
    }

    @Override
    public String visitBinary(BinaryOperation operation) {
        BinaryOperation.Operator op = operation.getOperator();
        Expr left = operation.getLeft();
        Expr right = operation.getRight();

        boolean wrapLeft = left.precedence() < op.getPrecedence()
                || (op == BinaryOperation.Operator.POWER && left.precedence() <= op.getPrecedence());
        boolean wrapRight = right.precedence() < op.getPrecedence()
                || right instanceof Negation
                || ((op == BinaryOperation.Operator.SUBTRACT || op == BinaryOperation.Operator.DIVIDE)
                        && right.precedence() == op.getPrecedence());

        String symbol = String.valueOf(op.getSymbol());
        if (!compact && op.getPrecedence() == Expr.PRECEDENCE_SUM) {
            symbol = " " + symbol + " ";
        }
        return wrapIf(left, wrapLeft) + symbol + wrapIf(right, wrapRight);
    }

    @Override
    public String visitFunction(FunctionCall call) {
        return call.getName() + "(" + call.getArgument().accept(this) + ")";
    }

    private String wrapIf(Expr expr, boolean wrap) {
        String text = expr.accept(this);
        return wrap ? "(" + text + ")" : text;
    }
}
