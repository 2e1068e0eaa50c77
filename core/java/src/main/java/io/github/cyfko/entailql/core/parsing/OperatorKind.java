package io.github.cyfko.entailql.core.parsing;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Logical operators recognised in formulas, declared in order of increasing precedence.
 *
 * <table>
 *   <caption>Operator table</caption>
 *   <tr><th>kind</th><th>symbol</th><th>arity</th><th>precedence</th></tr>
 *   <tr><td>IMPLIES</td><td>{@code =>}</td><td>binary</td><td>0</td></tr>
 *   <tr><td>OR</td><td>{@code v}</td><td>binary</td><td>1</td></tr>
 *   <tr><td>AND</td><td>{@code ^}</td><td>binary</td><td>2</td></tr>
 *   <tr><td>NOT</td><td>{@code ~}</td><td>unary prefix</td><td>3</td></tr>
 * </table>
 * <p>
 * Binary operators are left-associative.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OperatorKind {
    IMPLIES("=>", 2),
    OR("v", 2),
    AND("^", 2),
    NOT("~", 1);

    private static final List<OperatorKind> BY_PRECEDENCE = List.of(values());

    private final String symbol;
    private final int arity;

    OperatorKind(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public String symbol() {
        return symbol;
    }

    public int arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    /**
     * Returns the precedence rank of this operator; higher binds tighter.
     *
     * @return rank from 0 ({@link #IMPLIES}) to 3 ({@link #NOT})
     */
    public int precedence() {
        return ordinal();
    }

    /**
     * Returns every operator ordered from lowest to highest precedence.
     *
     * @return immutable list of operators
     */
    public static List<OperatorKind> byPrecedence() {
        return BY_PRECEDENCE;
    }

    /**
     * Looks up an operator by its symbol.
     *
     * @param symbol the operator text, already lower-cased
     * @return the operator, or empty if the symbol is unknown
     */
    public static Optional<OperatorKind> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
