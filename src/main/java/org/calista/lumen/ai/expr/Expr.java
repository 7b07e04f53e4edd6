package org.calista.lumen.ai.expr;

import java.util.Objects;

/**
 * Expr — arithmetic AST.
 *
 * <p>The node set is closed: a literal, a unary sign and a binary operator. Every consumer
 * goes through {@link Visitor}, so adding a node kind breaks compilation of every walker
 * instead of slipping past a runtime type check.</p>
 */
public sealed interface Expr permits Expr.NumberLiteral, Expr.UnaryOp, Expr.BinaryOp {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitNumber(NumberLiteral n);

        R visitUnary(UnaryOp u);

        R visitBinary(BinaryOp b);
    }

    // ---------------------------------------------------------------------
    // Nodes
    // ---------------------------------------------------------------------

    record NumberLiteral(double value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record UnaryOp(Sign op, Expr operand) implements Expr {

        public enum Sign {
            POS("+"), NEG("-");

            public final String symbol;

            Sign(String symbol) {
                this.symbol = symbol;
            }
        }

        public UnaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public String toString() {
            return "(" + op.symbol + operand + ")";
        }
    }

    record BinaryOp(Operator op, Expr left, Expr right) implements Expr {

        public enum Operator {
            ADD("+"), SUB("-"), MUL("*"), DIV("/"), FLOOR_DIV("//"), MOD("%"), POW("**");

            public final String symbol;

            Operator(String symbol) {
                this.symbol = symbol;
            }
        }

        public BinaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.symbol + " " + right + ")";
        }
    }
}
