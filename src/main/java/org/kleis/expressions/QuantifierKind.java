package org.kleis.expressions;

public enum QuantifierKind {
    FOR_ALL("∀"),
    EXISTS("∃");

    private final String symbol;

    QuantifierKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
