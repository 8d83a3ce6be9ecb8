package Powerset.Model;

public class UnknownSymbolException extends AutomatonException {
    private final char symbol;

    public UnknownSymbolException(char symbol) {
        super("Symbol '" + symbol + "' is not part of the alphabet");
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }
}
