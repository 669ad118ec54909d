package com.spreadsheet.engine.formula.functions;

import com.spreadsheet.engine.formula.CellValueResolver;
import com.spreadsheet.engine.formula.FormulaTokenizer;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.ErrorCode;
import com.spreadsheet.engine.services.LookupTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * A function that returns externally supplied data, such as BID("AAPL")
 * or TRADEBOT("alpha", "winrate"). Arguments are quoted keys or cell references.
 * Data that has not arrived yet yields a placeholder, never an error.
 */
public class DomainLookupFunction implements FormulaFunction {

    private final String name;
    private final int arity;
    private final LookupTable lookupTable;
    private final UnaryOperator<String> placeholder;

    /**
     * @param arity       1 for key-only functions, 2 for key plus field
     * @param placeholder builds the placeholder text from the key
     */
    public DomainLookupFunction(String name, int arity, LookupTable lookupTable, UnaryOperator<String> placeholder) {
        if (arity < 1 || arity > 2) {
            throw new IllegalArgumentException("Lookup functions take a key and an optional field, got arity " + arity);
        }
        this.name = name;
        this.arity = arity;
        this.lookupTable = lookupTable;
        this.placeholder = placeholder;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String apply(List<String> arguments, CellValueResolver resolver) {
        if (arguments.size() != arity) {
            return ErrorCode.ERROR.getCode();
        }
        List<String> keys = new ArrayList<>(arity);
        for (String argument : arguments) {
            String key = resolveKey(argument, resolver);
            if (key == null) {
                return ErrorCode.ERROR.getCode();
            }
            keys.add(key);
        }

        Optional<String> value = arity == 1
                ? lookupTable.find(name, keys.get(0))
                : lookupTable.find(name, keys.get(0), keys.get(1));
        return value.orElseGet(() -> placeholder.apply(keys.get(0)));
    }

    private static String resolveKey(String argument, CellValueResolver resolver) {
        String arg = argument.trim();
        String key = null;
        if (FormulaTokenizer.isQuoted(arg)) {
            key = FormulaTokenizer.unquote(arg);
        } else if (CellAddress.isAddress(arg)) {
            key = resolver.resolveCell(arg);
        }
        return key == null || key.trim().isEmpty() ? null : key.trim();
    }
}
