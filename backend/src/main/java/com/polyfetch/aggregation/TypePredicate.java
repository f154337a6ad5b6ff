package com.polyfetch.aggregation;

/**
 * Matches documents whose field has the given BSON type alias ("number", "string", ...).
 */
public record TypePredicate(String typeAlias) implements FieldPredicate {

    public static final String NUMBER = "number";

    public TypePredicate {
        Stages.requireText(typeAlias, "typeAlias");
    }
}
