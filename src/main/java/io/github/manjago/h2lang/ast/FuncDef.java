package io.github.manjago.h2lang.ast;

import java.util.List;
import java.util.Map;

/**
 * Function definition. A definition without parameters is a macro.
 *
 * @param name       single lowercase letter
 * @param params     parameter letters in declaration order
 * @param paramTypes inferred type of every parameter
 * @param body       expression substituted at call sites
 */
public record FuncDef(
    char name,
    List<Character> params,
    Map<Character, ParamType> paramTypes,
    Expr body,
    Span span
) {

    public FuncDef {
        params = List.copyOf(params);
        paramTypes = Map.copyOf(paramTypes);
    }

    public boolean isMacro() {
        return params.isEmpty();
    }

    public int arity() {
        return params.size();
    }

    public ParamType typeOf(char param) {
        return paramTypes.getOrDefault(param, ParamType.COMMAND_SEQUENCE);
    }
}
