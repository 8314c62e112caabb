package com.cellsafety.analysis.instrument;

import com.cellsafety.analysis.syntax.Ast.ExprContext;
import com.cellsafety.analysis.syntax.Ast.TracerCall;

import java.util.List;

/**
 * Runtime handle that instrumented cells call back into.
 *
 * Every hook but {@link #key} returns its first argument unchanged, so an instrumented expression
 * evaluates to the same value as the original one. A host evaluating {@link TracerCall} nodes passes the
 * evaluated arguments to {@link #dispatch}.
 */
public interface TracingHooks {

    /** Called with the evaluated base of every attribute or subscript access. */
    Object begin(Object obj, Object key, boolean isSubscript, ExprContext ctx,
                 boolean inCallPosition, boolean makeActive);

    /** Called with the value of the outermost link of an access chain. */
    Object end(Object obj);

    /** Called with each bare-identifier argument of a method call. */
    Object recordArgument(Object obj, String name);

    /**
     * Returns the key of the latest {@link #begin}. A traced subscript indexes with this instead
     * of evaluating its index expression a second time.
     */
    Object key();

    default Object dispatch(TracerCall.Hook hook, List<Object> args) {
        switch (hook) {
            case BEGIN:
                return begin(args.get(0), args.get(1), (Boolean) args.get(2), (ExprContext) args.get(3),
                        (Boolean) args.get(4), (Boolean) args.get(5));
            case END:
                return end(args.get(0));
            case RECORD_ARGUMENT:
                return recordArgument(args.get(0), (String) args.get(1));
            case KEY:
                return key();
            default:
                throw new IllegalArgumentException("unknown hook " + hook);
        }
    }
}
