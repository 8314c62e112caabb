package com.cellsafety.analysis.syntax;

import com.cellsafety.analysis.syntax.Ast.*;
import com.cellsafety.analysis.syntax.Ast.Module;
import com.cellsafety.analysis.syntax.Tokenizer.Kind;
import com.cellsafety.analysis.syntax.Tokenizer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the cell language, an indentation-structured subset of Python:
 * assignments, control flow, function/lambda/class definitions, with/try blocks and imports.
 * Comprehensions, decorators and global/nonlocal declarations are rejected.
 */
public class CellParser {

    public static class ParseException extends RuntimeException {
        private final int line;

        public ParseException(String message, int line) {
            super("line " + line + ": " + message);
            this.line = line;
        }

        public int getLine() { return line; }
    }

    private static final Set<String> COMPARISON_OPS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private static final Set<String> AUGMENTED_OPS = Set.of(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

    private static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
        "return", "try", "while", "with", "yield");

    private List<Token> tokens;
    private int pos;

    /** Parses a whole cell. */
    public Module parse(String source) {
        tokens = new Tokenizer(source).tokenize();
        pos = 0;
        List<Stmt> body = new ArrayList<>();
        while (peek().kind() != Kind.EOF) {
            if (accept(Kind.NEWLINE)) continue;
            body.addAll(statement());
        }
        return new Module(List.copyOf(body));
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    private List<Stmt> statement() {
        Token t = peek();
        if (t.kind() == Kind.NAME) {
            switch (t.text()) {
                case "if":    return List.of(ifStatement());
                case "while": return List.of(whileStatement());
                case "for":   return List.of(forStatement());
                case "with":  return List.of(withStatement());
                case "def":   return List.of(functionDef(false));
                case "class": return List.of(classDef());
                case "try":   return List.of(tryStatement());
                case "async": {
                    next();
                    if (!peek().is(Kind.NAME, "def")) {
                        throw error("only 'async def' is supported");
                    }
                    return List.of(functionDef(true));
                }
                default: break;
            }
        }
        if (t.is(Kind.OP, "@")) {
            throw error("decorators are not supported");
        }
        return simpleStatements();
    }

    private List<Stmt> simpleStatements() {
        List<Stmt> result = new ArrayList<>();
        result.add(smallStatement());
        while (acceptOp(";")) {
            if (peek().kind() == Kind.NEWLINE || peek().kind() == Kind.EOF) break;
            result.add(smallStatement());
        }
        if (!accept(Kind.NEWLINE) && peek().kind() != Kind.EOF) {
            throw error("expected end of statement");
        }
        return result;
    }

    private Stmt smallStatement() {
        Token t = peek();
        int line = t.line();
        if (t.kind() == Kind.NAME) {
            switch (t.text()) {
                case "pass":     next(); return new Pass(line);
                case "break":    next(); return new Break(line);
                case "continue": next(); return new Continue(line);
                case "return": {
                    next();
                    Expr value = atStatementEnd() ? null : testList();
                    return new Return(line, value);
                }
                case "raise": {
                    next();
                    Expr exc = atStatementEnd() ? null : test();
                    return new Raise(line, exc);
                }
                case "import": return importStatement();
                case "from":   return fromImportStatement();
                case "global", "nonlocal", "del", "assert", "yield":
                    throw error("'" + t.text() + "' statements are not supported");
                default: break;
            }
        }

        Expr first = testList();
        if (peek().kind() == Kind.OP && AUGMENTED_OPS.contains(peek().text())) {
            String op = next().text();
            op = op.substring(0, op.length() - 1);
            Expr target = toTarget(first, ExprContext.AUG_STORE);
            Expr value = testList();
            return new AugAssign(line, target, op, value);
        }
        if (peek().is(Kind.OP, "=")) {
            List<Expr> targets = new ArrayList<>();
            Expr value = first;
            while (acceptOp("=")) {
                targets.add(toTarget(value, ExprContext.STORE));
                value = testList();
            }
            return new Assign(line, List.copyOf(targets), value);
        }
        return new ExprStmt(line, first);
    }

    private Stmt importStatement() {
        int line = expectName("import").line();
        List<Alias> names = new ArrayList<>();
        do {
            String name = dottedName();
            String asName = acceptName("as") ? identifier() : null;
            names.add(new Alias(name, asName));
        } while (acceptOp(","));
        return new Import(line, null, List.copyOf(names));
    }

    private Stmt fromImportStatement() {
        int line = expectName("from").line();
        StringBuilder module = new StringBuilder();
        while (peek().is(Kind.OP, ".") || peek().is(Kind.OP, "...")) {
            module.append(next().text());
        }
        if (!peek().is(Kind.NAME, "import")) {
            module.append(dottedName());
        }
        expectName("import");
        List<Alias> names = new ArrayList<>();
        boolean parenthesized = acceptOp("(");
        if (acceptOp("*")) {
            names.add(new Alias("*", null));
        } else {
            do {
                if (parenthesized && peek().is(Kind.OP, ")")) break;
                String name = identifier();
                String asName = acceptName("as") ? identifier() : null;
                names.add(new Alias(name, asName));
            } while (acceptOp(","));
        }
        if (parenthesized) expectOp(")");
        return new Import(line, module.toString(), List.copyOf(names));
    }

    private Stmt ifStatement() {
        int line = next().line(); // 'if' or 'elif'
        Expr test = namedTest();
        expectOp(":");
        List<Stmt> body = block();
        List<Stmt> orElse = List.of();
        if (peek().is(Kind.NAME, "elif")) {
            orElse = List.of(ifStatement());
        } else if (acceptName("else")) {
            expectOp(":");
            orElse = block();
        }
        return new If(line, test, body, orElse);
    }

    private Stmt whileStatement() {
        int line = expectName("while").line();
        Expr test = namedTest();
        expectOp(":");
        List<Stmt> body = block();
        List<Stmt> orElse = acceptElseBlock();
        return new While(line, test, body, orElse);
    }

    private Stmt forStatement() {
        int line = expectName("for").line();
        Expr target = toTarget(exprList(), ExprContext.STORE);
        expectName("in");
        Expr iter = testList();
        expectOp(":");
        List<Stmt> body = block();
        List<Stmt> orElse = acceptElseBlock();
        return new For(line, target, iter, body, orElse);
    }

    private Stmt withStatement() {
        int line = expectName("with").line();
        List<WithItem> items = new ArrayList<>();
        do {
            Expr context = test();
            Expr vars = acceptName("as") ? toTarget(expr(), ExprContext.STORE) : null;
            items.add(new WithItem(context, vars));
        } while (acceptOp(","));
        expectOp(":");
        return new With(line, List.copyOf(items), block());
    }

    private Stmt functionDef(boolean async) {
        int line = expectName("def").line();
        String name = identifier();
        expectOp("(");
        Arguments args = parameters(")", true);
        expectOp(")");
        if (acceptOp("->")) {
            test();
        }
        expectOp(":");
        return new FunctionDef(line, name, args, block(), async);
    }

    private Stmt classDef() {
        int line = expectName("class").line();
        String name = identifier();
        List<Expr> bases = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        if (acceptOp("(")) {
            callArguments(bases, keywords);
            expectOp(")");
        }
        expectOp(":");
        return new ClassDef(line, name, List.copyOf(bases), List.copyOf(keywords), block());
    }

    private Stmt tryStatement() {
        int line = expectName("try").line();
        expectOp(":");
        List<Stmt> body = block();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (peek().is(Kind.NAME, "except")) {
            int handlerLine = next().line();
            Expr type = null;
            String name = null;
            if (!peek().is(Kind.OP, ":")) {
                type = test();
                if (acceptName("as")) name = identifier();
            }
            expectOp(":");
            handlers.add(new ExceptHandler(handlerLine, type, name, block()));
        }
        List<Stmt> orElse = acceptElseBlock();
        List<Stmt> finalBody = List.of();
        if (acceptName("finally")) {
            expectOp(":");
            finalBody = block();
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error("try statement needs an except or finally clause");
        }
        return new Try(line, body, List.copyOf(handlers), orElse, finalBody);
    }

    private List<Stmt> acceptElseBlock() {
        if (!acceptName("else")) return List.of();
        expectOp(":");
        return block();
    }

    private List<Stmt> block() {
        if (!accept(Kind.NEWLINE)) {
            return List.copyOf(simpleStatements());
        }
        if (!accept(Kind.INDENT)) {
            throw error("expected an indented block");
        }
        List<Stmt> body = new ArrayList<>();
        while (!accept(Kind.DEDENT)) {
            if (peek().kind() == Kind.EOF) break;
            if (accept(Kind.NEWLINE)) continue;
            body.addAll(statement());
        }
        return List.copyOf(body);
    }

    private Arguments parameters(String terminator, boolean allowAnnotations) {
        List<Param> positional = new ArrayList<>();
        List<Param> keywordOnly = new ArrayList<>();
        Param vararg = null;
        Param kwarg = null;
        boolean afterStar = false;
        while (!peek().is(Kind.OP, terminator)) {
            if (acceptOp("**")) {
                kwarg = new Param(parameterName(allowAnnotations), null);
            } else if (acceptOp("*")) {
                afterStar = true;
                if (!peek().is(Kind.OP, ",") && !peek().is(Kind.OP, terminator)) {
                    vararg = new Param(parameterName(allowAnnotations), null);
                }
            } else if (acceptOp("/")) {
                // positional-only marker
            } else {
                String name = parameterName(allowAnnotations);
                Expr defaultValue = acceptOp("=") ? test() : null;
                (afterStar ? keywordOnly : positional).add(new Param(name, defaultValue));
            }
            if (!acceptOp(",")) break;
        }
        return new Arguments(List.copyOf(positional), vararg, List.copyOf(keywordOnly), kwarg);
    }

    private String parameterName(boolean allowAnnotations) {
        String name = identifier();
        if (allowAnnotations && acceptOp(":")) {
            test();
        }
        return name;
    }

    // -----------------------------------------------------------------------
    // Targets
    // -----------------------------------------------------------------------

    private Expr toTarget(Expr e, ExprContext ctx) {
        if (e instanceof Name n) {
            return new Name(n.line(), n.id(), ctx);
        } else if (e instanceof Attribute a) {
            return new Attribute(a.line(), a.value(), a.attr(), ctx);
        } else if (e instanceof Subscript s) {
            return new Subscript(s.line(), s.value(), s.slice(), ctx);
        } else if (e instanceof TupleExpr t && ctx != ExprContext.AUG_STORE) {
            return new TupleExpr(t.line(), t.elts().stream().map(x -> toTarget(x, ctx)).toList(), ctx);
        } else if (e instanceof ListExpr l && ctx != ExprContext.AUG_STORE) {
            return new ListExpr(l.line(), l.elts().stream().map(x -> toTarget(x, ctx)).toList(), ctx);
        } else if (e instanceof Starred s && ctx != ExprContext.AUG_STORE) {
            return new Starred(s.line(), toTarget(s.value(), ctx), ctx);
        }
        throw new ParseException("cannot assign to " + e.getClass().getSimpleName(), e.line());
    }

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    private Expr testList() {
        int line = peek().line();
        Expr first = starOrTest();
        if (!peek().is(Kind.OP, ",")) return first;
        List<Expr> elts = new ArrayList<>(List.of(first));
        while (acceptOp(",")) {
            if (atExpressionEnd()) break;
            elts.add(starOrTest());
        }
        return new TupleExpr(line, List.copyOf(elts), ExprContext.LOAD);
    }

    private Expr exprList() {
        int line = peek().line();
        Expr first = starOrExpr();
        if (!peek().is(Kind.OP, ",")) return first;
        List<Expr> elts = new ArrayList<>(List.of(first));
        while (acceptOp(",")) {
            if (peek().is(Kind.NAME, "in")) break;
            elts.add(starOrExpr());
        }
        return new TupleExpr(line, List.copyOf(elts), ExprContext.LOAD);
    }

    private Expr starOrTest() {
        if (peek().is(Kind.OP, "*")) {
            int line = next().line();
            return new Starred(line, expr(), ExprContext.LOAD);
        }
        return test();
    }

    private Expr starOrExpr() {
        if (peek().is(Kind.OP, "*")) {
            int line = next().line();
            return new Starred(line, expr(), ExprContext.LOAD);
        }
        return expr();
    }

    private Expr namedTest() {
        Expr e = test();
        if (peek().is(Kind.OP, ":=")) {
            throw error("assignment expressions are not supported");
        }
        return e;
    }

    private Expr test() {
        if (peek().is(Kind.NAME, "lambda")) {
            return lambda();
        }
        Expr body = orTest();
        if (peek().is(Kind.NAME, "if")) {
            int line = next().line();
            Expr cond = orTest();
            expectName("else");
            Expr orElse = test();
            return new IfExp(line, cond, body, orElse);
        }
        return body;
    }

    private Expr lambda() {
        int line = expectName("lambda").line();
        Arguments args = parameters(":", false);
        expectOp(":");
        return new Lambda(line, args, test());
    }

    private Expr orTest() {
        return boolChain("or", this::andTest);
    }

    private Expr andTest() {
        return boolChain("and", this::notTest);
    }

    private Expr boolChain(String op, java.util.function.Supplier<Expr> operand) {
        int line = peek().line();
        Expr first = operand.get();
        if (!peek().is(Kind.NAME, op)) return first;
        List<Expr> values = new ArrayList<>(List.of(first));
        while (acceptName(op)) {
            values.add(operand.get());
        }
        return new BoolOp(line, op, List.copyOf(values));
    }

    private Expr notTest() {
        if (peek().is(Kind.NAME, "not")) {
            int line = next().line();
            return new UnaryOp(line, "not", notTest());
        }
        return comparison();
    }

    private Expr comparison() {
        int line = peek().line();
        Expr left = expr();
        List<String> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            Token t = peek();
            String op;
            if (t.kind() == Kind.OP && COMPARISON_OPS.contains(t.text())) {
                op = next().text();
            } else if (t.is(Kind.NAME, "in")) {
                next();
                op = "in";
            } else if (t.is(Kind.NAME, "not") && peekAt(1).is(Kind.NAME, "in")) {
                next();
                next();
                op = "not in";
            } else if (t.is(Kind.NAME, "is")) {
                next();
                op = acceptName("not") ? "is not" : "is";
            } else {
                break;
            }
            ops.add(op);
            comparators.add(expr());
        }
        return ops.isEmpty() ? left : new Compare(line, left, List.copyOf(ops), List.copyOf(comparators));
    }

    private Expr expr() {
        return binaryLevel(0);
    }

    private static final List<Set<String>> BINARY_LEVELS = List.of(
        Set.of("|"),
        Set.of("^"),
        Set.of("&"),
        Set.of("<<", ">>"),
        Set.of("+", "-"),
        Set.of("*", "/", "//", "%", "@"));

    private Expr binaryLevel(int level) {
        if (level == BINARY_LEVELS.size()) {
            return factor();
        }
        Expr left = binaryLevel(level + 1);
        while (peek().kind() == Kind.OP && BINARY_LEVELS.get(level).contains(peek().text())) {
            Token op = next();
            Expr right = binaryLevel(level + 1);
            left = new BinOp(op.line(), left, op.text(), right);
        }
        return left;
    }

    private Expr factor() {
        Token t = peek();
        if (t.kind() == Kind.OP && (t.text().equals("-") || t.text().equals("+") || t.text().equals("~"))) {
            next();
            return new UnaryOp(t.line(), t.text(), factor());
        }
        return power();
    }

    private Expr power() {
        Expr base = atomExpr();
        if (peek().is(Kind.OP, "**")) {
            int line = next().line();
            return new BinOp(line, base, "**", factor());
        }
        return base;
    }

    private Expr atomExpr() {
        if (peek().is(Kind.NAME, "await")) {
            throw error("'await' is not supported");
        }
        Expr e = atom();
        while (true) {
            Token t = peek();
            if (t.is(Kind.OP, "(")) {
                next();
                List<Expr> args = new ArrayList<>();
                List<Keyword> keywords = new ArrayList<>();
                callArguments(args, keywords);
                expectOp(")");
                e = new Call(e.line(), e, List.copyOf(args), List.copyOf(keywords));
            } else if (t.is(Kind.OP, "[")) {
                next();
                Slice slice = subscriptList();
                expectOp("]");
                e = new Subscript(e.line(), e, slice, ExprContext.LOAD);
            } else if (t.is(Kind.OP, ".")) {
                next();
                e = new Attribute(e.line(), e, identifier(), ExprContext.LOAD);
            } else {
                return e;
            }
        }
    }

    private void callArguments(List<Expr> args, List<Keyword> keywords) {
        while (!peek().is(Kind.OP, ")")) {
            if (acceptOp("**")) {
                keywords.add(new Keyword(null, test()));
            } else if (peek().is(Kind.OP, "*")) {
                int line = next().line();
                args.add(new Starred(line, test(), ExprContext.LOAD));
            } else if (peek().kind() == Kind.NAME && peekAt(1).is(Kind.OP, "=")) {
                String name = next().text();
                next();
                keywords.add(new Keyword(name, test()));
            } else {
                args.add(test());
                rejectComprehension();
            }
            if (!acceptOp(",")) break;
        }
    }

    private Slice subscriptList() {
        List<Slice> dims = new ArrayList<>();
        int line = peek().line();
        boolean trailingComma = false;
        do {
            if (peek().is(Kind.OP, "]")) {
                trailingComma = true;
                break;
            }
            dims.add(subscript());
        } while (acceptOp(","));
        if (dims.size() == 1 && !trailingComma) {
            return dims.get(0);
        }
        if (dims.stream().allMatch(d -> d instanceof Index)) {
            List<Expr> elts = dims.stream().map(d -> ((Index) d).value()).toList();
            return new Index(new TupleExpr(line, elts, ExprContext.LOAD));
        }
        return new Extended(List.copyOf(dims));
    }

    private Slice subscript() {
        Expr lower = null;
        if (!peek().is(Kind.OP, ":")) {
            lower = test();
            if (!peek().is(Kind.OP, ":")) {
                return new Index(lower);
            }
        }
        expectOp(":");
        Expr upper = null;
        Expr step = null;
        if (!peek().is(Kind.OP, "]") && !peek().is(Kind.OP, ",") && !peek().is(Kind.OP, ":")) {
            upper = test();
        }
        if (acceptOp(":")) {
            if (!peek().is(Kind.OP, "]") && !peek().is(Kind.OP, ",")) {
                step = test();
            }
        }
        return new Range(lower, upper, step);
    }

    private Expr atom() {
        Token t = next();
        int line = t.line();
        switch (t.kind()) {
            case NUMBER:
                return new Constant(line, t.value());
            case STRING:
                return new Constant(line, t.value());
            case NAME:
                switch (t.text()) {
                    case "None":  return new Constant(line, null);
                    case "True":  return new Constant(line, Boolean.TRUE);
                    case "False": return new Constant(line, Boolean.FALSE);
                    default:
                        if (KEYWORDS.contains(t.text())) {
                            throw new ParseException("unexpected keyword '" + t.text() + "'", line);
                        }
                        return new Name(line, t.text(), ExprContext.LOAD);
                }
            case OP:
                switch (t.text()) {
                    case "(": {
                        if (acceptOp(")")) return new TupleExpr(line, List.of(), ExprContext.LOAD);
                        Expr first = starOrTest();
                        rejectComprehension();
                        if (acceptOp(")")) return first;
                        List<Expr> elts = new ArrayList<>(List.of(first));
                        while (acceptOp(",")) {
                            if (peek().is(Kind.OP, ")")) break;
                            elts.add(starOrTest());
                        }
                        expectOp(")");
                        return new TupleExpr(line, List.copyOf(elts), ExprContext.LOAD);
                    }
                    case "[": {
                        List<Expr> elts = new ArrayList<>();
                        while (!peek().is(Kind.OP, "]")) {
                            elts.add(starOrTest());
                            rejectComprehension();
                            if (!acceptOp(",")) break;
                        }
                        expectOp("]");
                        return new ListExpr(line, List.copyOf(elts), ExprContext.LOAD);
                    }
                    case "{":
                        return dictOrSet(line);
                    case "...":
                        return new Constant(line, "...");
                    default:
                        break;
                }
                break;
            default:
                break;
        }
        throw new ParseException("unexpected " + t, line);
    }

    private Expr dictOrSet(int line) {
        if (acceptOp("}")) return new DictExpr(line, List.of(), List.of());
        Expr first = test();
        rejectComprehension();
        if (acceptOp(":")) {
            List<Expr> keys = new ArrayList<>(List.of(first));
            List<Expr> values = new ArrayList<>(List.of(test()));
            rejectComprehension();
            while (acceptOp(",")) {
                if (peek().is(Kind.OP, "}")) break;
                keys.add(test());
                expectOp(":");
                values.add(test());
            }
            expectOp("}");
            return new DictExpr(line, List.copyOf(keys), List.copyOf(values));
        }
        List<Expr> elts = new ArrayList<>(List.of(first));
        while (acceptOp(",")) {
            if (peek().is(Kind.OP, "}")) break;
            elts.add(test());
        }
        expectOp("}");
        return new SetExpr(line, List.copyOf(elts));
    }

    private void rejectComprehension() {
        if (peek().is(Kind.NAME, "for") || peek().is(Kind.NAME, "async")) {
            throw error("comprehensions are not supported");
        }
    }

    // -----------------------------------------------------------------------
    // Token helpers
    // -----------------------------------------------------------------------

    private String dottedName() {
        StringBuilder sb = new StringBuilder(identifier());
        while (acceptOp(".")) {
            sb.append('.').append(identifier());
        }
        return sb.toString();
    }

    private String identifier() {
        Token t = next();
        if (t.kind() != Kind.NAME || KEYWORDS.contains(t.text())) {
            throw new ParseException("expected identifier, got " + t, t.line());
        }
        return t.text();
    }

    private boolean atStatementEnd() {
        Token t = peek();
        return t.kind() == Kind.NEWLINE || t.kind() == Kind.EOF || t.is(Kind.OP, ";");
    }

    private boolean atExpressionEnd() {
        Token t = peek();
        return atStatementEnd() || t.is(Kind.OP, "=") || t.is(Kind.OP, ")") || t.is(Kind.OP, ":")
            || (t.kind() == Kind.OP && AUGMENTED_OPS.contains(t.text()));
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.kind() != Kind.EOF) pos++;
        return t;
    }

    private boolean accept(Kind kind) {
        if (peek().kind() == kind) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptOp(String op) {
        if (peek().is(Kind.OP, op)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptName(String keyword) {
        if (peek().is(Kind.NAME, keyword)) {
            next();
            return true;
        }
        return false;
    }

    private void expectOp(String op) {
        if (!acceptOp(op)) throw error("expected '" + op + "'");
    }

    private Token expectName(String keyword) {
        Token t = peek();
        if (!t.is(Kind.NAME, keyword)) throw error("expected '" + keyword + "'");
        return next();
    }

    private ParseException error(String message) {
        Token t = peek();
        return new ParseException(message + " but found " + t, t.line());
    }
}
