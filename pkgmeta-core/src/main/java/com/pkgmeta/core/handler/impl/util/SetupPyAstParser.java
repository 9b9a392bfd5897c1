package com.pkgmeta.core.handler.impl.util;

import com.pkgmeta.core.handler.DescriptorParseException;
import com.pkgmeta.core.handler.ast.PythonExpr.Call;
import com.pkgmeta.core.handler.ast.PythonExpr.Dict;
import com.pkgmeta.core.handler.ast.PythonExpr.DictEntry;
import com.pkgmeta.core.handler.ast.PythonExpr.Node;
import com.pkgmeta.core.handler.ast.PythonExpr.Opaque;
import com.pkgmeta.core.handler.ast.PythonExpr.Sequence;
import com.pkgmeta.core.handler.ast.PythonExpr.SequenceKind;
import com.pkgmeta.core.handler.ast.PythonExpr.Str;
import com.pkgmeta.parser.SetupPyBaseVisitor;
import com.pkgmeta.parser.SetupPyLexer;
import com.pkgmeta.parser.SetupPyParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the literal keyword arguments of the top-level {@code setup(...)} call
 * of a {@code setup.py} without executing it.
 *
 * <p>The source is parsed with the ANTLR {@code SetupPy} grammar and the parse
 * tree is converted to {@link com.pkgmeta.core.handler.ast.PythonExpr} nodes.
 * Only module-level statements of the form {@code setup(...)} or
 * {@code x = setup(...)} are inspected; {@code main(...)},
 * {@code setuptools.setup(...)} and {@code distutils.core.setup(...)} are
 * accepted as well. Keyword values are kept when they are string literals,
 * displays of string literals, or dicts of those. Non-literal values are
 * reported in {@link Arguments#nonLiteralKeys()}; non-literal elements dropped
 * from a display are reported in {@link Arguments#warnings()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SetupPyAstParser.Arguments arguments = SetupPyAstParser.parse(file, Files.readString(file));
 * Object requires = arguments.values().get("install_requires");
 * }</pre>
 */
public final class SetupPyAstParser {

    private static final Logger log = LoggerFactory.getLogger(SetupPyAstParser.class);

    private static final Set<String> SETUP_FUNCTIONS = Set.of(
        "setup", "main", "setuptools.setup", "distutils.core.setup");
    private static final String KWARGS_KEY = "**";

    /**
     * Literal arguments of the setup call.
     *
     * @param values keyword name to {@code String}, {@code List<String>} or {@code Map<String, Object>}
     * @param nonLiteralKeys keywords whose value is not a literal, in source order
     * @param warnings descriptions of dropped non-literal elements
     */
    public record Arguments(Map<String, Object> values, Set<String> nonLiteralKeys, List<String> warnings) {
        public Arguments {
            values = values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
            nonLiteralKeys = nonLiteralKeys != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(nonLiteralKeys))
                : Set.of();
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
        }
    }

    private SetupPyAstParser() {
        // Utility class - no instantiation
    }

    /**
     * Parses setup.py source.
     *
     * @param file file the source came from, for error messages
     * @param source Python source
     * @return literal arguments; empty when no setup call is found
     * @throws DescriptorParseException on an unterminated string literal or unbalanced brackets
     */
    public static Arguments parse(Path file, String source) throws DescriptorParseException {
        SetupPyParser.File_inputContext tree = parseTree(file, source);

        ExpressionBuilder builder = new ExpressionBuilder();
        Map<String, Object> values = new LinkedHashMap<>();
        Set<String> nonLiteral = new LinkedHashSet<>();
        List<String> warnings = new ArrayList<>();
        for (Call call : builder.topLevelSetupCalls(tree)) {
            for (Map.Entry<String, Node> keyword : call.keywords().entrySet()) {
                String key = keyword.getKey();
                Object value = toValue(key, keyword.getValue(), warnings);
                if (value == null) {
                    nonLiteral.add(key);
                    values.remove(key);
                } else {
                    nonLiteral.remove(key);
                    values.put(key, value);
                }
            }
        }
        return new Arguments(values, nonLiteral, warnings);
    }

    private static SetupPyParser.File_inputContext parseTree(Path file, String source) throws DescriptorParseException {
        // every statement ends with NEWLINE, including the last one
        String text = source.endsWith("\n") ? source : source + "\n";
        SetupPyLexer lexer = new SetupPyLexer(CharStreams.fromString(text, String.valueOf(file)));
        lexer.removeErrorListeners();
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        for (Token token : tokens.getTokens()) {
            if (token.getType() == SetupPyLexer.UNTERMINATED_STRING) {
                throw new DescriptorParseException(file, "unterminated string literal at line " + token.getLine());
            }
        }

        SetupPyParser parser = new SetupPyParser(tokens);
        parser.removeErrorListeners();
        SyntaxErrorCollector errors = new SyntaxErrorCollector();
        parser.addErrorListener(errors);
        SetupPyParser.File_inputContext tree = parser.file_input();
        if (errors.first != null) {
            throw new DescriptorParseException(file, errors.first);
        }
        log.debug("Parsed {} statements from {}", tree.statement().size(), file);
        return tree;
    }

    private static final class SyntaxErrorCollector extends BaseErrorListener {

        private String first;

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            if (first == null) {
                first = "syntax error at line " + line + ":" + charPositionInLine + ": " + msg;
            }
        }
    }

    // ==================== Parse tree to expression nodes ====================

    private static final class ExpressionBuilder extends SetupPyBaseVisitor<Node> {

        List<Call> topLevelSetupCalls(SetupPyParser.File_inputContext tree) {
            List<Call> calls = new ArrayList<>();
            for (SetupPyParser.StatementContext statement : tree.statement()) {
                SetupPyParser.CallStatementContext call = statement.callStatement();
                if (call == null || call.getStart().getCharPositionInLine() != 0) {
                    continue;
                }
                String function = call.dottedName().getText();
                if (SETUP_FUNCTIONS.contains(function)) {
                    calls.add(call(function, call.arglist()));
                }
            }
            return calls;
        }

        private Call call(String function, SetupPyParser.ArglistContext arglist) {
            List<Node> arguments = new ArrayList<>();
            Map<String, Node> keywords = new LinkedHashMap<>();
            if (arglist != null) {
                for (SetupPyParser.ArgumentContext argument : arglist.argument()) {
                    if (argument instanceof SetupPyParser.KeywordArgumentContext keyword) {
                        keywords.put(keyword.NAME().getText(), visit(keyword.expr()));
                    } else if (argument instanceof SetupPyParser.UnpackedKeywordsContext unpacked) {
                        keywords.put(KWARGS_KEY, visit(unpacked.expr()));
                    } else if (argument instanceof SetupPyParser.PositionalArgumentContext positional) {
                        arguments.add(visit(positional.expr()));
                    } else {
                        arguments.add(new Opaque(sourceText(argument)));
                    }
                }
            }
            return new Call(function, arguments, keywords);
        }

        @Override
        public Node visitExpr(SetupPyParser.ExprContext ctx) {
            // operators, comprehensions, conditionals: keep the source, do not evaluate
            return ctx.unit().size() == 1 ? visit(ctx.unit(0)) : new Opaque(sourceText(ctx));
        }

        @Override
        public Node visitLambdaUnit(SetupPyParser.LambdaUnitContext ctx) {
            return new Opaque(sourceText(ctx));
        }

        @Override
        public Node visitOperatorUnit(SetupPyParser.OperatorUnitContext ctx) {
            return new Opaque(sourceText(ctx));
        }

        @Override
        public Node visitAtomUnit(SetupPyParser.AtomUnitContext ctx) {
            List<SetupPyParser.TrailerContext> trailers = ctx.trailer();
            if (trailers.isEmpty()) {
                return visit(ctx.atom());
            }
            SetupPyParser.TrailerContext last = trailers.get(trailers.size() - 1);
            boolean dottedCallee = ctx.atom() instanceof SetupPyParser.NameAtomContext
                && trailers.subList(0, trailers.size() - 1).stream().allMatch(t -> t.NAME() != null);
            if (last.OPEN_PAREN() != null && dottedCallee) {
                String function = sourceText(ctx.atom())
                    + String.join("", trailers.subList(0, trailers.size() - 1).stream().map(ParseTree::getText).toList());
                return call(function, last.arglist());
            }
            return new Opaque(sourceText(ctx));
        }

        @Override
        public Node visitStringAtom(SetupPyParser.StringAtomContext ctx) {
            if (!ctx.FORMATTED_STRING().isEmpty()) {
                return new Opaque(sourceText(ctx));
            }
            StringBuilder value = new StringBuilder();
            for (TerminalNode literal : ctx.STRING()) {
                value.append(decodeString(literal.getText()));
            }
            return new Str(value.toString());
        }

        @Override
        public Node visitParenAtom(SetupPyParser.ParenAtomContext ctx) {
            List<SetupPyParser.ElementContext> elements = ctx.element();
            if (elements.size() == 1 && ctx.COMMA().isEmpty() && elements.get(0).STAR() == null) {
                return visit(elements.get(0));
            }
            return new Sequence(SequenceKind.TUPLE, elements(elements));
        }

        @Override
        public Node visitListAtom(SetupPyParser.ListAtomContext ctx) {
            return new Sequence(SequenceKind.LIST, elements(ctx.element()));
        }

        @Override
        public Node visitBraceAtom(SetupPyParser.BraceAtomContext ctx) {
            List<SetupPyParser.EntryContext> entries = ctx.entry();
            boolean dict = entries.isEmpty()
                || entries.stream().anyMatch(e -> e.COLON() != null || e.POWER() != null);
            if (!dict) {
                List<Node> elements = new ArrayList<>();
                for (SetupPyParser.EntryContext entry : entries) {
                    elements.add(entry.STAR() != null ? new Opaque(sourceText(entry)) : visit(entry.expr(0)));
                }
                return new Sequence(SequenceKind.SET, elements);
            }
            List<DictEntry> dictEntries = new ArrayList<>();
            for (SetupPyParser.EntryContext entry : entries) {
                if (entry.COLON() != null) {
                    dictEntries.add(new DictEntry(visit(entry.expr(0)), visit(entry.expr(1))));
                } else {
                    // **unpacking or a comprehension fragment
                    Node opaque = new Opaque(sourceText(entry));
                    dictEntries.add(new DictEntry(opaque, opaque));
                }
            }
            return new Dict(dictEntries);
        }

        @Override
        public Node visitNameAtom(SetupPyParser.NameAtomContext ctx) {
            return new Opaque(ctx.getText());
        }

        @Override
        public Node visitNumberAtom(SetupPyParser.NumberAtomContext ctx) {
            return new Opaque(ctx.getText());
        }

        @Override
        public Node visitElement(SetupPyParser.ElementContext ctx) {
            return ctx.STAR() != null ? new Opaque(sourceText(ctx)) : visit(ctx.expr());
        }

        private List<Node> elements(List<SetupPyParser.ElementContext> elements) {
            List<Node> nodes = new ArrayList<>();
            for (SetupPyParser.ElementContext element : elements) {
                nodes.add(visit(element));
            }
            return nodes;
        }
    }

    private static String sourceText(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (stop == null || stop.getStopIndex() < start.getStartIndex()) {
            return ctx.getText();
        }
        return start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
    }

    // ==================== String literals ====================

    /**
     * Decodes a plain (non-formatted) string literal token, prefix and quotes included.
     */
    static String decodeString(String literal) {
        int quoteIndex = 0;
        while (literal.charAt(quoteIndex) != '\'' && literal.charAt(quoteIndex) != '"') {
            quoteIndex++;
        }
        boolean raw = literal.substring(0, quoteIndex).toLowerCase(Locale.ROOT).contains("r");
        String rest = literal.substring(quoteIndex);
        int quoteLength = rest.length() >= 6 && rest.startsWith(rest.substring(0, 1).repeat(3)) ? 3 : 1;
        String body = rest.substring(quoteLength, rest.length() - quoteLength)
            .replace("\r\n", "\n")
            .replace('\r', '\n');
        return raw ? body : unescape(body);
    }

    private static String unescape(String body) {
        StringBuilder value = new StringBuilder(body.length());
        int pos = 0;
        while (pos < body.length()) {
            char c = body.charAt(pos);
            if (c != '\\' || pos + 1 >= body.length()) {
                value.append(c);
                pos++;
                continue;
            }
            char next = body.charAt(pos + 1);
            switch (next) {
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                case '\\' -> value.append('\\');
                case '\'' -> value.append('\'');
                case '"' -> value.append('"');
                case 'a' -> value.append('\u0007');
                case 'b' -> value.append('\b');
                case 'f' -> value.append('\f');
                case 'v' -> value.append('\u000B');
                case '\n' -> {
                    // escaped line break joins the lines
                }
                case 'x', 'u', 'U' -> {
                    int digits = next == 'x' ? 2 : next == 'u' ? 4 : 8;
                    int end = pos + 2 + digits;
                    Integer codePoint = end <= body.length() ? hexValue(body.substring(pos + 2, end)) : null;
                    if (codePoint != null) {
                        value.appendCodePoint(codePoint);
                        pos = end;
                        continue;
                    }
                    value.append('\\').append(next);
                }
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = pos + 1;
                        while (end < body.length() && end - pos - 1 < 3 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        value.append((char) Integer.parseInt(body.substring(pos + 1, end), 8));
                        pos = end;
                        continue;
                    }
                    value.append('\\').append(next);
                }
            }
            pos += 2;
        }
        return value.toString();
    }

    private static Integer hexValue(String digits) {
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), 16) < 0) {
                return null;
            }
        }
        int codePoint = Integer.parseInt(digits, 16);
        return Character.isValidCodePoint(codePoint) ? codePoint : null;
    }

    // ==================== Literal conversion ====================

    private static Object toValue(String key, Node node, List<String> warnings) {
        if (node instanceof Str str) {
            return str.value();
        }
        if (node instanceof Sequence sequence) {
            return stringList(key, sequence, warnings);
        }
        if (node instanceof Dict dict) {
            Map<String, Object> map = new LinkedHashMap<>();
            int dropped = 0;
            for (DictEntry entry : dict.entries()) {
                Object value = entry.value() instanceof Str str ? str.value()
                    : entry.value() instanceof Sequence sequence ? stringList(key, sequence, warnings)
                    : null;
                if (entry.key() instanceof Str name && value != null) {
                    map.put(name.value(), value);
                } else {
                    dropped++;
                }
            }
            if (dropped > 0) {
                warnings.add("setup(" + key + "=...): dropped " + dropped + " non-literal dict entr"
                    + (dropped == 1 ? "y" : "ies"));
            }
            return map;
        }
        return null;
    }

    private static List<String> stringList(String key, Sequence sequence, List<String> warnings) {
        List<String> values = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (Node element : sequence.elements()) {
            if (element instanceof Str str) {
                values.add(str.value());
            } else {
                dropped.add(textOf(element));
            }
        }
        if (!dropped.isEmpty()) {
            warnings.add("setup(" + key + "=...): dropped non-literal element(s) " + dropped);
        }
        return values;
    }

    private static String textOf(Node node) {
        if (node instanceof Str str) {
            return '"' + str.value() + '"';
        }
        if (node instanceof Opaque opaque) {
            return opaque.text();
        }
        if (node instanceof Call call) {
            return call.function() + "(...)";
        }
        if (node instanceof Sequence sequence) {
            return sequence.kind().name().toLowerCase(Locale.ROOT) + "[" + sequence.elements().size() + "]";
        }
        return "{...}";
    }
}
