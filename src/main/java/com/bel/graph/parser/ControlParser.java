package com.bel.graph.parser;

import com.bel.graph.assembly.BelGraph;
import com.bel.graph.core.model.Citation;
import com.bel.graph.core.model.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Applies {@code SET} and {@code UNSET} lines to a {@link ControlContext}.
 *
 * <pre>
 * SET Citation = {"PubMed", "Title", "12345"}
 * SET Evidence = "..."                         (alias SupportingText)
 * SET Cell = "fibroblast"  |  SET Cell = {"a", "b"}
 * SET STATEMENT_GROUP = "group"
 * UNSET Cell  |  UNSET {Cell, Tissue}  |  UNSET Citation  |  UNSET Evidence  |  UNSET ALL
 * </pre>
 *
 * <p>Annotation values are checked against the document's {@code LIST} and {@code PATTERN}
 * declarations. A rejected {@code SET} leaves the key unset rather than keeping its
 * previous value.</p>
 */
public class ControlParser {
    private static final Logger log = LoggerFactory.getLogger(ControlParser.class);

    public static final String SET = "SET";
    public static final String UNSET = "UNSET";
    public static final String CITATION = "Citation";
    public static final String STATEMENT_GROUP = "STATEMENT_GROUP";
    public static final String ALL = "ALL";
    public static final Set<String> EVIDENCE_KEYS = Set.of("Evidence", "SupportingText");

    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    private final ControlContext context;
    private final BelGraph graph;

    /**
     * @param context the context to mutate
     * @param graph   source of annotation declarations
     */
    public ControlParser(ControlContext context, BelGraph graph) {
        this.context = Objects.requireNonNull(context, "context is required");
        this.graph = Objects.requireNonNull(graph, "graph is required");
    }

    public ControlContext getContext() {
        return context;
    }

    /**
     * Whether the line is a {@code SET} or {@code UNSET} command.
     */
    public static boolean isControlLine(String line) {
        String trimmed = line.stripLeading();
        return startsWithKeyword(trimmed, SET) || startsWithKeyword(trimmed, UNSET);
    }

    private static boolean startsWithKeyword(String line, String keyword) {
        return line.startsWith(keyword)
                && (line.length() == keyword.length() || Character.isWhitespace(line.charAt(keyword.length()))
                || line.charAt(keyword.length()) == '{');
    }

    public void parse(String line) throws BelParseException {
        TokenStream tokens = TokenStream.of(line);
        Token command = tokens.next();
        if (command.isWord(SET)) {
            set(tokens);
        } else if (command.isWord(UNSET)) {
            unset(tokens);
        } else {
            throw new LexicalException(WarningKind.UNPARSABLE_LINE,
                    "expected SET or UNSET but found " + command.describe());
        }
    }

    private void set(TokenStream tokens) throws BelParseException {
        String key = key(tokens);
        if (!tokens.accept(TokenType.EQUALS)) {
            throw unparsable("expected '=' after SET " + key, tokens.peek());
        }
        List<String> values = values(tokens);
        end(tokens);

        if (CITATION.equals(key)) {
            setCitation(values);
        } else if (EVIDENCE_KEYS.contains(key)) {
            context.unsetEvidence();
            context.setEvidence(single(key, values));
        } else if (STATEMENT_GROUP.equals(key)) {
            context.unsetStatementGroup();
            context.setStatementGroup(single(key, values));
        } else {
            setAnnotation(key, values);
        }
    }

    private void setCitation(List<String> values) throws SemanticException {
        if (values.size() < 2 || values.size() > 6) {
            context.discardCitation();
            throw new SemanticException(WarningKind.INVALID_CITATION,
                    "citation must have 2 to 6 fields, had " + values.size());
        }
        String type = values.get(0);
        String name = values.size() == 2 ? null : values.get(1);
        String reference = values.size() == 2 ? values.get(1) : values.get(2);
        String date = field(values, 3);
        String authors = field(values, 4);
        String comment = field(values, 5);

        Citation citation = new Citation(type, reference, name, date, authors, comment);
        try {
            checkCitation(citation);
        } catch (SemanticException e) {
            context.discardCitation();
            throw e;
        }
        context.setCitation(citation);
        log.trace("citation.set type={} reference={}", type, reference);
    }

    /**
     * Rejects citations with an unknown type, a blank reference or a non-numeric PubMed id.
     */
    public static void checkCitation(Citation citation) throws SemanticException {
        if (!Citation.TYPES.contains(citation.type())) {
            throw new SemanticException(WarningKind.INVALID_CITATION,
                    "unknown citation type '" + citation.type() + "', expected one of " + Citation.TYPES);
        }
        if (citation.reference().isBlank()) {
            throw new SemanticException(WarningKind.INVALID_CITATION, "citation reference is blank");
        }
        if ("PubMed".equals(citation.type()) && !NUMERIC.matcher(citation.reference()).matches()) {
            throw new SemanticException(WarningKind.INVALID_CITATION,
                    "PubMed reference must be numeric, was '" + citation.reference() + "'");
        }
    }

    private static String field(List<String> values, int index) {
        if (index >= values.size() || values.get(index).isBlank()) {
            return null;
        }
        return values.get(index);
    }

    private void setAnnotation(String name, List<String> values) throws SemanticException {
        Set<String> allowed = graph.getAnnotationLists().get(name);
        Pattern pattern = graph.getAnnotationPatterns().get(name);
        for (String value : values) {
            if (allowed != null && !allowed.contains(value)) {
                context.unsetAnnotation(name);
                throw new SemanticException(WarningKind.ILLEGAL_ANNOTATION_VALUE,
                        "'" + value + "' is not a value of annotation " + name);
            }
            if (pattern != null && !pattern.matcher(value).matches()) {
                context.unsetAnnotation(name);
                throw new SemanticException(WarningKind.ILLEGAL_ANNOTATION_VALUE,
                        "'" + value + "' does not match the pattern of annotation " + name);
            }
        }
        context.setAnnotation(name, values);
    }

    private void unset(TokenStream tokens) throws BelParseException {
        List<String> keys = new ArrayList<>();
        if (tokens.accept(TokenType.LBRACE)) {
            do {
                keys.add(key(tokens));
            } while (tokens.accept(TokenType.COMMA));
            if (!tokens.accept(TokenType.RBRACE)) {
                throw unparsable("expected '}'", tokens.peek());
            }
        } else {
            keys.add(key(tokens));
        }
        end(tokens);

        for (String key : keys) {
            if (ALL.equals(key)) {
                context.unsetAll();
            } else if (CITATION.equals(key)) {
                context.unsetCitation();
            } else if (EVIDENCE_KEYS.contains(key)) {
                context.unsetEvidence();
            } else if (STATEMENT_GROUP.equals(key)) {
                context.unsetStatementGroup();
            } else if (!context.unsetAnnotation(key)) {
                log.debug("annotation.unset.ignored name={} reason=not_set", key);
            }
        }
    }

    private String key(TokenStream tokens) throws LexicalException {
        Token token = tokens.peek();
        if (!token.is(TokenType.WORD) && !token.is(TokenType.STRING)) {
            throw unparsable("expected a key", token);
        }
        return tokens.next().text();
    }

    private List<String> values(TokenStream tokens) throws LexicalException {
        List<String> values = new ArrayList<>();
        if (tokens.accept(TokenType.LBRACE)) {
            do {
                values.add(value(tokens));
            } while (tokens.accept(TokenType.COMMA));
            if (!tokens.accept(TokenType.RBRACE)) {
                throw unparsable("expected '}'", tokens.peek());
            }
        } else {
            values.add(value(tokens));
        }
        return values;
    }

    private String value(TokenStream tokens) throws LexicalException {
        Token token = tokens.peek();
        if (!token.is(TokenType.WORD) && !token.is(TokenType.STRING)) {
            throw unparsable("expected a value", token);
        }
        return tokens.next().text();
    }

    private static String single(String key, List<String> values) throws LexicalException {
        if (values.size() != 1) {
            throw new LexicalException(WarningKind.UNPARSABLE_LINE, key + " takes a single value");
        }
        return values.get(0);
    }

    private static void end(TokenStream tokens) throws LexicalException {
        if (!tokens.atEnd()) {
            throw unparsable("unexpected trailing input", tokens.peek());
        }
    }

    private static LexicalException unparsable(String message, Token token) {
        return new LexicalException(WarningKind.UNPARSABLE_LINE,
                message + " at column " + token.column() + ", found " + token.describe());
    }
}
