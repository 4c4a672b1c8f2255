package com.bel.graph.parser;

import com.bel.graph.assembly.GraphAssembler;
import com.bel.graph.core.model.Context;
import com.bel.graph.core.model.ParseWarning;
import com.bel.graph.core.model.Relation;
import com.bel.graph.core.model.Term;
import com.bel.graph.core.model.WarningKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses statement lines and adds the resulting nodes and edges to the graph.
 *
 * <pre>
 * statement := term
 *            | term relation term
 *            | term relation '(' term relation term ')'       (nested, when allowed)
 *            | term ('hasComponents' | 'hasMembers') 'list' '(' term (',' term)* ')'
 * </pre>
 *
 * <p>A statement is fully parsed and checked against the control context before anything
 * is added, so a rejected statement leaves no nodes behind. Qualified edges are added once
 * per context snapshot; unqualified edges are added with the empty context. Both edges of a
 * nested statement share one context: the snapshots when either relation is qualified.</p>
 */
public class StatementParser {

    private static final String HAS_COMPONENTS = "hasComponents";
    private static final String HAS_MEMBERS = "hasMembers";
    private static final String LIST = "list";

    private final TermParser termParser;
    private final ControlContext context;
    private final GraphAssembler assembler;
    private final boolean allowNested;

    public StatementParser(TermParser termParser, ControlContext context, GraphAssembler assembler) {
        this.termParser = Objects.requireNonNull(termParser, "termParser is required");
        this.context = Objects.requireNonNull(context, "context is required");
        this.assembler = Objects.requireNonNull(assembler, "assembler is required");
        this.allowNested = termParser.getConfig().allowNested();
    }

    /**
     * Parses one statement line. All warnings, blocking or not, are recorded on the graph.
     *
     * @return the number of new edges, or the failure
     */
    public ParseResult<Integer> parseStatement(String line, long lineNumber) {
        List<ParseWarning> notes = new ArrayList<>();
        ParseResult<Integer> result;
        try {
            result = ParseResult.ok(apply(parse(line, lineNumber, notes), lineNumber), notes);
        } catch (BelParseException e) {
            result = ParseResult.failed(e.toWarning(lineNumber, line), notes);
        }
        result.warnings().forEach(assembler::addWarning);
        return result;
    }

    private Statement parse(String line, long lineNumber, List<ParseWarning> notes) throws BelParseException {
        TokenStream tokens = TokenStream.of(line);
        Term subject = termParser.parse(tokens, lineNumber, line, notes);
        List<PendingEdge> edges = new ArrayList<>();
        boolean nested = false;

        if (!tokens.atEnd()) {
            Token relationToken = tokens.next();
            if (!relationToken.is(TokenType.WORD) && !relationToken.is(TokenType.RELATION_SYMBOL)) {
                throw new LexicalException(WarningKind.UNPARSABLE_LINE,
                        "expected a relation at column " + relationToken.column()
                                + " but found " + relationToken.describe());
            }
            String keyword = relationToken.text();

            if (HAS_COMPONENTS.equals(keyword) || HAS_MEMBERS.equals(keyword)) {
                Relation relation = HAS_COMPONENTS.equals(keyword) ? Relation.HAS_COMPONENT : Relation.HAS_MEMBER;
                for (Term member : listObject(tokens, lineNumber, line, notes)) {
                    edges.add(new PendingEdge(subject, member, relation));
                }
            } else {
                Relation relation = Relation.fromKeyword(keyword).orElseThrow(() -> new StructuralException(
                        WarningKind.UNKNOWN_RELATION,
                        "unknown relation '" + keyword + "' at column " + relationToken.column()));

                if (tokens.peek().is(TokenType.LPAREN)) {
                    if (!allowNested) {
                        throw new StructuralException(WarningKind.NESTED_NOT_ALLOWED,
                                "nested statement at column " + tokens.peek().column() + " is not allowed");
                    }
                    tokens.next();
                    Term innerSubject = termParser.parse(tokens, lineNumber, line, notes);
                    Relation innerRelation = relation(tokens);
                    Term innerObject = termParser.parse(tokens, lineNumber, line, notes);
                    tokens.expect(TokenType.RPAREN, "')' closing the nested statement");
                    edges.add(new PendingEdge(subject, innerSubject, relation));
                    edges.add(new PendingEdge(innerSubject, innerObject, innerRelation));
                    nested = true;
                } else {
                    Term object = termParser.parse(tokens, lineNumber, line, notes);
                    edges.add(new PendingEdge(subject, object, relation));
                }
            }

            if (!tokens.atEnd()) {
                throw new LexicalException(WarningKind.UNPARSABLE_LINE,
                        "unexpected " + tokens.peek().describe() + " at column " + tokens.peek().column()
                                + " after statement");
            }
        }

        for (PendingEdge edge : edges) {
            if (edge.relation().isQualified() && !context.isQualifying()) {
                throw new SemanticException(WarningKind.MISSING_CONTEXT,
                        "relation " + edge.relation().getKeyword() + " requires a citation and evidence");
            }
        }
        return new Statement(subject, edges, nested);
    }

    private Relation relation(TokenStream tokens) throws BelParseException {
        Token token = tokens.next();
        if (!token.is(TokenType.WORD) && !token.is(TokenType.RELATION_SYMBOL)) {
            throw new LexicalException(WarningKind.UNPARSABLE_LINE,
                    "expected a relation at column " + token.column() + " but found " + token.describe());
        }
        return Relation.fromKeyword(token.text()).orElseThrow(() -> new StructuralException(
                WarningKind.UNKNOWN_RELATION, "unknown relation '" + token.text() + "' at column " + token.column()));
    }

    private List<Term> listObject(TokenStream tokens, long lineNumber, String line, List<ParseWarning> notes)
            throws BelParseException {
        Token keyword = tokens.peek();
        if (!keyword.isWord(LIST) || !tokens.peek(1).is(TokenType.LPAREN)) {
            throw new StructuralException(WarningKind.MALFORMED_TERM,
                    "expected 'list(' at column " + keyword.column() + " but found " + keyword.describe());
        }
        tokens.next();
        tokens.next();
        List<Term> members = new ArrayList<>();
        do {
            members.add(termParser.parse(tokens, lineNumber, line, notes));
        } while (tokens.accept(TokenType.COMMA));
        tokens.expect(TokenType.RPAREN, "')' closing 'list'");
        return members;
    }

    private int apply(Statement statement, long lineNumber) {
        assembler.registerNode(statement.subject(), lineNumber);
        int added = 0;
        List<Context> snapshots = null;
        boolean shared = statement.nested()
                && statement.edges().stream().anyMatch(edge -> edge.relation().isQualified());
        for (PendingEdge edge : statement.edges()) {
            int source = assembler.registerNode(edge.source(), lineNumber);
            int target = assembler.registerNode(edge.target(), lineNumber);
            if (shared || edge.relation().isQualified()) {
                if (snapshots == null) {
                    snapshots = context.snapshots();
                }
                for (Context snapshot : snapshots) {
                    if (assembler.addEdge(source, target, edge.relation(), snapshot, lineNumber)) {
                        added++;
                    }
                }
            } else if (assembler.addEdge(source, target, edge.relation(), Context.empty(), lineNumber)) {
                added++;
            }
        }
        return added;
    }

    private record PendingEdge(Term source, Term target, Relation relation) {}

    private record Statement(Term subject, List<PendingEdge> edges, boolean nested) {}
}
