package com.bel.graph.parser;

import com.bel.graph.assembly.GraphAssembler;
import com.bel.graph.core.model.ActivityTerm;
import com.bel.graph.core.model.BelFunction;
import com.bel.graph.core.model.EntityTerm;
import com.bel.graph.core.model.FusionTerm;
import com.bel.graph.core.model.Identifier;
import com.bel.graph.core.model.ListTerm;
import com.bel.graph.core.model.ParseWarning;
import com.bel.graph.core.model.ReactionTerm;
import com.bel.graph.core.model.Term;
import com.bel.graph.core.model.TransformationTerm;
import com.bel.graph.core.model.TranslocationTerm;
import com.bel.graph.core.model.Variant;
import com.bel.graph.core.model.VariantTerm;
import com.bel.graph.core.model.WarningKind;
import com.bel.graph.namespace.NamespaceResolver;
import com.bel.graph.namespace.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive-descent parser for BEL terms.
 *
 * <pre>
 * term       := function '(' arguments ')'
 * entity     := identifier (',' variant)*          | 'fus' '(' partner ',' partner ')'
 * list       := term (',' term)*                   | identifier
 * activity   := term [',' 'ma' '(' identifier ')']
 * reaction   := 'reactants' '(' [terms] ')' ',' 'products' '(' [terms] ')'
 * tloc       := term ',' 'fromLoc' '(' identifier ')' ',' 'toLoc' '(' identifier ')'
 * identifier := NS ':' name | name                 (naked, lenient mode only)
 * </pre>
 *
 * <p>BEL 1 syntax is accepted and normalized on the way in: legacy activity functions
 * ({@code kin(p(X))}), single-letter {@code pmod} codes, {@code sub} and {@code trunc}.</p>
 *
 * <p>Every namespaced identifier is checked against the {@link NamespaceResolver}. Unknown
 * names do not stop the parse; they are returned as notes.</p>
 */
public class TermParser {
    private static final Logger log = LoggerFactory.getLogger(TermParser.class);

    private static final Map<String, String> LEGACY_ACTIVITIES = Map.ofEntries(
            Map.entry("kin", "kin"), Map.entry("kinaseActivity", "kin"),
            Map.entry("cat", "cat"), Map.entry("catalyticActivity", "cat"),
            Map.entry("chap", "chap"), Map.entry("chaperoneActivity", "chap"),
            Map.entry("gtp", "gtp"), Map.entry("gtpBoundActivity", "gtp"),
            Map.entry("pep", "pep"), Map.entry("peptidaseActivity", "pep"),
            Map.entry("phos", "phos"), Map.entry("phosphataseActivity", "phos"),
            Map.entry("ribo", "ribo"), Map.entry("ribosylationActivity", "ribo"),
            Map.entry("tscript", "tscript"), Map.entry("transcriptionalActivity", "tscript"),
            Map.entry("tport", "tport"), Map.entry("transportActivity", "tport"));

    private static final Map<String, String> LEGACY_MODIFICATIONS = Map.of(
            "P", "Ph", "A", "Ac", "F", "Farn", "G", "Glyco", "H", "Hy",
            "M", "Me", "R", "ADPRib", "S", "Sumo", "U", "Ub", "O", "Ox");

    private static final Map<String, String> AMINO_ACIDS = Map.ofEntries(
            Map.entry("A", "Ala"), Map.entry("R", "Arg"), Map.entry("N", "Asn"), Map.entry("D", "Asp"),
            Map.entry("C", "Cys"), Map.entry("E", "Glu"), Map.entry("Q", "Gln"), Map.entry("G", "Gly"),
            Map.entry("H", "His"), Map.entry("I", "Ile"), Map.entry("L", "Leu"), Map.entry("K", "Lys"),
            Map.entry("M", "Met"), Map.entry("F", "Phe"), Map.entry("P", "Pro"), Map.entry("S", "Ser"),
            Map.entry("T", "Thr"), Map.entry("W", "Trp"), Map.entry("Y", "Tyr"), Map.entry("V", "Val"));

    private final ParserConfig config;
    private final NamespaceResolver resolver;
    private final GraphAssembler assembler;

    /**
     * @param config    parser policy
     * @param resolver  namespace validation
     * @param assembler target of {@link #registerTerm}; may be {@code null} when only parsing
     */
    public TermParser(ParserConfig config, NamespaceResolver resolver, GraphAssembler assembler) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.assembler = assembler;
    }

    public ParserConfig getConfig() {
        return config;
    }

    /**
     * Parses a complete term. Nothing is recorded on the graph.
     */
    public ParseResult<Term> parseTerm(String text, long lineNumber) {
        List<ParseWarning> notes = new ArrayList<>();
        try {
            TokenStream tokens = TokenStream.of(text);
            Term term = parse(tokens, lineNumber, text, notes);
            if (!tokens.atEnd()) {
                throw new LexicalException(WarningKind.UNPARSABLE_LINE,
                        "unexpected " + tokens.peek().describe() + " at column " + tokens.peek().column()
                                + " after term");
            }
            return ParseResult.ok(term, notes);
        } catch (BelParseException e) {
            return ParseResult.failed(e.toWarning(lineNumber, text), notes);
        }
    }

    /**
     * Parses a term and registers it as a node without any edge. All warnings are
     * recorded on the graph.
     *
     * @return the node index, or the failure
     */
    public ParseResult<Integer> registerTerm(String text, long lineNumber) {
        if (assembler == null) {
            throw new IllegalStateException("no assembler configured");
        }
        ParseResult<Term> result = parseTerm(text, lineNumber);
        result.warnings().forEach(assembler::addWarning);
        if (!result.isOk()) {
            return ParseResult.failed(result.failure(), result.notes());
        }
        int index = assembler.registerNode(result.getValue(), lineNumber);
        return ParseResult.ok(index, result.notes());
    }

    /**
     * Parses one term from the stream, leaving the cursor after its closing parenthesis.
     *
     * @param notes receives non-blocking warnings, positioned at {@code lineNumber}
     */
    public Term parse(TokenStream tokens, long lineNumber, String line, List<ParseWarning> notes)
            throws BelParseException {
        return new Session(tokens, lineNumber, line, notes).term(1);
    }

    private final class Session {
        private final TokenStream tokens;
        private final long lineNumber;
        private final String line;
        private final List<ParseWarning> notes;

        Session(TokenStream tokens, long lineNumber, String line, List<ParseWarning> notes) {
            this.tokens = tokens;
            this.lineNumber = lineNumber;
            this.line = line;
            this.notes = notes;
        }

        Term term(int depth) throws BelParseException {
            if (depth > config.maxTermDepth()) {
                throw new StructuralException(WarningKind.MALFORMED_TERM,
                        "term nesting exceeds maximum depth " + config.maxTermDepth());
            }
            Token keyword = tokens.peek();
            if (!keyword.is(TokenType.WORD)) {
                throw new StructuralException(WarningKind.MALFORMED_TERM,
                        "expected a function at column " + keyword.column() + " but found " + keyword.describe());
            }
            if (!tokens.peek(1).is(TokenType.LPAREN)) {
                throw new StructuralException(WarningKind.MALFORMED_TERM,
                        "expected '(' after '" + keyword.text() + "' at column " + keyword.column());
            }

            BelFunction function = BelFunction.fromKeyword(keyword.text()).orElse(null);
            String legacyActivity = LEGACY_ACTIVITIES.get(keyword.text());
            if (function == null && legacyActivity == null) {
                throw new StructuralException(WarningKind.UNKNOWN_FUNCTION,
                        "unknown function '" + keyword.text() + "' at column " + keyword.column());
            }
            tokens.next();
            tokens.next();

            Term term;
            if (function == null) {
                Term target = term(depth + 1);
                term = new ActivityTerm(target, Identifier.of(Identifier.DEFAULT_NAMESPACE, legacyActivity));
            } else {
                term = switch (function.getKind()) {
                    case ENTITY, PROCESS -> entity(function);
                    case LIST -> list(function, depth);
                    case ACTIVITY -> activity(depth);
                    case REACTION -> reaction(depth);
                    case TRANSLOCATION -> translocation(depth);
                    case TRANSFORMATION -> new TransformationTerm(function, term(depth + 1));
                };
            }
            closeArguments(keyword.text());
            return term;
        }

        private void closeArguments(String functionName) throws StructuralException {
            if (tokens.peek().is(TokenType.COMMA)) {
                throw new StructuralException(WarningKind.ARITY_MISMATCH,
                        "too many arguments to '" + functionName + "' at column " + tokens.peek().column());
            }
            tokens.expect(TokenType.RPAREN, "')' closing '" + functionName + "'");
        }

        private Term entity(BelFunction function) throws BelParseException {
            if (function.acceptsVariants() && isCall("fus", "fusion")) {
                return fusion(function);
            }
            Identifier identifier = identifier();
            EntityTerm base = new EntityTerm(function, identifier);
            if (function.getKind() == BelFunction.Kind.PROCESS) {
                return base;
            }
            List<Variant> variants = new ArrayList<>();
            while (tokens.accept(TokenType.COMMA)) {
                variants.add(variant(function));
            }
            return variants.isEmpty() ? base : new VariantTerm(base, variants);
        }

        private Term list(BelFunction function, int depth) throws BelParseException {
            if (!isCallAhead()) {
                if (function != BelFunction.COMPLEX) {
                    throw new StructuralException(WarningKind.MALFORMED_TERM,
                            "'" + function.getShortName() + "' requires member terms");
                }
                return entity(function);
            }
            List<Term> members = new ArrayList<>();
            do {
                members.add(term(depth + 1));
            } while (tokens.accept(TokenType.COMMA));
            return new ListTerm(function, members);
        }

        private Term activity(int depth) throws BelParseException {
            Term target = term(depth + 1);
            Identifier effect = null;
            if (tokens.accept(TokenType.COMMA)) {
                String keyword = callKeyword("ma", "molecularActivity");
                effect = defaultedIdentifier();
                tokens.expect(TokenType.RPAREN, "')' closing '" + keyword + "'");
            }
            return new ActivityTerm(target, effect);
        }

        private Term reaction(int depth) throws BelParseException {
            callKeyword("reactants");
            List<Term> reactants = termList(depth);
            tokens.expect(TokenType.RPAREN, "')' closing 'reactants'");
            tokens.expect(TokenType.COMMA, "',' before 'products'");
            callKeyword("products");
            List<Term> products = termList(depth);
            tokens.expect(TokenType.RPAREN, "')' closing 'products'");
            return new ReactionTerm(reactants, products);
        }

        private List<Term> termList(int depth) throws BelParseException {
            List<Term> terms = new ArrayList<>();
            if (tokens.peek().is(TokenType.RPAREN)) {
                return terms;
            }
            do {
                terms.add(term(depth + 1));
            } while (tokens.accept(TokenType.COMMA));
            return terms;
        }

        private Term translocation(int depth) throws BelParseException {
            Term target = term(depth + 1);
            tokens.expect(TokenType.COMMA, "',' before the source location");
            Identifier from;
            Identifier to;
            if (isCall("fromLoc")) {
                callKeyword("fromLoc");
                from = identifier();
                tokens.expect(TokenType.RPAREN, "')' closing 'fromLoc'");
                tokens.expect(TokenType.COMMA, "',' before 'toLoc'");
                callKeyword("toLoc");
                to = identifier();
                tokens.expect(TokenType.RPAREN, "')' closing 'toLoc'");
            } else {
                from = identifier();
                tokens.expect(TokenType.COMMA, "',' before the target location");
                to = identifier();
            }
            return new TranslocationTerm(target, from, to);
        }

        private Term fusion(BelFunction function) throws BelParseException {
            String keyword = callKeyword("fus", "fusion");
            Identifier partner5 = identifier();
            tokens.expect(TokenType.COMMA, "',' after the 5' fusion partner");
            String range5 = null;
            if (tokens.peek().is(TokenType.STRING)) {
                range5 = tokens.next().text();
                tokens.expect(TokenType.COMMA, "',' after the 5' range");
            }
            Identifier partner3 = identifier();
            String range3 = null;
            if (tokens.accept(TokenType.COMMA)) {
                range3 = text("3' range");
            }
            tokens.expect(TokenType.RPAREN, "')' closing '" + keyword + "'");
            return new FusionTerm(function, partner5, range5, partner3, range3);
        }

        private Variant variant(BelFunction function) throws BelParseException {
            Token keyword = tokens.peek();
            if (!keyword.is(TokenType.WORD) || !tokens.peek(1).is(TokenType.LPAREN)) {
                throw new StructuralException(WarningKind.MALFORMED_TERM,
                        "expected a variant at column " + keyword.column() + " but found " + keyword.describe());
            }
            String name = keyword.text();
            Variant variant = switch (name) {
                case "pmod", "proteinModification" -> {
                    requireFunction(function, name, BelFunction.PROTEIN);
                    yield proteinModification();
                }
                case "gmod", "geneModification" -> {
                    requireFunction(function, name, BelFunction.GENE);
                    yield Variant.geneModification(calledIdentifier());
                }
                case "var", "variant" -> {
                    requireVariants(function, name);
                    tokens.next();
                    tokens.next();
                    yield Variant.hgvs(text("HGVS description"));
                }
                case "frag", "fragment" -> {
                    requireFunction(function, name, BelFunction.PROTEIN);
                    tokens.next();
                    tokens.next();
                    String range = text("fragment range");
                    String description = tokens.accept(TokenType.COMMA) ? text("fragment description") : null;
                    yield Variant.fragment(range, description);
                }
                case "loc", "location" -> {
                    tokens.next();
                    tokens.next();
                    yield Variant.location(identifier());
                }
                case "sub", "substitution" -> {
                    requireVariants(function, name);
                    yield substitution(function);
                }
                case "trunc", "truncation" -> {
                    requireFunction(function, name, BelFunction.PROTEIN);
                    tokens.next();
                    tokens.next();
                    yield Variant.hgvs("p." + position() + "*");
                }
                default -> throw new StructuralException(WarningKind.UNKNOWN_FUNCTION,
                        "unknown variant '" + name + "' at column " + keyword.column());
            };
            tokens.expect(TokenType.RPAREN, "')' closing '" + name + "'");
            return variant;
        }

        private Variant proteinModification() throws BelParseException {
            tokens.next();
            tokens.next();
            Identifier modification = defaultedIdentifier();
            if (modification.isDefaultNamespace() && LEGACY_MODIFICATIONS.containsKey(modification.name())) {
                modification = Identifier.of(Identifier.DEFAULT_NAMESPACE,
                        LEGACY_MODIFICATIONS.get(modification.name()));
            }
            String aminoAcid = null;
            String position = null;
            if (tokens.accept(TokenType.COMMA)) {
                aminoAcid = aminoAcid();
                if (tokens.accept(TokenType.COMMA)) {
                    position = position();
                }
            }
            return Variant.proteinModification(modification, aminoAcid, position);
        }

        private Variant substitution(BelFunction function) throws BelParseException {
            tokens.next();
            tokens.next();
            String reference = word("reference residue");
            tokens.expect(TokenType.COMMA, "',' after the reference residue");
            String position = position();
            tokens.expect(TokenType.COMMA, "',' after the position");
            String variant = word("variant residue");
            if (function == BelFunction.PROTEIN) {
                return Variant.hgvs("p." + threeLetter(reference) + position + threeLetter(variant));
            }
            return Variant.hgvs("c." + position + reference + ">" + variant);
        }

        private Identifier calledIdentifier() throws BelParseException {
            tokens.next();
            tokens.next();
            return defaultedIdentifier();
        }

        private String aminoAcid() throws BelParseException {
            return threeLetter(word("amino acid"));
        }

        private String threeLetter(String code) {
            return AMINO_ACIDS.getOrDefault(code, code);
        }

        private String position() throws BelParseException {
            Token token = tokens.peek();
            String value = word("position");
            if (!value.chars().allMatch(Character::isDigit)) {
                throw new StructuralException(WarningKind.MALFORMED_TERM,
                        "position must be numeric at column " + token.column() + " but was '" + value + "'");
            }
            return value;
        }

        private void requireFunction(BelFunction function, String variant, BelFunction allowed)
                throws StructuralException {
            if (function != allowed) {
                throw new StructuralException(WarningKind.MALFORMED_TERM,
                        "'" + variant + "' is not allowed in '" + function.getShortName() + "'");
            }
        }

        private void requireVariants(BelFunction function, String variant) throws StructuralException {
            if (!function.acceptsVariants()) {
                throw new StructuralException(WarningKind.MALFORMED_TERM,
                        "'" + variant + "' is not allowed in '" + function.getShortName() + "'");
            }
        }

        /**
         * Namespaced identifier, or a naked one under lenient parsing.
         */
        private Identifier identifier() throws BelParseException {
            Token first = tokens.peek();
            if (tokens.peek(1).is(TokenType.COLON)) {
                if (!first.is(TokenType.WORD)) {
                    throw new StructuralException(WarningKind.MALFORMED_TERM,
                            "expected a namespace at column " + first.column() + " but found " + first.describe());
                }
                tokens.next();
                tokens.next();
                String name = text("name");
                Identifier identifier = Identifier.of(first.text(), name);
                validate(identifier);
                return identifier;
            }
            String name = text("identifier");
            if (!config.allowNakedNames()) {
                throw new SemanticException(WarningKind.NAKED_NAME,
                        "name '" + name + "' at column " + first.column() + " has no namespace");
            }
            return Identifier.naked(config.nakedNamespace(), name);
        }

        /**
         * Identifier whose namespace defaults to the built-in BEL vocabulary, as in {@code ma(kin)}.
         */
        private Identifier defaultedIdentifier() throws BelParseException {
            if (tokens.peek(1).is(TokenType.COLON)) {
                return identifier();
            }
            return Identifier.of(Identifier.DEFAULT_NAMESPACE, text("name"));
        }

        private void validate(Identifier identifier) {
            if (identifier.isDefaultNamespace()) {
                return;
            }
            Resolution resolution;
            try {
                resolution = resolver.resolve(identifier.namespace(), identifier.name());
            } catch (RuntimeException e) {
                log.warn("resolver.failed namespace={} name={} error={}",
                        identifier.namespace(), identifier.name(), e.getMessage());
                note(WarningKind.UNKNOWN_NAMESPACE_TERM,
                        "could not validate " + identifier.toBel() + ": resolver failed: " + e.getMessage());
                return;
            }
            if (resolution == null || resolution == Resolution.UNKNOWN) {
                note(WarningKind.UNKNOWN_NAMESPACE_TERM,
                        "'" + identifier.name() + "' is not in namespace " + identifier.namespace());
            } else if (resolution == Resolution.NAMESPACE_UNDECLARED) {
                note(WarningKind.NAMESPACE_UNDECLARED,
                        "namespace " + identifier.namespace() + " is not declared");
            }
        }

        private void note(WarningKind kind, String message) {
            notes.add(new ParseWarning(lineNumber, line, kind, message));
        }

        private String text(String what) throws StructuralException {
            Token token = tokens.peek();
            if (!token.is(TokenType.WORD) && !token.is(TokenType.STRING)) {
                throw new StructuralException(WarningKind.MALFORMED_TERM,
                        "expected " + what + " at column " + token.column() + " but found " + token.describe());
            }
            return tokens.next().text();
        }

        private String word(String what) throws StructuralException {
            return tokens.expect(TokenType.WORD, what).text();
        }

        private boolean isCall(String... keywords) {
            if (!tokens.peek(1).is(TokenType.LPAREN)) {
                return false;
            }
            for (String keyword : keywords) {
                if (tokens.peek().isWord(keyword)) {
                    return true;
                }
            }
            return false;
        }

        private boolean isCallAhead() {
            return tokens.peek().is(TokenType.WORD) && tokens.peek(1).is(TokenType.LPAREN);
        }

        /**
         * Consumes {@code keyword (} for one of the given keywords and returns the keyword used.
         */
        private String callKeyword(String... keywords) throws StructuralException {
            if (!isCall(keywords)) {
                Token token = tokens.peek();
                throw new StructuralException(WarningKind.MALFORMED_TERM,
                        "expected '" + keywords[0] + "(' at column " + token.column() + " but found " + token.describe());
            }
            String keyword = tokens.next().text();
            tokens.next();
            return keyword;
        }
    }
}
