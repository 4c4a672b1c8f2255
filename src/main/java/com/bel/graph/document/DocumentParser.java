package com.bel.graph.document;

import com.bel.graph.assembly.BelGraph;
import com.bel.graph.assembly.GraphAssembler;
import com.bel.graph.core.model.ParseWarning;
import com.bel.graph.core.model.WarningKind;
import com.bel.graph.logging.LogContext;
import com.bel.graph.metrics.MetricsService;
import com.bel.graph.metrics.NoOpMetricsService;
import com.bel.graph.namespace.NamespaceResolver;
import com.bel.graph.namespace.PatternNamespaceResolver;
import com.bel.graph.parser.BelParseException;
import com.bel.graph.parser.ControlContext;
import com.bel.graph.parser.ControlParser;
import com.bel.graph.parser.LexicalException;
import com.bel.graph.parser.ParserConfig;
import com.bel.graph.parser.SemanticException;
import com.bel.graph.parser.StatementParser;
import com.bel.graph.parser.TermParser;
import com.bel.graph.parser.Token;
import com.bel.graph.parser.TokenStream;
import com.bel.graph.parser.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Drives the parse of a whole BEL document.
 *
 * <p>A document has three sections, in order: document metadata ({@code SET DOCUMENT}),
 * definitions ({@code DEFINE NAMESPACE|ANNOTATION}) and statements, where {@code SET} and
 * {@code UNSET} lines control the context of the statements that follow. Metadata or
 * definition lines after the first statement line are skipped with a warning.</p>
 *
 * <p>No line-level failure stops the parse: every problem, including unexpected runtime
 * failures and I/O errors, is recorded as a {@link ParseWarning} on the returned graph.
 * Each call works on its own graph and context, so one instance may parse several
 * documents concurrently.</p>
 */
public class DocumentParser {
    private static final Logger log = LoggerFactory.getLogger(DocumentParser.class);
    private static final int PROGRESS_INTERVAL = 1000;

    public static final Set<String> DOCUMENT_KEYS = Set.of(
            "Name", "Version", "Description", "Authors", "ContactInfo", "Copyright", "Licenses", "Disclaimer");

    private static final String DEFINE = "DEFINE";
    private static final String DOCUMENT = "DOCUMENT";
    private static final String DEFAULT_DOCUMENT_NAME = "<input>";

    private final ParserConfig config;
    private final NamespaceResolver resolver;
    private final MetricsService metrics;

    public DocumentParser(ParserConfig config, NamespaceResolver resolver) {
        this(config, resolver, new NoOpMetricsService());
    }

    public DocumentParser(ParserConfig config, NamespaceResolver resolver, MetricsService metrics) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public BelGraph parse(Iterable<String> lines) {
        return parse(lines, DEFAULT_DOCUMENT_NAME, ProgressCallback.NONE);
    }

    public BelGraph parse(Iterable<String> lines, String documentName, ProgressCallback callback) {
        return run(new LogicalLineReader(lines), documentName, callback);
    }

    public BelGraph parse(Reader reader) {
        return parse(reader, DEFAULT_DOCUMENT_NAME, ProgressCallback.NONE);
    }

    public BelGraph parse(Reader reader, String documentName, ProgressCallback callback) {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        return run(new LogicalLineReader(br), documentName, callback);
    }

    /**
     * Parses a UTF-8 file. A file that cannot be opened yields an empty graph with an
     * {@link WarningKind#UNREADABLE_INPUT} warning.
     */
    public BelGraph parse(Path path, ProgressCallback callback) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.getFileName().toString(), callback);
        } catch (IOException e) {
            log.error("document.unreadable path={} error={}", path, e.getMessage());
            Run run = new Run();
            run.assembler.addWarning(new ParseWarning(0, "", WarningKind.UNREADABLE_INPUT,
                    "cannot read " + path + ": " + e.getMessage()));
            return run.assembler.complete();
        }
    }

    public BelGraph parse(Path path) {
        return parse(path, ProgressCallback.NONE);
    }

    private BelGraph run(LogicalLineReader reader, String documentName, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NONE;
        String name = documentName != null ? documentName : DEFAULT_DOCUMENT_NAME;
        long start = System.nanoTime();
        Run run = new Run();
        long processed = 0;

        try (LogContext ctx = LogContext.forDocument(LogContext.generateParseId(), name)) {
            log.debug("document.started document={}", name);
            try {
                LogicalLine line;
                while ((line = reader.next()) != null) {
                    run.handle(line);
                    processed++;
                    if (processed % PROGRESS_INTERVAL == 0) {
                        cb.onProgress(processed, run.graph.edgeCount(), false);
                    }
                }
            } catch (IOException | UncheckedIOException e) {
                log.error("document.read.failed document={} line={} error={}",
                        name, reader.getPhysicalLineNumber(), e.getMessage());
                run.assembler.addWarning(new ParseWarning(reader.getPhysicalLineNumber(), "",
                        WarningKind.UNREADABLE_INPUT, "read failed: " + e.getMessage()));
            }

            BelGraph graph = run.assembler.complete();
            metrics.recordLinesProcessed(processed);
            metrics.recordParseDuration(Duration.ofNanos(System.nanoTime() - start));
            cb.onProgress(processed, graph.edgeCount(), true);
            log.info("document.parsed document={} lines={} nodes={} edges={} warnings={}",
                    name, processed, graph.nodeCount(), graph.edgeCount(), graph.getWarnings().size());
            return graph;
        }
    }

    /**
     * State of one document parse.
     */
    private final class Run {
        private final BelGraph graph = new BelGraph();
        private final GraphAssembler assembler = new GraphAssembler(graph, config.inferImplicitEdges(), metrics);
        private final ControlParser controlParser = new ControlParser(ControlContext.of(config), graph);
        private final StatementParser statementParser = new StatementParser(
                new TermParser(config, new PatternNamespaceResolver(graph.getNamespacePatterns(), resolver), assembler),
                controlParser.getContext(),
                assembler);
        private boolean inStatements;

        void handle(LogicalLine line) {
            String text = line.text();
            try {
                if (startsWithWord(text, DEFINE)) {
                    checkHeaderSection("definition");
                    define(text);
                } else if (isDocumentLine(text)) {
                    checkHeaderSection("document metadata");
                    document(text);
                } else if (ControlParser.isControlLine(text)) {
                    inStatements = true;
                    controlParser.parse(text);
                } else {
                    inStatements = true;
                    statementParser.parseStatement(text, line.lineNumber());
                }
            } catch (BelParseException e) {
                assembler.addWarning(e.toWarning(line.lineNumber(), text));
            } catch (RuntimeException e) {
                log.warn("line.failed line={} error={}", line.lineNumber(), e.toString());
                assembler.addWarning(new ParseWarning(line.lineNumber(), text, WarningKind.UNPARSABLE_LINE,
                        "unexpected failure: " + e));
            }
        }

        private void checkHeaderSection(String what) throws BelParseException {
            if (inStatements) {
                throw new BelParseException(WarningKind.MISPLACED_LINE,
                        what + " after the first statement is ignored");
            }
        }

        private void document(String text) throws BelParseException {
            TokenStream tokens = TokenStream.of(text);
            tokens.next();
            tokens.next();
            String key = word(tokens, "metadata key");
            expect(tokens, TokenType.EQUALS, "'='");
            String value = value(tokens);
            end(tokens);
            if (!DOCUMENT_KEYS.contains(key)) {
                throw new SemanticException(WarningKind.INVALID_METADATA,
                        "unknown document key '" + key + "', expected one of " + DOCUMENT_KEYS);
            }
            assembler.putMetadata(key, value);
        }

        private void define(String text) throws BelParseException {
            TokenStream tokens = TokenStream.of(text);
            tokens.next();
            String target = word(tokens, "NAMESPACE or ANNOTATION");
            boolean namespace;
            if ("NAMESPACE".equals(target)) {
                namespace = true;
            } else if ("ANNOTATION".equals(target)) {
                namespace = false;
            } else {
                throw unparsable("expected NAMESPACE or ANNOTATION but found '" + target + "'");
            }
            String keyword = word(tokens, "keyword");
            if (!"AS".equals(word(tokens, "AS"))) {
                throw unparsable("expected AS after " + keyword);
            }
            String kind = word(tokens, "URL, PATTERN or LIST");
            switch (kind) {
                case "URL" -> {
                    String url = value(tokens);
                    end(tokens);
                    if (namespace) {
                        assembler.declareNamespaceUrl(keyword, url);
                    } else {
                        assembler.declareAnnotationUrl(keyword, url);
                    }
                }
                case "PATTERN" -> {
                    Pattern pattern = compile(keyword, value(tokens));
                    end(tokens);
                    if (namespace) {
                        assembler.declareNamespacePattern(keyword, pattern);
                    } else {
                        assembler.declareAnnotationPattern(keyword, pattern);
                    }
                }
                case "LIST" -> {
                    Set<String> values = list(tokens);
                    end(tokens);
                    if (namespace) {
                        // enumerated namespaces are validated locally, like patterns
                        assembler.declareNamespacePattern(keyword, Pattern.compile(values.stream()
                                .map(Pattern::quote)
                                .collect(Collectors.joining("|"))));
                    } else {
                        assembler.declareAnnotationList(keyword, values);
                    }
                }
                default -> throw unparsable("expected URL, PATTERN or LIST but found '" + kind + "'");
            }
            log.debug("definition.added target={} keyword={} kind={}", target, keyword, kind);
        }

        private Pattern compile(String keyword, String regex) throws LexicalException {
            try {
                return Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new LexicalException(WarningKind.UNPARSABLE_LINE,
                        "invalid pattern for " + keyword + ": " + e.getDescription());
            }
        }

        private Set<String> list(TokenStream tokens) throws BelParseException {
            expect(tokens, TokenType.LBRACE, "'{'");
            Set<String> values = new LinkedHashSet<>();
            if (!tokens.peek().is(TokenType.RBRACE)) {
                do {
                    values.add(value(tokens));
                } while (tokens.accept(TokenType.COMMA));
            }
            expect(tokens, TokenType.RBRACE, "'}'");
            return values;
        }
    }

    private static boolean isDocumentLine(String text) {
        if (!startsWithWord(text, ControlParser.SET)) {
            return false;
        }
        String rest = text.substring(ControlParser.SET.length()).stripLeading();
        return startsWithWord(rest, DOCUMENT);
    }

    private static boolean startsWithWord(String text, String word) {
        return text.startsWith(word)
                && (text.length() == word.length() || Character.isWhitespace(text.charAt(word.length())));
    }

    private static String word(TokenStream tokens, String what) throws LexicalException {
        Token token = tokens.peek();
        if (!token.is(TokenType.WORD)) {
            throw unparsable("expected " + what + " at column " + token.column() + " but found " + token.describe());
        }
        return tokens.next().text();
    }

    private static String value(TokenStream tokens) throws LexicalException {
        Token token = tokens.peek();
        if (!token.is(TokenType.WORD) && !token.is(TokenType.STRING)) {
            throw unparsable("expected a value at column " + token.column() + " but found " + token.describe());
        }
        return tokens.next().text();
    }

    private static void expect(TokenStream tokens, TokenType type, String what) throws LexicalException {
        if (!tokens.accept(type)) {
            Token token = tokens.peek();
            throw unparsable("expected " + what + " at column " + token.column() + " but found " + token.describe());
        }
    }

    private static void end(TokenStream tokens) throws LexicalException {
        if (!tokens.atEnd()) {
            Token token = tokens.peek();
            throw unparsable("unexpected " + token.describe() + " at column " + token.column());
        }
    }

    private static LexicalException unparsable(String message) {
        return new LexicalException(WarningKind.UNPARSABLE_LINE, message);
    }
}
