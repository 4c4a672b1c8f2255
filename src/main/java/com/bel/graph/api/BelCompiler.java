package com.bel.graph.api;

import com.bel.graph.assembly.BelGraph;
import com.bel.graph.assembly.GraphMerger;
import com.bel.graph.core.model.Term;
import com.bel.graph.document.DocumentParser;
import com.bel.graph.document.ProgressCallback;
import com.bel.graph.jgif.JgifImporter;
import com.bel.graph.metrics.MetricsService;
import com.bel.graph.metrics.NoOpMetricsService;
import com.bel.graph.namespace.CachingNamespaceResolver;
import com.bel.graph.namespace.NamespaceResolver;
import com.bel.graph.namespace.ResolverCacheConfig;
import com.bel.graph.parser.ParseResult;
import com.bel.graph.parser.ParserConfig;
import com.bel.graph.parser.TermParser;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.nio.file.Path;
import java.util.List;

/**
 * Main entry point: compiles BEL documents and JGIF exports into {@link BelGraph}s.
 *
 * <p>A compiler is immutable and thread-safe as long as its resolver is; every call parses
 * into a fresh graph and control context.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * BelCompiler compiler = BelCompiler.builder()
 *     .config(ParserConfig.builder().allowNested(true).build())
 *     .resolver(myResolver)
 *     .cache(ResolverCacheConfig.defaults())
 *     .build();
 *
 * BelGraph graph = compiler.parse(Path.of("small_corpus.bel"));
 * graph.getWarnings().forEach(System.out::println);
 * </pre>
 */
public class BelCompiler {
    private static final Logger log = LoggerFactory.getLogger(BelCompiler.class);

    private final ParserConfig config;
    private final NamespaceResolver resolver;
    private final MetricsService metrics;
    private final DocumentParser documentParser;
    private final JgifImporter jgifImporter;

    private BelCompiler(Builder builder) {
        this.config = builder.config;
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        NamespaceResolver base = builder.resolver != null ? builder.resolver : NamespaceResolver.permissive();
        this.resolver = builder.cacheConfig != null && builder.cacheConfig.enabled()
                ? new CachingNamespaceResolver(base, builder.cacheConfig, metrics)
                : base;
        this.documentParser = new DocumentParser(config, resolver, metrics);
        this.jgifImporter = new JgifImporter(config, resolver, metrics);
        log.debug("compiler.created allowNakedNames={} allowNested={} citationClearing={} inferImplicitEdges={}",
                config.allowNakedNames(), config.allowNested(), config.citationClearing(), config.inferImplicitEdges());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A compiler with strict defaults and a resolver that accepts every name.
     */
    public static BelCompiler defaults() {
        return builder().build();
    }

    public ParserConfig getConfig() {
        return config;
    }

    public NamespaceResolver getResolver() {
        return resolver;
    }

    public BelGraph parse(Iterable<String> lines) {
        return documentParser.parse(lines);
    }

    /**
     * Parses a document held in memory.
     */
    public BelGraph parse(String document) {
        return documentParser.parse(document.lines().toList());
    }

    public BelGraph parse(Reader reader, String documentName) {
        return documentParser.parse(reader, documentName, ProgressCallback.NONE);
    }

    public BelGraph parse(Path path) {
        return documentParser.parse(path);
    }

    public BelGraph parse(Path path, ProgressCallback callback) {
        return documentParser.parse(path, callback);
    }

    /**
     * Parses documents independently and merges the graphs, in argument order.
     */
    public BelGraph parseAll(List<Path> paths) {
        return GraphMerger.merge(paths.stream().map(this::parse).toList());
    }

    /**
     * Parses a single term without recording anything.
     */
    public ParseResult<Term> parseTerm(String text) {
        return new TermParser(config, resolver, null).parseTerm(text, 1);
    }

    public BelGraph importJgif(Reader reader) {
        return jgifImporter.importGraph(reader);
    }

    public BelGraph importJgif(JsonNode root) {
        return jgifImporter.importGraph(root);
    }

    public BelGraph importCbnJgif(Reader reader) {
        return jgifImporter.importCbn(reader);
    }

    public BelGraph importCbnJgif(JsonNode root) {
        return jgifImporter.importCbn(root);
    }

    public static class Builder {
        private ParserConfig config = ParserConfig.defaults();
        private NamespaceResolver resolver;
        private ResolverCacheConfig cacheConfig;
        private MetricsService metricsService;

        /**
         * Sets the parser policy.
         */
        public Builder config(ParserConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the namespace resolver. Defaults to {@link NamespaceResolver#permissive()}.
         */
        public Builder resolver(NamespaceResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /**
         * Caches resolver lookups with the given configuration.
         */
        public Builder cache(ResolverCacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Sets a custom metrics service for recording parse metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public BelCompiler build() {
            if (config == null) {
                throw new IllegalStateException("ParserConfig is required");
            }
            return new BelCompiler(this);
        }
    }
}
