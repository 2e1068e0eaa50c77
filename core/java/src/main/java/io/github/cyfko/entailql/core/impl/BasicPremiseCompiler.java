package io.github.cyfko.entailql.core.impl;

import io.github.cyfko.entailql.core.api.CompiledPremise;
import io.github.cyfko.entailql.core.api.PremiseCompiler;
import io.github.cyfko.entailql.core.ast.Expression;
import io.github.cyfko.entailql.core.cache.BoundedLRUCache;
import io.github.cyfko.entailql.core.config.CachePolicy;
import io.github.cyfko.entailql.core.config.ParserPolicy;
import io.github.cyfko.entailql.core.exception.PremiseSyntaxException;
import io.github.cyfko.entailql.core.parsing.PostfixExpressionBuilder;
import io.github.cyfko.entailql.core.parsing.Scanner;
import io.github.cyfko.entailql.core.parsing.ShuntingYardParser;
import io.github.cyfko.entailql.core.parsing.Token;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link PremiseCompiler}: scans, parses and builds each formula in three phases.
 * <ol>
 *   <li>{@link Scanner#scan(String)} - lazy tokenisation of the lower-cased formula</li>
 *   <li>{@link ShuntingYardParser#toPostfix(java.util.Iterator)} - validation and postfix conversion</li>
 *   <li>{@link PostfixExpressionBuilder#build(List)} - expression tree construction</li>
 * </ol>
 * <p>
 * The scanner, and its compiled token pattern, belong to this compiler instance. Compiled premises
 * are immutable and can be cached per instance according to the {@link CachePolicy}.
 * </p>
 *
 * <pre>{@code
 * PremiseCompiler compiler = new BasicPremiseCompiler(ParserPolicy.strict(), CachePolicy.none());
 * List<CompiledPremise> premises = compiler.compileAll(List.of("a", "a => b"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicPremiseCompiler implements PremiseCompiler {

    private static final Logger log = Logger.getLogger(BasicPremiseCompiler.class.getName());

    private final ParserPolicy parserPolicy;
    private final Scanner scanner = new Scanner();
    protected final BoundedLRUCache<String, CompiledPremise> cache;

    public BasicPremiseCompiler() {
        this(ParserPolicy.defaults(), CachePolicy.defaults());
    }

    public BasicPremiseCompiler(ParserPolicy parserPolicy) {
        this(parserPolicy, CachePolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param parserPolicy input limits
     * @param cachePolicy  compiled-premise cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public BasicPremiseCompiler(ParserPolicy parserPolicy, CachePolicy cachePolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }
        this.parserPolicy = parserPolicy;
        this.cache = cachePolicy.cacheEnabled()
                ? new BoundedLRUCache<>(cachePolicy.cacheSize())
                : null;
    }

    /**
     * {@inheritDoc}
     * <p>
     * The formula is lower-cased before scanning; reported positions refer to that string.
     * </p>
     *
     * @throws PremiseSyntaxException with {@code EXPRESSION_TOO_LONG} if the formula exceeds
     *                                {@link ParserPolicy#maxExpressionLength()}, or at the first
     *                                syntax error
     */
    @Override
    public CompiledPremise compile(String formula) throws PremiseSyntaxException {
        Objects.requireNonNull(formula, "formula cannot be null");
        if (formula.length() > parserPolicy.maxExpressionLength()) {
            throw PremiseSyntaxException.expressionTooLong(
                    formula.length(), parserPolicy.maxExpressionLength(), parserPolicy.policyName());
        }

        if (cache == null) {
            return doCompile(formula);
        }
        return cache.computeIfAbsent(formula, this::doCompile);
    }

    private CompiledPremise doCompile(String source) {
        String normalized = source.toLowerCase(Locale.ROOT);
        List<Token> postfix = ShuntingYardParser.toPostfix(scanner.scan(normalized));
        Expression expression = PostfixExpressionBuilder.build(postfix);
        CompiledPremise premise = new CompiledPremise(source, postfix, expression);
        log.fine(() -> String.format("Compiled premise '%s' to '%s'", source, premise.postfixForm()));
        return premise;
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return map with {@code enabled}, {@code size}, {@code maxSize}, {@code hits} and {@code misses},
     *         or only {@code enabled=false} if the cache is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }
        return Map.of(
                "enabled", true,
                "size", cache.size(),
                "maxSize", cache.getMaxSize(),
                "hits", cache.getHits(),
                "misses", cache.getMisses()
        );
    }
}
