package com.oloc.core;

import com.oloc.config.OlocConfig;
import com.oloc.evaluator.Evaluation;
import com.oloc.evaluator.Evaluator;
import com.oloc.function.FunctionType;
import com.oloc.lexer.Lexer;
import com.oloc.parser.AstNode;
import com.oloc.parser.Parser;
import com.oloc.preprocess.NormalizedExpression;
import com.oloc.preprocess.Preprocessor;
import com.oloc.token.TokenGrammar;
import com.oloc.token.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs the preprocess, tokenize, parse and evaluate pipeline on one expression.
 * Instances hold only immutable configuration and are safe to share.
 */
public class Calculator {

    private static final Logger log = LoggerFactory.getLogger(Calculator.class);

    private final OlocConfig config;
    private final Preprocessor preprocessor;
    private final Lexer lexer;

    public Calculator(OlocConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.preprocessor = new Preprocessor(config);
        this.lexer = new Lexer();
        log.info("Calculator initialized: {} symbol entries, {} function entries, {} decimal places",
                config.symbols().entries().size(), config.functions().entries().size(), config.decimalPlaces());
    }

    public Result calculate(String expression) {
        return calculate(expression, CalculationOptions.from(config));
    }

    /**
     * Calculate in the calling thread. The time limit of {@code options} is only
     * enforced when running under a supervisor.
     */
    public Result calculate(String expression, CalculationOptions options) {
        Objects.requireNonNull(expression, "expression");
        NormalizedExpression normalized = preprocessor.process(expression);
        TokenStream tokens = lexer.tokenize(normalized);
        AstNode tree = new Parser(expression, tokens).parse();
        log.debug("Parsed '{}' into {}", expression, tree);
        Evaluation evaluation = new Evaluator(expression).evaluate(tree);
        return new Result(expression, evaluation.value(), evaluation.steps(),
                evaluation.params().asMap(), options.decimalPlaces());
    }

    /**
     * Whether {@code symbol} collides with a reserved word: a function name, a
     * canonical operator or constant, or a name with the reserved prefix.
     */
    public boolean isReserved(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return false;
        }
        return FunctionType.fromName(symbol).isPresent() || TokenGrammar.isReservedSymbol(symbol);
    }

    public OlocConfig getConfig() {
        return config;
    }
}
