package me.comfortable_andy.eval;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.comfortable_andy.eval.lexing.Lexer;
import me.comfortable_andy.eval.lexing.Token;
import me.comfortable_andy.eval.parsing.Parser;
import me.comfortable_andy.eval.parsing.node.Node;
import me.comfortable_andy.eval.parsing.node.Visitor;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ties a lexer, a parser and an evaluator together. Remembers the tokens and the tree of the
 * last {@link #parse(String)}, so an instance should not be shared between threads.
 *
 * @param <T> result of an evaluation
 * @author AndyNoob
 */
@Slf4j
@Getter
public abstract class AbstractEvaluator<T> {

    protected Lexer lexer;
    protected Parser parser;
    protected List<Token> tokens = Collections.emptyList();
    protected /* nullable */ Node tree;

    protected AbstractEvaluator(Lexer lexer, Parser parser) {
        this.lexer = lexer;
        this.parser = parser;
    }

    public void replaceLexer(Lexer lexer) {
        this.lexer = lexer;
    }

    public void replaceParser(Parser parser) {
        this.parser = parser;
    }

    public void allowImplicitMultiplication(boolean flag) {
        this.parser.setImplicitMultiplication(flag);
    }

    public void setSimplifying(boolean flag) {
        this.parser.setSimplifying(flag);
    }

    public void setDebugMode(boolean flag) {
        this.parser.setDebugMode(flag);
    }

    public Node parse(String expression) {
        this.tokens = this.lexer.tokenize(expression);
        log.trace("Tokenized {} into {} tokens", expression, this.tokens.size());
        this.tree = this.parser.parse(this.tokens);
        log.debug("Parsed {} as {}", expression, this.tree);
        return this.tree;
    }

    public T evaluate(String expression) {
        return evaluate(expression, Collections.emptyMap());
    }

    public T evaluate(String expression, Map<String, ?> variables) {
        return parse(expression).accept(createEvaluator(variables));
    }

    protected abstract Visitor<T> createEvaluator(Map<String, ?> variables);

}
