package org.csu.vhdlfmt.compiler.parser;

import org.csu.vhdlfmt.common.exception.ParseException;
import org.csu.vhdlfmt.compiler.lexer.Token;
import org.csu.vhdlfmt.compiler.lexer.TokenKind;
import org.csu.vhdlfmt.compiler.parser.ast.DesignFile;
import org.csu.vhdlfmt.compiler.parser.ast.Ident;
import org.csu.vhdlfmt.compiler.parser.ast.TokenSpan;
import org.csu.vhdlfmt.compiler.parser.ast.configuration.*;
import org.csu.vhdlfmt.compiler.parser.ast.context.ContextItem;
import org.csu.vhdlfmt.compiler.parser.ast.context.ContextReference;
import org.csu.vhdlfmt.compiler.parser.ast.context.LibraryClause;
import org.csu.vhdlfmt.compiler.parser.ast.context.UseClause;
import org.csu.vhdlfmt.compiler.parser.ast.expression.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)，并为每个节点记录 TokenSpan。
 * 只覆盖配置声明相关的语法：上下文子句、配置声明、块配置、组件配置、配置说明。
 */
public class Parser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private static final Set<TokenKind> LOGICAL_OPERATORS = Set.of(
            TokenKind.AND, TokenKind.OR, TokenKind.XOR, TokenKind.NAND, TokenKind.NOR, TokenKind.XNOR);
    private static final Set<TokenKind> RELATIONAL_OPERATORS = Set.of(
            TokenKind.EQ, TokenKind.NE, TokenKind.LT, TokenKind.LTE, TokenKind.GT, TokenKind.GTE);
    private static final Set<TokenKind> SHIFT_OPERATORS = Set.of(
            TokenKind.SLL, TokenKind.SRL, TokenKind.SLA, TokenKind.SRA, TokenKind.ROL, TokenKind.ROR);
    private static final Set<TokenKind> ADDING_OPERATORS = Set.of(
            TokenKind.PLUS, TokenKind.MINUS, TokenKind.CONCAT);
    private static final Set<TokenKind> MULTIPLYING_OPERATORS = Set.of(
            TokenKind.TIMES, TokenKind.DIV, TokenKind.MOD, TokenKind.REM);
    private static final Set<TokenKind> LITERALS = Set.of(
            TokenKind.ABSTRACT_LITERAL, TokenKind.STRING_LITERAL, TokenKind.BIT_STRING,
            TokenKind.CHARACTER_LITERAL, TokenKind.NULL);

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int position = 0;

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    public Parser(List<Token> tokens, int maxNestingDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != TokenKind.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
    }

    public DesignFile parseDesignFile() {
        List<ConfigurationDeclaration> units = new ArrayList<>();
        while (!isAtEnd()) {
            units.add(parseDesignUnit());
        }
        return new DesignFile(units, position);
    }

    /**
     * 解析一个独立的配置说明，Token 流中只能有这一条
     */
    public ConfigurationSpecification parseConfigurationSpecification() {
        int start = position;
        ComponentSpecification spec = parseComponentSpecification();
        BindingIndication bindingIndication = parseBindingIndication();
        List<VUnitBindingIndication> vunitBindings = parseVUnitBindingIndications();
        Integer endToken = null;
        if (check(TokenKind.END)) {
            endToken = position;
            advance();
            consume(TokenKind.FOR, "'for' after 'end'");
            consume(TokenKind.SEMICOLON, "';' after 'end for'");
        }
        TokenSpan span = span(start);
        if (!isAtEnd()) {
            throw new ParseException(peek(), "end of input after the configuration specification");
        }
        return new ConfigurationSpecification(spec, bindingIndication, vunitBindings, endToken, span);
    }

    // ---- 设计单元与上下文子句 ----

    private ConfigurationDeclaration parseDesignUnit() {
        List<ContextItem> contextClause = parseContextClause();
        if (!check(TokenKind.CONFIGURATION)) {
            throw new ParseException(peek(), "'configuration' (only configuration declarations are supported)");
        }
        return parseConfigurationDeclaration(contextClause);
    }

    private List<ContextItem> parseContextClause() {
        List<ContextItem> items = new ArrayList<>();
        while (true) {
            if (check(TokenKind.LIBRARY)) {
                items.add(parseLibraryClause());
            } else if (check(TokenKind.USE)) {
                items.add(parseUseClause());
            } else if (check(TokenKind.CONTEXT)) {
                items.add(parseContextReference());
            } else {
                return items;
            }
        }
    }

    private LibraryClause parseLibraryClause() {
        int start = position;
        consume(TokenKind.LIBRARY, "'library' keyword");
        List<Ident> libraries = new ArrayList<>();
        do {
            libraries.add(ident("library name"));
        } while (match(TokenKind.COMMA));
        consume(TokenKind.SEMICOLON, "';' after library clause");
        return new LibraryClause(libraries, span(start));
    }

    private UseClause parseUseClause() {
        int start = position;
        consume(TokenKind.USE, "'use' keyword");
        List<Name> names = new ArrayList<>();
        do {
            names.add(parseSelectedName());
        } while (match(TokenKind.COMMA));
        consume(TokenKind.SEMICOLON, "';' after use clause");
        return new UseClause(names, span(start));
    }

    private ContextReference parseContextReference() {
        int start = position;
        consume(TokenKind.CONTEXT, "'context' keyword");
        List<Name> names = new ArrayList<>();
        do {
            names.add(parseSelectedName());
        } while (match(TokenKind.COMMA));
        consume(TokenKind.SEMICOLON, "';' after context reference");
        return new ContextReference(names, span(start));
    }

    // ---- 配置声明 ----

    private ConfigurationDeclaration parseConfigurationDeclaration(List<ContextItem> contextClause) {
        int start = position;
        consume(TokenKind.CONFIGURATION, "'configuration' keyword");
        Ident name = ident("configuration name");
        consume(TokenKind.OF, "'of' after configuration name");
        Name entityName = parseSelectedName();
        consume(TokenKind.IS, "'is' after entity name");

        List<UseClause> declarations = new ArrayList<>();
        while (check(TokenKind.USE) && peekAt(1).kind() != TokenKind.VUNIT) {
            declarations.add(parseUseClause());
        }
        List<VUnitBindingIndication> vunitBindings = parseVUnitBindingIndications();
        BlockConfiguration blockConfiguration = parseBlockConfiguration(1);

        int endToken = position;
        consume(TokenKind.END, "'end' of configuration declaration");
        match(TokenKind.CONFIGURATION);
        match(TokenKind.IDENTIFIER);
        consume(TokenKind.SEMICOLON, "';' after configuration declaration");
        return new ConfigurationDeclaration(contextClause, name, entityName, declarations,
                vunitBindings, blockConfiguration, endToken, span(start));
    }

    private BlockConfiguration parseBlockConfiguration(int depth) {
        checkDepth(depth);
        int start = position;
        consume(TokenKind.FOR, "'for' at the start of a block configuration");
        Name blockSpec = parseName();

        List<UseClause> useClauses = new ArrayList<>();
        while (check(TokenKind.USE)) {
            useClauses.add(parseUseClause());
        }

        List<ConfigurationItem> items = new ArrayList<>();
        while (check(TokenKind.FOR)) {
            if (isComponentConfigurationAhead()) {
                items.add(parseComponentConfiguration(depth + 1));
            } else {
                items.add(parseBlockConfiguration(depth + 1));
            }
        }

        consume(TokenKind.END, "'end' of block configuration");
        consume(TokenKind.FOR, "'for' after 'end'");
        consume(TokenKind.SEMICOLON, "';' after 'end for'");
        return new BlockConfiguration(blockSpec, useClauses, items, span(start));
    }

    /**
     * for 之后是 all / others，或标签后紧跟 ',' / ':' 时为组件配置，否则为块配置
     */
    private boolean isComponentConfigurationAhead() {
        TokenKind next = peekAt(1).kind();
        if (next == TokenKind.ALL || next == TokenKind.OTHERS) {
            return true;
        }
        TokenKind afterNext = peekAt(2).kind();
        return next == TokenKind.IDENTIFIER && (afterNext == TokenKind.COMMA || afterNext == TokenKind.COLON);
    }

    private ComponentConfiguration parseComponentConfiguration(int depth) {
        checkDepth(depth);
        int start = position;
        ComponentSpecification spec = parseComponentSpecification();

        BindingIndication bindingIndication = null;
        if (check(TokenKind.USE) && peekAt(1).kind() != TokenKind.VUNIT) {
            bindingIndication = parseBindingIndication();
        }
        List<VUnitBindingIndication> vunitBindings = parseVUnitBindingIndications();
        BlockConfiguration blockConfiguration = null;
        if (check(TokenKind.FOR)) {
            blockConfiguration = parseBlockConfiguration(depth + 1);
        }

        consume(TokenKind.END, "'end' of component configuration");
        consume(TokenKind.FOR, "'for' after 'end'");
        consume(TokenKind.SEMICOLON, "';' after 'end for'");
        return new ComponentConfiguration(spec, bindingIndication, vunitBindings, blockConfiguration, span(start));
    }

    private ComponentSpecification parseComponentSpecification() {
        int start = position;
        consume(TokenKind.FOR, "'for' at the start of a component specification");
        InstantiationList instantiationList;
        if (match(TokenKind.ALL)) {
            instantiationList = new InstantiationList.All();
        } else if (match(TokenKind.OTHERS)) {
            instantiationList = new InstantiationList.Others();
        } else {
            List<Ident> labels = new ArrayList<>();
            do {
                labels.add(ident("instantiation label"));
            } while (match(TokenKind.COMMA));
            instantiationList = new InstantiationList.Labels(labels);
        }
        int colonToken = position;
        consume(TokenKind.COLON, "':' after instantiation list");
        Name componentName = parseSelectedName();
        return new ComponentSpecification(instantiationList, colonToken, componentName, span(start));
    }

    private BindingIndication parseBindingIndication() {
        int start = position;
        consume(TokenKind.USE, "'use' at the start of a binding indication");

        EntityAspect entityAspect = null;
        if (match(TokenKind.ENTITY)) {
            Name entityName = parseSelectedName();
            Ident architecture = null;
            if (match(TokenKind.LEFT_PAR)) {
                architecture = ident("architecture name");
                consume(TokenKind.RIGHT_PAR, "')' after architecture name");
            }
            entityAspect = new EntityAspect.Entity(entityName, architecture);
        } else if (match(TokenKind.CONFIGURATION)) {
            entityAspect = new EntityAspect.Configuration(parseSelectedName());
        } else if (match(TokenKind.OPEN)) {
            entityAspect = new EntityAspect.Open();
        }

        MapAspect genericMap = check(TokenKind.GENERIC) ? parseMapAspect(TokenKind.GENERIC) : null;
        MapAspect portMap = check(TokenKind.PORT) ? parseMapAspect(TokenKind.PORT) : null;
        if (entityAspect == null && genericMap == null && portMap == null) {
            throw new ParseException(peek(), "an entity aspect or a map aspect after 'use'");
        }
        consume(TokenKind.SEMICOLON, "';' after binding indication");
        return new BindingIndication(entityAspect, genericMap, portMap, span(start));
    }

    private MapAspect parseMapAspect(TokenKind kind) {
        int start = position;
        consume(kind, "'" + kind.name().toLowerCase() + "' keyword");
        consume(TokenKind.MAP, "'map' keyword");
        consume(TokenKind.LEFT_PAR, "'(' after 'map'");
        List<AssociationElement> elements = new ArrayList<>();
        do {
            elements.add(parseAssociationElement());
        } while (match(TokenKind.COMMA));
        consume(TokenKind.RIGHT_PAR, "')' after association list");
        return new MapAspect(elements, span(start));
    }

    private List<VUnitBindingIndication> parseVUnitBindingIndications() {
        List<VUnitBindingIndication> bindings = new ArrayList<>();
        while (check(TokenKind.USE) && peekAt(1).kind() == TokenKind.VUNIT) {
            int start = position;
            consume(TokenKind.USE, "'use' keyword");
            consume(TokenKind.VUNIT, "'vunit' keyword");
            List<Name> vunits = new ArrayList<>();
            do {
                vunits.add(parseSelectedName());
            } while (match(TokenKind.COMMA));
            consume(TokenKind.SEMICOLON, "';' after vunit binding");
            bindings.add(new VUnitBindingIndication(vunits, span(start)));
        }
        return bindings;
    }

    // ---- 名字 ----

    /**
     * 只允许 '.' 选择的名字，用于库、实体、组件、vunit 名
     */
    private Name parseSelectedName() {
        int start = position;
        Name name = parseSimpleName();
        while (match(TokenKind.DOT)) {
            Token suffix = consumeSuffix();
            name = new SelectedName(name, suffix.text(), span(start));
        }
        return name;
    }

    private Name parseName() {
        int start = position;
        Name name = parseSimpleName();
        while (true) {
            if (match(TokenKind.DOT)) {
                Token suffix = consumeSuffix();
                name = new SelectedName(name, suffix.text(), span(start));
            } else if (check(TokenKind.TICK) && peekAt(1).kind() == TokenKind.IDENTIFIER) {
                advance();
                Ident attribute = ident("attribute name");
                Expression argument = null;
                if (match(TokenKind.LEFT_PAR)) {
                    argument = parseExpression();
                    consume(TokenKind.RIGHT_PAR, "')' after attribute argument");
                }
                name = new AttributeName(name, attribute, argument, span(start));
            } else if (match(TokenKind.LEFT_PAR)) {
                name = parseCallOrSlice(name, start);
            } else {
                return name;
            }
        }
    }

    private Name parseCallOrSlice(Name prefix, int start) {
        int argumentStart = position;
        Expression first = parseActual();
        if (match(TokenKind.TO, TokenKind.DOWNTO)) {
            Expression right = parseExpression();
            Range range = new Range(first, right, span(argumentStart));
            consume(TokenKind.RIGHT_PAR, "')' after range");
            return new SliceName(prefix, range, span(start));
        }
        List<AssociationElement> arguments = new ArrayList<>();
        arguments.add(finishAssociationElement(argumentStart, first));
        while (match(TokenKind.COMMA)) {
            arguments.add(parseAssociationElement());
        }
        consume(TokenKind.RIGHT_PAR, "')' after argument list");
        return new CallName(prefix, arguments, span(start));
    }

    private Name parseSimpleName() {
        if (match(TokenKind.IDENTIFIER, TokenKind.STRING_LITERAL, TokenKind.CHARACTER_LITERAL)) {
            return new SimpleName(previous().text(), TokenSpan.single(position - 1));
        }
        throw new ParseException(peek(), "a name");
    }

    private Token consumeSuffix() {
        if (match(TokenKind.IDENTIFIER, TokenKind.ALL, TokenKind.CHARACTER_LITERAL, TokenKind.STRING_LITERAL)) {
            return previous();
        }
        throw new ParseException(peek(), "a suffix after '.'");
    }

    private AssociationElement parseAssociationElement() {
        int start = position;
        return finishAssociationElement(start, parseActual());
    }

    private AssociationElement finishAssociationElement(int start, Expression first) {
        if (match(TokenKind.RIGHT_ARROW)) {
            if (!(first instanceof Name)) {
                throw new ParseException(previous(), "a formal name before '=>'");
            }
            Expression actual = parseActual();
            return new AssociationElement((Name) first, actual, span(start));
        }
        return new AssociationElement(null, first, span(start));
    }

    private Expression parseActual() {
        if (match(TokenKind.OPEN)) {
            return new Literal(previous().text(), TokenSpan.single(position - 1));
        }
        return parseExpression();
    }

    // ---- 表达式 (按 VHDL 运算符优先级) ----

    private Expression parseExpression() {
        int start = position;
        Expression left = parseRelation();
        while (LOGICAL_OPERATORS.contains(peek().kind())) {
            advance();
            Expression right = parseRelation();
            left = new BinaryExpression(left, right, span(start));
        }
        return left;
    }

    private Expression parseRelation() {
        int start = position;
        Expression left = parseShiftExpression();
        if (RELATIONAL_OPERATORS.contains(peek().kind())) {
            advance();
            Expression right = parseShiftExpression();
            left = new BinaryExpression(left, right, span(start));
        }
        return left;
    }

    private Expression parseShiftExpression() {
        int start = position;
        Expression left = parseSimpleExpression();
        if (SHIFT_OPERATORS.contains(peek().kind())) {
            advance();
            Expression right = parseSimpleExpression();
            left = new BinaryExpression(left, right, span(start));
        }
        return left;
    }

    private Expression parseSimpleExpression() {
        int start = position;
        Expression left;
        if (match(TokenKind.PLUS, TokenKind.MINUS)) {
            left = new UnaryExpression(parseTerm(), span(start));
        } else {
            left = parseTerm();
        }
        while (ADDING_OPERATORS.contains(peek().kind())) {
            advance();
            Expression right = parseTerm();
            left = new BinaryExpression(left, right, span(start));
        }
        return left;
    }

    private Expression parseTerm() {
        int start = position;
        Expression left = parseFactor();
        while (MULTIPLYING_OPERATORS.contains(peek().kind())) {
            advance();
            Expression right = parseFactor();
            left = new BinaryExpression(left, right, span(start));
        }
        return left;
    }

    private Expression parseFactor() {
        int start = position;
        if (match(TokenKind.ABS, TokenKind.NOT)) {
            return new UnaryExpression(parsePrimary(), span(start));
        }
        Expression left = parsePrimary();
        if (match(TokenKind.POW)) {
            Expression right = parsePrimary();
            return new BinaryExpression(left, right, span(start));
        }
        return left;
    }

    private Expression parsePrimary() {
        int start = position;
        if (LITERALS.contains(peek().kind())) {
            advance();
            // 物理量字面量，例如 10 ns
            if (previous().kind() == TokenKind.ABSTRACT_LITERAL && check(TokenKind.IDENTIFIER)) {
                advance();
            }
            return new Literal(textOf(span(start)), span(start));
        }
        if (check(TokenKind.LEFT_PAR)) {
            return parseAggregate();
        }
        if (check(TokenKind.IDENTIFIER)) {
            return parseName();
        }
        throw new ParseException(peek(), "an expression (a literal, a name or an aggregate)");
    }

    private Aggregate parseAggregate() {
        int start = position;
        consume(TokenKind.LEFT_PAR, "'('");
        List<ElementAssociation> elements = new ArrayList<>();
        do {
            elements.add(parseElementAssociation());
        } while (match(TokenKind.COMMA));
        consume(TokenKind.RIGHT_PAR, "')' after aggregate");
        return new Aggregate(elements, span(start));
    }

    private ElementAssociation parseElementAssociation() {
        int start = position;
        Expression first = parseChoice();
        if (check(TokenKind.BAR) || check(TokenKind.RIGHT_ARROW)) {
            List<Expression> choices = new ArrayList<>();
            choices.add(first);
            while (match(TokenKind.BAR)) {
                choices.add(parseChoice());
            }
            consume(TokenKind.RIGHT_ARROW, "'=>' after choices");
            Expression value = parseExpression();
            return new ElementAssociation(choices, value, span(start));
        }
        if (tokens.get(first.span().startToken()).kind() == TokenKind.OTHERS) {
            throw new ParseException(peek(), "'=>' after 'others'");
        }
        return new ElementAssociation(List.of(), first, span(start));
    }

    private Expression parseChoice() {
        if (match(TokenKind.OTHERS)) {
            return new Literal(previous().text(), TokenSpan.single(position - 1));
        }
        return parseExpression();
    }

    // ---- 辅助方法 ----

    private void checkDepth(int depth) {
        if (depth > maxNestingDepth) {
            throw new ParseException(peek(), "at most " + maxNestingDepth + " nested configuration levels");
        }
    }

    private Ident ident(String what) {
        Token token = consume(TokenKind.IDENTIFIER, what);
        return new Ident(token.text(), position - 1);
    }

    private TokenSpan span(int start) {
        return new TokenSpan(start, position - 1);
    }

    private String textOf(TokenSpan span) {
        StringBuilder sb = new StringBuilder();
        for (int i = span.startToken(); i <= span.endToken(); i++) {
            if (i > span.startToken()) {
                sb.append(' ');
            }
            sb.append(tokens.get(i).text());
        }
        return sb.toString();
    }

    private boolean match(TokenKind... kinds) {
        for (TokenKind kind : kinds) {
            if (check(kind)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenKind kind, String message) {
        if (check(kind)) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenKind kind) {
        if (isAtEnd()) return false;
        return peek().kind() == kind;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().kind() == TokenKind.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
