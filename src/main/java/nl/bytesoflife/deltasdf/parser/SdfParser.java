package nl.bytesoflife.deltasdf.parser;

import nl.bytesoflife.deltasdf.SyntaxException;
import nl.bytesoflife.deltasdf.lexer.Keyword;
import nl.bytesoflife.deltasdf.lexer.SdfLexer;
import nl.bytesoflife.deltasdf.lexer.Token;
import nl.bytesoflife.deltasdf.lexer.TokenType;
import nl.bytesoflife.deltasdf.model.DelayMode;
import nl.bytesoflife.deltasdf.model.Edge;
import nl.bytesoflife.deltasdf.model.EntryKind;
import nl.bytesoflife.deltasdf.model.HeaderItem;
import nl.bytesoflife.deltasdf.model.Timescale;
import nl.bytesoflife.deltasdf.model.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for SDF files.
 *
 * <p>Each instance parses one input. The parser never recovers: the first grammar
 * violation aborts the call with a {@link SyntaxException} that points at the
 * offending token.
 */
public class SdfParser {

    private static final Logger log = LoggerFactory.getLogger(SdfParser.class);

    // Delay value counts allowed in a path delay: plain, rise/fall, rise/fall/z, and the 6 and 12 transition forms
    private static final Set<Integer> DELAY_VALUE_COUNTS = Set.of(1, 2, 3, 6, 12);
    private static final Set<Integer> RETAIN_VALUE_COUNTS = Set.of(1, 2, 3);

    private final TokenCursor cursor;

    public SdfParser(String content) {
        this.cursor = new TokenCursor(new SdfLexer().stream(content));
    }

    public SdfNode.DelayFile parse() {
        return (SdfNode.DelayFile) parse(StartRule.DELAYFILE);
    }

    /**
     * Parses the whole input as the given rule. Input left over after the rule is an error.
     */
    public SdfNode parse(StartRule rule) {
        SdfNode node = switch (rule) {
            case DELAYFILE -> parseDelayFile();
            case CELL -> parseCell();
            case DEL_DEF -> parseDelDef();
            case TC_DEF -> parseCheck();
            case TE_DEF -> parsePathConstraint();
            case RVALUE -> new SdfNode.Value(parseRvalue());
        };
        cursor.expect(TokenType.EOF, "end of input");
        return node;
    }

    private SdfNode.DelayFile parseDelayFile() {
        cursor.open(Keyword.DELAYFILE);

        List<SdfNode.HeaderEntry> header = new ArrayList<>();
        while (cursor.at(TokenType.LPAR) && headerItem(cursor.peek(1)) != null) {
            header.add(parseHeaderEntry());
        }

        List<SdfNode.Cell> cells = new ArrayList<>();
        while (cursor.atOpen(Keyword.CELL)) {
            cells.add(parseCell());
        }

        if (cursor.at(TokenType.LPAR)) {
            throw new SyntaxException("Expected header item or CELL", cursor.peek(1));
        }
        cursor.close();

        log.debug("Parsed DELAYFILE with {} header items and {} cells", header.size(), cells.size());
        return new SdfNode.DelayFile(header, cells);
    }

    private SdfNode.HeaderEntry parseHeaderEntry() {
        cursor.expect(TokenType.LPAR, "'('");
        Token keyword = cursor.next();
        HeaderItem item = headerItem(keyword);
        SdfNode.HeaderEntry entry;

        if (item.isQuoted()) {
            String text = cursor.expect(TokenType.QSTRING, "quoted string").text();
            entry = new SdfNode.HeaderEntry(item, text, null, null, keyword);
        } else {
            entry = switch (item) {
                case DIVIDER -> {
                    Token divider = cursor.peek();
                    if (!divider.is(TokenType.IDENTIFIER)
                            || !(divider.text().equals(".") || divider.text().equals("/"))) {
                        throw new SyntaxException("Expected hierarchy divider '.' or '/'", divider);
                    }
                    cursor.next();
                    yield new SdfNode.HeaderEntry(item, divider.text(), null, null, keyword);
                }
                case VOLTAGE, TEMPERATURE -> {
                    Triple triple;
                    if (cursor.at(TokenType.LPAR)) {
                        cursor.next();
                        triple = parseTripleBody(false);
                        cursor.close();
                    } else {
                        triple = parseTripleBody(false);
                    }
                    yield new SdfNode.HeaderEntry(item, null, triple, null, keyword);
                }
                case TIMESCALE -> new SdfNode.HeaderEntry(item, null, null, parseTimescale(), keyword);
                default -> throw new SyntaxException("Unsupported header item", keyword);
            };
        }

        cursor.close();
        return entry;
    }

    private Timescale parseTimescale() {
        Token first = cursor.peek();
        String text;
        if (first.is(TokenType.NUMBER)) {
            cursor.next();
            Token unit = cursor.expect(TokenType.IDENTIFIER, "timescale unit");
            text = first.text() + unit.text();
        } else if (first.is(TokenType.IDENTIFIER)) {
            text = cursor.next().text();
        } else {
            throw new SyntaxException("Expected timescale value", first);
        }
        try {
            return Timescale.parse(text);
        } catch (IllegalArgumentException e) {
            throw new SyntaxException(e.getMessage(), first);
        }
    }

    private SdfNode.Cell parseCell() {
        Token start = cursor.peek();
        cursor.open(Keyword.CELL);

        cursor.open(Keyword.CELLTYPE);
        String cellType = cursor.expect(TokenType.QSTRING, "quoted cell type").text();
        cursor.close();

        cursor.open(Keyword.INSTANCE);
        String instance = "";
        if (!cursor.at(TokenType.RPAR)) {
            instance = parsePath();
        }
        cursor.close();

        List<SdfNode.TimingSpec> specs = new ArrayList<>();
        while (cursor.at(TokenType.LPAR)) {
            Token keyword = cursor.peek(1);
            if (keyword.is(Keyword.DELAY)) {
                specs.add(parseDelay());
            } else if (keyword.is(Keyword.TIMINGCHECK)) {
                specs.add(parseTimingCheck());
            } else if (keyword.is(Keyword.TIMINGENV)) {
                specs.add(parseTimingEnv());
            } else {
                throw new SyntaxException("Expected DELAY, TIMINGCHECK or TIMINGENV", keyword);
            }
        }
        cursor.close();
        return new SdfNode.Cell(cellType, instance, specs, start);
    }

    private SdfNode.Delay parseDelay() {
        cursor.open(Keyword.DELAY);
        List<SdfNode.DelayBlock> blocks = new ArrayList<>();
        do {
            cursor.expect(TokenType.LPAR, "'('");
            Token keyword = cursor.next();
            DelayMode mode;
            if (keyword.is(Keyword.ABSOLUTE)) {
                mode = DelayMode.ABSOLUTE;
            } else if (keyword.is(Keyword.INCREMENT)) {
                mode = DelayMode.INCREMENT;
            } else {
                throw new SyntaxException("Expected ABSOLUTE or INCREMENT", keyword);
            }
            List<SdfNode.PathDelay> entries = new ArrayList<>();
            while (cursor.at(TokenType.LPAR)) {
                entries.add(parseDelDef());
            }
            cursor.close();
            blocks.add(new SdfNode.DelayBlock(mode, entries));
        } while (cursor.at(TokenType.LPAR));
        cursor.close();
        return new SdfNode.Delay(blocks);
    }

    private SdfNode.PathDelay parseDelDef() {
        cursor.expect(TokenType.LPAR, "'('");
        Token keyword = cursor.next();
        if (keyword.is(Keyword.COND)) {
            String cond = new ConditionParser(cursor).parse();
            cursor.expect(TokenType.LPAR, "'('");
            Token inner = cursor.next();
            if (!inner.is(Keyword.IOPATH)) {
                throw new SyntaxException("COND is only allowed around IOPATH", inner);
            }
            SdfNode.PathDelay iopath = parseIopathBody(inner, cond);
            cursor.close();
            return iopath;
        }
        if (keyword.type() != TokenType.KEYWORD) {
            throw new SyntaxException("Expected IOPATH, INTERCONNECT, PORT, DEVICE or COND", keyword);
        }

        return switch (keyword.keyword()) {
            case IOPATH -> parseIopathBody(keyword, null);
            case INTERCONNECT -> {
                SdfNode.PortSpec from = new SdfNode.PortSpec(parsePath(), null);
                SdfNode.PortSpec to = new SdfNode.PortSpec(parsePath(), null);
                List<Triple> values = parseRvalues(keyword, DELAY_VALUE_COUNTS);
                cursor.close();
                yield new SdfNode.PathDelay(EntryKind.INTERCONNECT, from, to, null, List.of(), values, keyword);
            }
            case PORT -> {
                SdfNode.PortSpec port = new SdfNode.PortSpec(parsePath(), null);
                List<Triple> values = parseRvalues(keyword, DELAY_VALUE_COUNTS);
                cursor.close();
                yield new SdfNode.PathDelay(EntryKind.PORT, port, null, null, List.of(), values, keyword);
            }
            case DEVICE -> {
                SdfNode.PortSpec port = null;
                if (!cursor.at(TokenType.LPAR)) {
                    port = new SdfNode.PortSpec(parsePath(), null);
                }
                List<Triple> values = parseRvalues(keyword, DELAY_VALUE_COUNTS);
                cursor.close();
                yield new SdfNode.PathDelay(EntryKind.DEVICE, port, null, null, List.of(), values, keyword);
            }
            default -> throw new SyntaxException("Expected IOPATH, INTERCONNECT, PORT, DEVICE or COND", keyword);
        };
    }

    /**
     * Everything after the IOPATH keyword, including the closing parenthesis.
     */
    private SdfNode.PathDelay parseIopathBody(Token keyword, String cond) {
        SdfNode.PortSpec from = parsePortSpec();
        SdfNode.PortSpec to = parsePortSpec();
        List<Triple> retain = List.of();
        if (cursor.atOpen(Keyword.RETAIN)) {
            Token retainToken = cursor.peek(1);
            cursor.open(Keyword.RETAIN);
            retain = parseRvalues(retainToken, RETAIN_VALUE_COUNTS);
            cursor.close();
        }
        List<Triple> values = parseRvalues(keyword, DELAY_VALUE_COUNTS);
        cursor.close();
        return new SdfNode.PathDelay(EntryKind.IOPATH, from, to, cond, retain, values, keyword);
    }

    private SdfNode.TimingCheck parseTimingCheck() {
        cursor.open(Keyword.TIMINGCHECK);
        List<SdfNode.Check> checks = new ArrayList<>();
        do {
            checks.add(parseCheck());
        } while (cursor.at(TokenType.LPAR));
        cursor.close();
        return new SdfNode.TimingCheck(checks);
    }

    private SdfNode.Check parseCheck() {
        cursor.expect(TokenType.LPAR, "'('");
        Token keyword = cursor.next();
        EntryKind kind = checkKind(keyword);
        if (kind == null) {
            throw new SyntaxException("Expected timing check", keyword);
        }

        int portCount = kind.isSinglePortCheck() ? 1 : 2;
        List<SdfNode.CheckPort> ports = new ArrayList<>();
        for (int i = 0; i < portCount; i++) {
            ports.add(parseCheckPort());
        }

        Set<Integer> counts = switch (kind) {
            case SETUPHOLD -> Set.of(2);
            case NOCHANGE -> Set.of(1, 2);
            default -> Set.of(1);
        };
        List<Triple> values = parseRvalues(keyword, counts);
        cursor.close();
        return new SdfNode.Check(kind, ports, values, keyword);
    }

    private SdfNode.CheckPort parseCheckPort() {
        if (cursor.atOpen(Keyword.COND)) {
            cursor.open(Keyword.COND);
            String cond = new ConditionParser(cursor).parse();
            SdfNode.PortSpec port = parsePortSpec();
            cursor.close();
            return new SdfNode.CheckPort(port, cond);
        }
        return new SdfNode.CheckPort(parsePortSpec(), null);
    }

    private SdfNode.TimingEnv parseTimingEnv() {
        cursor.open(Keyword.TIMINGENV);
        List<SdfNode.PathConstraint> constraints = new ArrayList<>();
        do {
            constraints.add(parsePathConstraint());
        } while (cursor.at(TokenType.LPAR));
        cursor.close();
        return new SdfNode.TimingEnv(constraints);
    }

    private SdfNode.PathConstraint parsePathConstraint() {
        cursor.expect(TokenType.LPAR, "'('");
        Token keyword = cursor.next();
        if (!keyword.is(Keyword.PATHCONSTRAINT)) {
            throw new SyntaxException("Expected PATHCONSTRAINT", keyword);
        }
        SdfNode.PortSpec output = parsePortSpec();
        SdfNode.PortSpec input = parsePortSpec();
        List<Triple> values = parseRvalues(keyword, Set.of(2));
        cursor.close();
        return new SdfNode.PathConstraint(output, input, values, keyword);
    }

    private SdfNode.PortSpec parsePortSpec() {
        if (!cursor.at(TokenType.LPAR)) {
            return new SdfNode.PortSpec(parsePath(), null);
        }
        cursor.next();
        Token edgeToken = cursor.next();
        Edge edge;
        if (edgeToken.is(Keyword.POSEDGE)) {
            edge = Edge.POSEDGE;
        } else if (edgeToken.is(Keyword.NEGEDGE)) {
            edge = Edge.NEGEDGE;
        } else {
            throw new SyntaxException("Expected posedge or negedge", edgeToken);
        }
        String path = parsePath();
        cursor.close();
        return new SdfNode.PortSpec(path, edge);
    }

    /**
     * A hierarchical path. Words that happen to be keywords are accepted as names.
     */
    private String parsePath() {
        Token token = cursor.peek();
        if (token.is(TokenType.IDENTIFIER) || token.is(TokenType.NUMBER)
                || (token.is(TokenType.KEYWORD) && !token.is(Keyword.POSEDGE) && !token.is(Keyword.NEGEDGE))) {
            return cursor.next().text();
        }
        throw new SyntaxException("Expected port path", token);
    }

    private List<Triple> parseRvalues(Token construct, Set<Integer> allowedCounts) {
        List<Triple> values = new ArrayList<>();
        while (cursor.at(TokenType.LPAR)) {
            values.add(parseRvalue());
        }
        if (!allowedCounts.contains(values.size())) {
            Token at = values.isEmpty() ? cursor.peek() : construct;
            throw new SyntaxException(construct.text() + " does not accept " + values.size()
                + " delay value(s)", at);
        }
        return values;
    }

    private Triple parseRvalue() {
        cursor.expect(TokenType.LPAR, "'(' opening a delay value");
        Triple triple = parseTripleBody(true);
        cursor.close();
        return triple;
    }

    /**
     * Reads {@code v}, {@code a:b:c} (any slot may be blank, not all of them) or nothing.
     * Stops before the closing parenthesis.
     */
    private Triple parseTripleBody(boolean allowEmpty) {
        Token start = cursor.peek();
        if (start.is(TokenType.RPAR)) {
            if (!allowEmpty) {
                throw new SyntaxException("Expected value", start);
            }
            return Triple.empty();
        }

        BigDecimal min = optionalNumber();
        if (!cursor.at(TokenType.COLON)) {
            if (min == null) {
                throw new SyntaxException("Expected number", start);
            }
            return Triple.of(min);
        }
        cursor.next();
        BigDecimal avg = optionalNumber();
        cursor.expect(TokenType.COLON, "':' in min:typ:max triple");
        BigDecimal max = optionalNumber();
        if (min == null && avg == null && max == null) {
            throw new SyntaxException("Triple needs at least one value", start);
        }
        return new Triple(min, avg, max);
    }

    private BigDecimal optionalNumber() {
        if (!cursor.at(TokenType.NUMBER)) {
            return null;
        }
        Token token = cursor.next();
        BigDecimal value = new BigDecimal(token.text());
        // 1e3 must read back the same after printing as 1000
        return value.scale() < 0 ? value.setScale(0) : value;
    }

    private static HeaderItem headerItem(Token token) {
        if (token.type() != TokenType.KEYWORD) {
            return null;
        }
        return switch (token.keyword()) {
            case SDFVERSION -> HeaderItem.SDFVERSION;
            case DESIGN -> HeaderItem.DESIGN;
            case DATE -> HeaderItem.DATE;
            case VENDOR -> HeaderItem.VENDOR;
            case PROGRAM -> HeaderItem.PROGRAM;
            case VERSION -> HeaderItem.VERSION;
            case DIVIDER -> HeaderItem.DIVIDER;
            case VOLTAGE -> HeaderItem.VOLTAGE;
            case PROCESS -> HeaderItem.PROCESS;
            case TEMPERATURE -> HeaderItem.TEMPERATURE;
            case TIMESCALE -> HeaderItem.TIMESCALE;
            default -> null;
        };
    }

    private static EntryKind checkKind(Token token) {
        if (token.type() != TokenType.KEYWORD) {
            return null;
        }
        return switch (token.keyword()) {
            case SETUPHOLD -> EntryKind.SETUPHOLD;
            case SETUP -> EntryKind.SETUP;
            case HOLD -> EntryKind.HOLD;
            case RECOVERY -> EntryKind.RECOVERY;
            case REMOVAL -> EntryKind.REMOVAL;
            case SKEW -> EntryKind.SKEW;
            case WIDTH -> EntryKind.WIDTH;
            case PERIOD -> EntryKind.PERIOD;
            case NOCHANGE -> EntryKind.NOCHANGE;
            default -> null;
        };
    }
}
