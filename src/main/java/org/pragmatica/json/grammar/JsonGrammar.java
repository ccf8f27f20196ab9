package org.pragmatica.json.grammar;

import org.pragmatica.json.parser.Cursor;
import org.pragmatica.json.parser.Expectation;
import org.pragmatica.json.parser.ParseResult;
import org.pragmatica.json.parser.ParseResult.Failure;
import org.pragmatica.json.parser.ParseResult.Success;
import org.pragmatica.json.parser.Parser;
import org.pragmatica.json.parser.Parsers;
import org.pragmatica.json.tree.JsonValue;
import org.pragmatica.json.tree.JsonValue.JsonArray;
import org.pragmatica.json.tree.JsonValue.JsonBool;
import org.pragmatica.json.tree.JsonValue.JsonNull;
import org.pragmatica.json.tree.JsonValue.JsonNumber;
import org.pragmatica.json.tree.JsonValue.JsonObject;
import org.pragmatica.json.tree.JsonValue.JsonString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.pragmatica.json.parser.Parsers.character;
import static org.pragmatica.json.parser.Parsers.charMatching;
import static org.pragmatica.json.parser.Parsers.digit;
import static org.pragmatica.json.parser.Parsers.hexDigit;
import static org.pragmatica.json.parser.Parsers.literal;

/**
 * JSON productions expressed as parser combinators.
 *
 * <pre>
 * value   <- ws (object / array / string / number / bool / null) ws
 * object  <- '{' ws (member (ws ',' ws member)*)? ws '}'
 * member  <- string ws ':' ws value
 * array   <- '[' ws (value (ws ',' ws value)*)? ws ']'
 * string  <- '"' char* '"'
 * number  <- '-'? int ('.' digit+)? ([eE] [+-]? digit+)?
 * </pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class JsonGrammar {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonGrammar.class);

    private static final String SIMPLE_ESCAPES = "\"\\/bfnrt";
    private static final String TOO_DEEP = "less deeply nested value";
    private static final JsonGrammar STANDARD = new JsonGrammar(ParserConfig.DEFAULT);

    private final ParserConfig config;
    private final Parser<String> whitespace;
    private final Parser<JsonValue> nul;
    private final Parser<JsonValue> bool;
    private final Parser<JsonValue> number;
    private final Parser<String> quotedString;
    private final Parser<JsonValue> string;
    private final Parser<JsonValue> scalar;
    private final Parser<JsonValue> array;
    private final Parser<JsonValue> object;
    private final Parser<JsonValue> value;

    private JsonGrammar(ParserConfig config) {
        this.config = config;
        this.whitespace = Parsers.whitespace();
        this.nul = literal("null").map(ignored -> JsonNull.INSTANCE);
        this.bool = literal("true").or(literal("false"))
                                   .map(text -> JsonBool.of(text.equals("true")));
        this.number = numberProduction(config.strictNumbers());
        this.quotedString = stringProduction();
        this.string = quotedString.map(JsonString::new);
        this.scalar = Parser.choice(string, number, bool, nul);
        this.value = this::parseValue;
        this.array = this::parseArray;
        this.object = this::parseObject;
    }

    /**
     * Grammar with {@link ParserConfig#DEFAULT} settings.
     */
    public static JsonGrammar standard() {
        return STANDARD;
    }

    public static JsonGrammar create(ParserConfig config) {
        if (config.equals(ParserConfig.DEFAULT)) {
            return STANDARD;
        }
        LOGGER.debug("Building JSON grammar with {}", config);
        return new JsonGrammar(config);
    }

    public ParserConfig config() {
        return config;
    }

    // === Productions ===

    /**
     * Any JSON value with surrounding whitespace.
     */
    public Parser<JsonValue> value() {
        return value;
    }

    public Parser<JsonValue> object() {
        return object;
    }

    public Parser<JsonValue> array() {
        return array;
    }

    public Parser<JsonValue> string() {
        return string;
    }

    public Parser<JsonValue> number() {
        return number;
    }

    public Parser<JsonValue> bool() {
        return bool;
    }

    public Parser<JsonValue> nul() {
        return nul;
    }

    // === Values and Containers ===

    // Arrays and objects recurse through these methods directly, two or three frames per nesting level
    private ParseResult<JsonValue> parseValue(Cursor input) {
        var start = skipWhitespace(input);
        var next = start.peek()
                        .orElse(-1);
        ParseResult<JsonValue> result;
        try {
            result = next == '['
                     ? parseArray(start)
                     : next == '{'
                       ? parseObject(start)
                       : parseScalar(start);
        } catch (StackOverflowError e) {
            result = Failure.consumed(Expectation.at(start.offset(), TOO_DEEP));
        }
        if (result instanceof Failure<JsonValue> failure) {
            return new Failure<>(failure.expected(), failure.consumed() || start.offset() > input.offset());
        }
        var success = (Success<JsonValue>) result;
        var end = skipWhitespace(success.remaining());
        var hint = silent(start).merge(success.hint())
                                .merge(silent(end));
        return new Success<>(success.value(), end, hint);
    }

    private ParseResult<JsonValue> parseScalar(Cursor start) {
        var result = scalar.parse(start);
        if (result instanceof Failure<JsonValue> failure && !failure.consumed()) {
            var containers = Expectation.at(start.offset(), "object")
                                        .merge(Expectation.at(start.offset(), "array"));
            return Failure.empty(containers.merge(failure.expected()));
        }
        return result;
    }

    private ParseResult<JsonValue> parseArray(Cursor input) {
        var opened = input.skip("[");
        if (opened.isEmpty()) {
            return Failure.at(input, "array");
        }
        if (opened.get().depth() >= config.maxDepth()) {
            return depthExceeded(opened.get());
        }
        var cursor = skipWhitespace(opened.get().enter());
        var hint = silent(cursor);
        var elements = new ArrayList<JsonValue>();
        var next = parseValue(cursor);
        if (next instanceof Failure<JsonValue> none) {
            if (none.consumed()) {
                return none;
            }
            return close(cursor, ']', hint.merge(none.expected()), new JsonArray(elements));
        }
        while (next instanceof Success<JsonValue> element) {
            elements.add(element.value());
            hint = hint.merge(element.hint());
            cursor = element.remaining();
            var separated = cursor.skip(",");
            if (separated.isEmpty()) {
                break;
            }
            cursor = skipWhitespace(separated.get());
            next = parseValue(cursor);
            if (next instanceof Failure<JsonValue> broken) {
                return Failure.consumed(hint.merge(broken.expected()));
            }
        }
        hint = hint.merge(Expectation.at(cursor.offset(), "','"));
        return close(cursor, ']', hint, new JsonArray(elements));
    }

    private ParseResult<JsonValue> parseObject(Cursor input) {
        var opened = input.skip("{");
        if (opened.isEmpty()) {
            return Failure.at(input, "object");
        }
        if (opened.get().depth() >= config.maxDepth()) {
            return depthExceeded(opened.get());
        }
        var cursor = skipWhitespace(opened.get().enter());
        var hint = silent(cursor);
        var members = new ArrayList<Map.Entry<String, JsonValue>>();
        var next = parseMember(cursor);
        if (next instanceof Failure<Map.Entry<String, JsonValue>> none) {
            if (none.consumed()) {
                return none.cast();
            }
            return close(cursor, '}', hint.merge(none.expected()), JsonObject.fromMembers(members));
        }
        while (next instanceof Success<Map.Entry<String, JsonValue>> member) {
            members.add(member.value());
            hint = hint.merge(member.hint());
            cursor = member.remaining();
            var separated = cursor.skip(",");
            if (separated.isEmpty()) {
                break;
            }
            cursor = skipWhitespace(separated.get());
            next = parseMember(cursor);
            if (next instanceof Failure<Map.Entry<String, JsonValue>> broken) {
                return Failure.consumed(hint.merge(broken.expected()));
            }
        }
        hint = hint.merge(Expectation.at(cursor.offset(), "','"));
        return close(cursor, '}', hint, JsonObject.fromMembers(members));
    }

    // Key, colon and value; the cursor after a member is past its trailing whitespace
    private ParseResult<Map.Entry<String, JsonValue>> parseMember(Cursor input) {
        var key = quotedString.parse(input);
        if (key instanceof Failure<String> failure) {
            return failure.cast();
        }
        var named = (Success<String>) key;
        var cursor = skipWhitespace(named.remaining());
        var hint = named.hint()
                        .merge(silent(cursor));
        var colon = cursor.skip(":");
        if (colon.isEmpty()) {
            return Failure.consumed(hint.merge(Expectation.at(cursor.offset(), "':'")));
        }
        cursor = skipWhitespace(colon.get());
        hint = hint.merge(silent(cursor));
        var result = parseValue(cursor);
        if (result instanceof Failure<JsonValue> failure) {
            return Failure.consumed(hint.merge(failure.expected()));
        }
        var success = (Success<JsonValue>) result;
        return new Success<>(Map.entry(named.value(), success.value()), success.remaining(), hint.merge(success.hint()));
    }

    private static ParseResult<JsonValue> close(Cursor cursor, char close, Expectation hint, JsonValue container) {
        var closed = cursor.leave()
                           .skip(String.valueOf(close));
        if (closed.isEmpty()) {
            return Failure.consumed(hint.merge(Expectation.at(cursor.offset(), "'" + close + "'")));
        }
        return new Success<>(container, closed.get(), hint);
    }

    private ParseResult<JsonValue> depthExceeded(Cursor cursor) {
        return Failure.consumed(Expectation.at(cursor.offset(), "nesting depth of at most " + config.maxDepth()));
    }

    private Cursor skipWhitespace(Cursor input) {
        return whitespace.parse(input) instanceof Success<String> success
               ? success.remaining()
               : input;
    }

    private static Expectation silent(Cursor cursor) {
        return Expectation.at(cursor.offset(), "");
    }

    // === Building Blocks ===

    private static Parser<JsonValue> numberProduction(boolean strict) {
        var integer = strict
                      ? strictInteger()
                      : digit().many1()
                               .matched();
        var fraction = character('.').then(digit().many1());
        var exponent = charMatching(c -> c == 'e' || c == 'E', "exponent")
                           .then(charMatching(c -> c == '+' || c == '-', "sign").optional())
                           .then(digit().many1());

        return character('-').optional()
                             .then(integer)
                             .followedBy(fraction.optional())
                             .followedBy(exponent.optional())
                             .matched()
                             .<JsonValue>map(text -> new JsonNumber(Double.parseDouble(text)))
                             .label("number");
    }

    // Either a single zero or digits without a leading zero
    private static Parser<String> strictInteger() {
        var zero = character('0').matched();
        var nonZero = charMatching(c -> c >= '1' && c <= '9', "digit").then(digit().many())
                                                                      .matched();
        return zero.or(nonZero)
                   .label("digit");
    }

    private static Parser<String> stringProduction() {
        var unescaped = charMatching(c -> c != '"' && c != '\\' && c >= 0x20, "");
        var simpleEscape = charMatching(c -> c < 0x80 && SIMPLE_ESCAPES.indexOf(c) >= 0, "")
                               .map(JsonGrammar::unescape);
        var unicodeEscape = character('u').then(hexDigit().times(4)
                                                          .matched())
                                          .map(hex -> Integer.parseInt(hex, 16));
        var escape = character('\\').then(Parser.choice(simpleEscape, unicodeEscape)
                                                .label("escape character"));

        return unescaped.or(escape)
                        .label("")
                        .many()
                        .map(JsonGrammar::toText)
                        .between(character('"'), character('"'))
                        .label("string");
    }

    private static int unescape(int escaped) {
        return switch (escaped) {
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> escaped;
        };
    }

    private static String toText(List<Integer> codePoints) {
        var sb = new StringBuilder(codePoints.size());
        for (var codePoint : codePoints) {
            sb.appendCodePoint(codePoint);
        }
        return sb.toString();
    }
}
