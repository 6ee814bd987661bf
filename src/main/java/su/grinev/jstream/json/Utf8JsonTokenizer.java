package su.grinev.jstream.json;

import su.grinev.jstream.exception.JsonSyntaxException;
import su.grinev.jstream.json.token.NumberScanner;
import su.grinev.jstream.json.token.StringParser;
import su.grinev.jstream.json.token.TokenType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import static su.grinev.jstream.json.token.TokenType.*;

/**
 * Forward-only UTF-8 JSON tokenizer over one block of a possibly larger input.
 * <p>
 * When the block is not final, a token that runs into the end of the block is not reported:
 * {@link #read()} returns false and leaves the tokenizer at the start of that token, so that
 * {@link #currentState()} and {@link #getBytesConsumed()} describe exactly where to resume.
 * A new instance seeded with that state and the remaining bytes (plus whatever arrived since)
 * continues as if it had never stopped.
 * <p>
 * Not thread-safe.
 */
public class Utf8JsonTokenizer {

    private static final byte[] TRUE_BYTES = "true".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FALSE_BYTES = "false".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_BYTES = "null".getBytes(StandardCharsets.US_ASCII);
    private static final int INCOMPLETE = -1;

    private final byte[] buf;
    private final int start;
    private final int end;
    private final boolean isFinalBlock;
    private final JsonReaderOptions options;
    private final CommentHandling commentHandling;
    private final int maxDepth;
    private final long baseOffset;
    private final StringParser stringParser;
    private final StringParser.Escapes escapes = new StringParser.Escapes();

    private int pos;
    private int depth;
    private long[] containers;
    private TokenType lastToken;
    private boolean commaPending;
    private long lineNumber;
    private long lineStart;

    private TokenType tokenType = NONE;
    private int tokenStart;
    private int valueStart;
    private int valueEnd;
    private boolean valueEscaped;

    public Utf8JsonTokenizer(byte[] json, JsonReaderOptions options) {
        this(json, 0, json.length, true, TokenizerState.initial(options));
    }

    public Utf8JsonTokenizer(byte[] buf, int offset, int length, boolean isFinalBlock, TokenizerState state) {
        Objects.checkFromIndexSize(offset, length, buf.length);
        this.buf = buf;
        this.start = offset;
        this.end = offset + length;
        this.isFinalBlock = isFinalBlock;
        this.options = state.getOptions();
        this.commentHandling = options.getCommentHandling();
        this.maxDepth = options.effectiveMaxDepth();
        this.baseOffset = state.getBytePosition();
        this.stringParser = new StringParser(buf);

        this.pos = offset;
        this.depth = state.getDepth();
        this.containers = state.copyContainers();
        this.lastToken = state.getLastToken();
        this.commaPending = state.isCommaPending();
        this.lineNumber = state.getLineNumber();
        this.lineStart = state.getBytePosition() - state.getBytePositionInLine();
    }

    /**
     * Advances to the next token.
     *
     * @return false when no further complete token is available in this block
     * @throws JsonSyntaxException if the bytes are not valid JSON under the configured options
     */
    public boolean read() {
        while (true) {
            if (lastToken == NONE && absolute(pos) == 0 && !skipByteOrderMark()) {
                return false;
            }
            skipWhitespace();
            if (pos >= end) {
                return endOfData();
            }

            byte b = buf[pos];
            if (b == '/') {
                if (commentHandling == CommentHandling.DISALLOW) {
                    throw syntaxError("Comments are not allowed", pos);
                }
                int commentEnd = scanComment(pos);
                if (commentEnd == INCOMPLETE) {
                    return incomplete("Unterminated comment", pos);
                }
                int commentStart = pos;
                countLines(pos, commentEnd);
                pos = commentEnd;
                if (commentHandling == CommentHandling.ALLOW) {
                    boolean block = buf[commentStart + 1] == '*';
                    setToken(COMMENT, commentStart, commentStart + 2, block ? commentEnd - 2 : commentEnd, false);
                    return true;
                }
                continue;
            }

            if (depth == 0) {
                if (lastToken != NONE) {
                    throw syntaxError(describe(b) + " is invalid after a single JSON value, expected end of data", pos);
                }
                return readValue(b);
            }

            boolean inObject = isObject(depth);
            if (lastToken == PROPERTY_NAME) {
                return readValue(b);
            }
            if (lastToken == START_ARRAY) {
                return b == ']' ? readEnd(END_ARRAY) : readValue(b);
            }
            if (lastToken == START_OBJECT) {
                return b == '}' ? readEnd(END_OBJECT) : readPropertyName(b);
            }

            // after a complete value inside a container
            if (commaPending) {
                if (b == (inObject ? '}' : ']')) {
                    if (!options.isAllowTrailingCommas()) {
                        throw syntaxError("Trailing comma is not allowed", pos);
                    }
                    return readEnd(inObject ? END_OBJECT : END_ARRAY);
                }
                return inObject ? readPropertyName(b) : readValue(b);
            }
            if (b == ',') {
                pos++;
                commaPending = true;
                continue;
            }
            if (inObject && b == '}') {
                return readEnd(END_OBJECT);
            }
            if (!inObject && b == ']') {
                return readEnd(END_ARRAY);
            }
            throw syntaxError("%s is invalid after a value, expected ',' or '%c'".formatted(describe(b), inObject ? '}' : ']'), pos);
        }
    }

    /**
     * When positioned on {@link TokenType#START_OBJECT} or {@link TokenType#START_ARRAY}, moves to the
     * matching end token. Any other token is already complete and is left as is.
     *
     * @return false, with the tokenizer restored to the start token, if the matching end is not in this block
     */
    public boolean trySkip() {
        if (tokenType != START_OBJECT && tokenType != START_ARRAY) {
            return true;
        }

        int savedPos = pos;
        int savedDepth = depth;
        TokenType savedLastToken = lastToken;
        boolean savedCommaPending = commaPending;
        long savedLineNumber = lineNumber;
        long savedLineStart = lineStart;
        TokenType savedTokenType = tokenType;
        int savedTokenStart = tokenStart;
        int savedValueStart = valueStart;
        int savedValueEnd = valueEnd;
        boolean savedValueEscaped = valueEscaped;

        int targetDepth = depth - 1;
        while (read()) {
            if (tokenType.isContainerEnd() && depth == targetDepth) {
                return true;
            }
        }

        pos = savedPos;
        depth = savedDepth;
        lastToken = savedLastToken;
        commaPending = savedCommaPending;
        lineNumber = savedLineNumber;
        lineStart = savedLineStart;
        tokenType = savedTokenType;
        tokenStart = savedTokenStart;
        valueStart = savedValueStart;
        valueEnd = savedValueEnd;
        valueEscaped = savedValueEscaped;
        return false;
    }

    /**
     * Skips the current value; on a property name, skips the value that follows it.
     * Only meaningful on a final block, where every value is complete.
     */
    public void skip() {
        if (tokenType == PROPERTY_NAME) {
            readRequired();
        }
        if (!trySkip()) {
            throw new IllegalStateException("Cannot skip a value that is not complete in this block");
        }
    }

    /**
     * Reads the next token that is not a comment, failing if the block ends first.
     */
    public TokenType readRequired() {
        do {
            if (!read()) {
                throw syntaxError("Unexpected end of data", pos);
            }
        } while (tokenType == COMMENT);
        return tokenType;
    }

    /**
     * Builds a syntax error located at the current token, for callers that reject a well-formed token.
     */
    public JsonSyntaxException errorAtToken(String message) {
        return syntaxError(message, tokenStart);
    }

    /**
     * Line of the current token, counting from 1.
     */
    public long getTokenLineNumber() {
        return lineNumber;
    }

    /**
     * Column of the current token in bytes, counting from 0.
     */
    public long getTokenBytePositionInLine() {
        return absolute(tokenStart) - lineStart;
    }

    public TokenizerState currentState() {
        long position = absolute(pos);
        return new TokenizerState(options, depth, Arrays.copyOf(containers, (depth >>> 6) + 1), lastToken,
                commaPending, position, lineNumber, position - lineStart);
    }

    public TokenType getTokenType() {
        return tokenType;
    }

    public int getDepth() {
        return depth;
    }

    public byte[] getBuffer() {
        return buf;
    }

    /**
     * Index in {@link #getBuffer()} of the first byte of the current token.
     */
    public int getTokenStartIndex() {
        return tokenStart;
    }

    /**
     * Index in {@link #getBuffer()} just past the last byte read.
     */
    public int getPosition() {
        return pos;
    }

    public int getBytesConsumed() {
        return pos - start;
    }

    /**
     * Absolute offset of the current token in the whole input.
     */
    public long getTokenOffset() {
        return absolute(tokenStart);
    }

    public JsonReaderOptions getOptions() {
        return options;
    }

    public boolean isFinalBlock() {
        return isFinalBlock;
    }

    public String getString() {
        if (tokenType != STRING && tokenType != PROPERTY_NAME && tokenType != COMMENT) {
            throw new IllegalStateException("Cannot get a string from token " + tokenType);
        }
        try {
            return stringParser.decode(valueStart, valueEnd, valueEscaped);
        } catch (StringParser.MalformedStringException e) {
            throw syntaxError(e.getMessage(), e.getIndex());
        }
    }

    public String getNumberText() {
        requireNumber();
        return new String(buf, valueStart, valueEnd - valueStart, StandardCharsets.US_ASCII);
    }

    /**
     * True when the current number has neither a fraction nor an exponent.
     */
    public boolean isIntegralNumber() {
        requireNumber();
        for (int i = valueStart; i < valueEnd; i++) {
            byte b = buf[i];
            if (b == '.' || b == 'e' || b == 'E') {
                return false;
            }
        }
        return true;
    }

    public int getInt() {
        return Integer.parseInt(getNumberText());
    }

    public long getLong() {
        return Long.parseLong(getNumberText());
    }

    public double getDouble() {
        return Double.parseDouble(getNumberText());
    }

    public BigDecimal getBigDecimal() {
        return new BigDecimal(getNumberText());
    }

    public BigInteger getBigInteger() {
        return NumberScanner.toBigIntegerExact(getBigDecimal());
    }

    public boolean getBoolean() {
        if (tokenType == TRUE) {
            return true;
        }
        if (tokenType == FALSE) {
            return false;
        }
        throw new IllegalStateException("Cannot get a boolean from token " + tokenType);
    }

    private void requireNumber() {
        if (tokenType != NUMBER) {
            throw new IllegalStateException("Cannot get a number from token " + tokenType);
        }
    }

    private boolean readValue(byte b) {
        switch (b) {
            case '{' -> {
                push(true);
                setToken(START_OBJECT, pos, pos, pos + 1, false);
                pos++;
                lastToken = START_OBJECT;
                commaPending = false;
                return true;
            }
            case '[' -> {
                push(false);
                setToken(START_ARRAY, pos, pos, pos + 1, false);
                pos++;
                lastToken = START_ARRAY;
                commaPending = false;
                return true;
            }
            case '"' -> {
                return readString();
            }
            case 't' -> {
                return readLiteral(TRUE_BYTES, TRUE);
            }
            case 'f' -> {
                return readLiteral(FALSE_BYTES, FALSE);
            }
            case 'n' -> {
                return readLiteral(NULL_BYTES, NULL);
            }
            default -> {
                if (b == '-' || (b >= '0' && b <= '9')) {
                    return readNumber();
                }
                throw syntaxError(describe(b) + " is an invalid start of a value", pos);
            }
        }
    }

    private boolean readString() {
        int stringEnd = scanString(pos);
        if (stringEnd == INCOMPLETE) {
            return incomplete("Unterminated string", pos);
        }
        setToken(STRING, pos, pos + 1, stringEnd - 1, escapes.found());
        pos = stringEnd;
        lastToken = STRING;
        commaPending = false;
        return true;
    }

    private boolean readPropertyName(byte b) {
        if (b != '"') {
            throw syntaxError("Expected property name but found " + describe(b), pos);
        }
        int nameStart = pos;
        int nameEnd = scanString(pos);
        if (nameEnd == INCOMPLETE) {
            return incomplete("Unterminated property name", pos);
        }
        boolean nameEscaped = escapes.found();

        long savedLineNumber = lineNumber;
        long savedLineStart = lineStart;
        int p = nameEnd;
        while (true) {
            p = skipWhitespaceFrom(p);
            if (p >= end) {
                lineNumber = savedLineNumber;
                lineStart = savedLineStart;
                return incomplete("Expected ':' after property name", p);
            }
            if (buf[p] == '/' && commentHandling != CommentHandling.DISALLOW) {
                int commentEnd = scanComment(p);
                if (commentEnd == INCOMPLETE) {
                    lineNumber = savedLineNumber;
                    lineStart = savedLineStart;
                    return incomplete("Unterminated comment", p);
                }
                countLines(p, commentEnd);
                p = commentEnd;
                continue;
            }
            if (buf[p] != ':') {
                throw syntaxError("Expected ':' after property name but found " + describe(buf[p]), p);
            }
            break;
        }

        setToken(PROPERTY_NAME, nameStart, nameStart + 1, nameEnd - 1, nameEscaped);
        pos = p + 1;
        lastToken = PROPERTY_NAME;
        commaPending = false;
        return true;
    }

    private boolean readNumber() {
        int numberEnd;
        try {
            numberEnd = NumberScanner.scan(buf, pos, end, isFinalBlock);
        } catch (NumberScanner.MalformedNumberException e) {
            throw syntaxError(e.getMessage(), e.getIndex());
        }
        if (numberEnd == NumberScanner.INCOMPLETE) {
            return false;
        }
        setToken(NUMBER, pos, pos, numberEnd, false);
        pos = numberEnd;
        lastToken = NUMBER;
        commaPending = false;
        return true;
    }

    private boolean readLiteral(byte[] literal, TokenType type) {
        int available = Math.min(end - pos, literal.length);
        for (int i = 0; i < available; i++) {
            if (buf[pos + i] != literal[i]) {
                throw syntaxError("Invalid literal, expected '%s'".formatted(new String(literal, StandardCharsets.US_ASCII)), pos + i);
            }
        }
        if (available < literal.length) {
            return incomplete("Unexpected end of data in literal", pos);
        }
        setToken(type, pos, pos, pos + literal.length, false);
        pos += literal.length;
        lastToken = type;
        commaPending = false;
        return true;
    }

    private boolean readEnd(TokenType type) {
        setToken(type, pos, pos, pos + 1, false);
        pos++;
        depth--;
        lastToken = type;
        commaPending = false;
        return true;
    }

    private boolean endOfData() {
        if (!isFinalBlock) {
            return false;
        }
        if (depth > 0) {
            throw syntaxError("Unexpected end of data, expected '%c'".formatted(isObject(depth) ? '}' : ']'), pos);
        }
        if (lastToken == NONE) {
            throw syntaxError("The input does not contain any JSON tokens", pos);
        }
        return false;
    }

    private boolean incomplete(String message, int index) {
        if (isFinalBlock) {
            throw syntaxError(message, index);
        }
        return false;
    }

    private boolean skipByteOrderMark() {
        if (pos >= end || buf[pos] != (byte) 0xEF) {
            return true;
        }
        if (end - pos < 3) {
            return incomplete("Incomplete byte order mark", pos);
        }
        if (buf[pos + 1] == (byte) 0xBB && buf[pos + 2] == (byte) 0xBF) {
            pos += 3;
        }
        return true;
    }

    private int scanString(int quotePos) {
        try {
            return stringParser.scan(quotePos, end, escapes);
        } catch (StringParser.MalformedStringException e) {
            throw syntaxError(e.getMessage(), e.getIndex());
        }
    }

    private int scanComment(int slashPos) {
        if (slashPos + 1 >= end) {
            return INCOMPLETE;
        }
        byte kind = buf[slashPos + 1];
        if (kind == '/') {
            for (int i = slashPos + 2; i < end; i++) {
                if (buf[i] == '\n' || buf[i] == '\r') {
                    return i;
                }
            }
            return isFinalBlock ? end : INCOMPLETE;
        }
        if (kind == '*') {
            for (int i = slashPos + 2; i + 1 < end; i++) {
                if (buf[i] == '*' && buf[i + 1] == '/') {
                    return i + 2;
                }
            }
            return INCOMPLETE;
        }
        throw syntaxError("Invalid comment start " + describe(kind), slashPos + 1);
    }

    private void skipWhitespace() {
        pos = skipWhitespaceFrom(pos);
    }

    private int skipWhitespaceFrom(int p) {
        while (p < end) {
            byte b = buf[p];
            if (b == '\n') {
                lineNumber++;
                lineStart = absolute(p + 1);
            } else if (b != ' ' && b != '\t' && b != '\r') {
                break;
            }
            p++;
        }
        return p;
    }

    private void countLines(int from, int to) {
        for (int i = from; i < to; i++) {
            if (buf[i] == '\n') {
                lineNumber++;
                lineStart = absolute(i + 1);
            }
        }
    }

    private void push(boolean isObject) {
        if (depth >= maxDepth) {
            throw syntaxError("Maximum depth of %d exceeded".formatted(maxDepth), pos);
        }
        int word = depth >>> 6;
        if (word >= containers.length) {
            containers = Arrays.copyOf(containers, word + 1);
        }
        long bit = 1L << (depth & 63);
        if (isObject) {
            containers[word] |= bit;
        } else {
            containers[word] &= ~bit;
        }
        depth++;
    }

    private boolean isObject(int atDepth) {
        int index = atDepth - 1;
        return (containers[index >>> 6] & (1L << (index & 63))) != 0;
    }

    private void setToken(TokenType type, int tokenStart, int valueStart, int valueEnd, boolean escaped) {
        this.tokenType = type;
        this.tokenStart = tokenStart;
        this.valueStart = valueStart;
        this.valueEnd = valueEnd;
        this.valueEscaped = escaped;
    }

    private long absolute(int index) {
        return baseOffset + (index - start);
    }

    private JsonSyntaxException syntaxError(String message, int index) {
        long offset = absolute(index);
        return new JsonSyntaxException(message, offset, lineNumber, offset - lineStart);
    }

    private static String describe(byte b) {
        int value = b & 0xFF;
        if (value >= 0x20 && value < 0x7F) {
            return "'" + (char) value + "'";
        }
        return "0x%02X".formatted(value);
    }
}
