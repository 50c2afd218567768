package rocq.indexer.scan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import rocq.indexer.model.Ids;

/**
 * Stack of open {@code Section} scopes for one file.
 * The implicit {@code Top-level} entry is never popped; {@code End} names are not validated.
 */
public final class SectionTracker {

    static final Pattern SECTION_START = Pattern.compile("^\\s*Section\\s+(\\w+)\\s*\\.",
            Pattern.UNICODE_CHARACTER_CLASS);
    static final Pattern SECTION_END = Pattern.compile("^\\s*End\\s+(\\w+)\\s*\\.",
            Pattern.UNICODE_CHARACTER_CLASS);

    private final Deque<String> stack = new ArrayDeque<>();

    public SectionTracker() {
        stack.push(Ids.TOP_LEVEL);
    }

    /**
     * Applies a scope marker on {@code line}, if any.
     *
     * @return true if the line opened or closed a scope
     */
    public boolean accept(String line) {
        final Matcher start = SECTION_START.matcher(line);
        if (start.lookingAt()) {
            open(start.group(1));
            return true;
        }
        if (SECTION_END.matcher(line).lookingAt()) {
            close();
            return true;
        }
        return false;
    }

    public void open(String name) {
        stack.push(name);
    }

    public void close() {
        if (stack.size() > 1) {
            stack.pop();
        }
    }

    public String current() {
        return stack.peek();
    }

    public int depth() {
        return stack.size();
    }
}
